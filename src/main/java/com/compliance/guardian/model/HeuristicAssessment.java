package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Keyword and attachment risk assessment used when no classifier model is active.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeuristicAssessment {
    // Raw point total; exclusion keywords can push it below zero
    private int points;
    private double riskScore;
    private Category category;
    private boolean whitelisted;
    @Builder.Default
    private List<String> riskFactors = new ArrayList<>();
}
