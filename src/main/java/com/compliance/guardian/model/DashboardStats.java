package com.compliance.guardian.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregate counts for the compliance dashboard")
public class DashboardStats {
    private int totalEmails;
    private int flaggedEmails;
    private int classifiedEmails;
    private int totalCases;
    @Builder.Default
    private Map<String, Integer> casesByStatus = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Integer> emailsByCategory = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Integer> emailsByRiskLevel = new LinkedHashMap<>();
    @Schema(description = "Email counts keyed by ISO date", example = "{\"2024-06-10\": 12}")
    @Builder.Default
    private Map<String, Integer> emailsByDay = new LinkedHashMap<>();
}
