package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReclassifyResult {
    private int evaluated;
    // emails whose score, category or flag changed
    private int changed;
    private int casesCreated;
    private int reopened;
    private String modelVersion;
}
