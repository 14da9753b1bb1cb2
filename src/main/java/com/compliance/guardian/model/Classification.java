package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Classification {
    private double riskScore;
    private Category category;
    // null when no model snapshot was available
    private String modelVersion;
    private boolean fallback;
}
