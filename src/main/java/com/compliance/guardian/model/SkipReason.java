package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Why an input row was not imported. Row numbers are 1-based.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkipReason {
    private int rowNumber;
    private String reason;
}
