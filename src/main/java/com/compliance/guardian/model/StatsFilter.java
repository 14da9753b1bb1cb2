package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsFilter {
    private Long fromDate;
    private Long toDate;
    private CaseStatus status;
    private Category category;
}
