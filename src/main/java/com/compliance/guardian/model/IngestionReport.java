package com.compliance.guardian.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {
    private int totalRows;
    private int accepted;
    private int skipped;
    @Builder.Default
    private List<SkipReason> skipReasons = new ArrayList<>();
}
