package com.compliance.guardian.model;

import java.util.List;

public record NormalizedBatch(List<NormalizedRow> rows, IngestionReport report) {

    public List<Email> emails() {
        return rows.stream().map(NormalizedRow::email).toList();
    }
}
