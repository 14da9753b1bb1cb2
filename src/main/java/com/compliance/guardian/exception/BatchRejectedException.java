package com.compliance.guardian.exception;

import java.util.List;

/**
 * The batch as a whole lacks required columns; nothing from it is imported.
 */
public class BatchRejectedException extends GuardianException {

    private final List<String> missingColumns;

    public BatchRejectedException(List<String> missingColumns) {
        super("Batch rejected, missing required columns: " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
