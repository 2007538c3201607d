package com.example.invoicesummary.domain.model;

import java.util.List;

/**
 * Result of a product summary run: rows in document order plus the per-document warnings and failures.
 */
public record ProductSummary(
        List<ResultRow> rows,
        List<ReconciliationWarning> warnings,
        List<DocumentFailure> failures
) {

    public ProductSummary {
        rows = rows == null ? List.of() : List.copyOf(rows);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
