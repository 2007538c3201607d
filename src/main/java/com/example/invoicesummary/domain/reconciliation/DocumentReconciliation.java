package com.example.invoicesummary.domain.reconciliation;

import com.example.invoicesummary.domain.model.ResultRow;

import java.util.List;

/**
 * Rows produced for one document together with how they were obtained.
 */
public record DocumentReconciliation(
        List<ResultRow> rows,
        AllocationPass pass,
        CorrectionResult correction
) {

    public DocumentReconciliation {
        rows = List.copyOf(rows);
    }
}
