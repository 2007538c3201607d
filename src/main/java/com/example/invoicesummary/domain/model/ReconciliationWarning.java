package com.example.invoicesummary.domain.model;

import java.math.BigDecimal;

/**
 * Flags a document whose rounding residual was larger than the configured tolerance.
 * Its rows are still emitted and carry {@link ResultRow#reconciliationWarning()}.
 */
public record ReconciliationWarning(
        String documentNumber,
        String supplierName,
        BigDecimal residual,
        BigDecimal tolerance
) {
}
