package com.example.invoicesummary.domain.reconciliation;

import java.math.BigDecimal;

/**
 * Residual placed by the {@link ReconciliationCorrector} and whether it exceeded the tolerance.
 */
public record CorrectionResult(
        BigDecimal residual,
        BigDecimal tolerance,
        boolean toleranceExceeded
) {
}
