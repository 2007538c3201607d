package com.example.invoicesummary.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable configuration handed to the reconciliation engine on every call.
 *
 * @param scale            currency minor-unit precision (number of decimals)
 * @param tolerancePerLine residual accepted per product line before a document is flagged
 * @param tolerance        absolute residual tolerance; overrides {@code tolerancePerLine} when set
 * @param parallel         whether documents may be evaluated concurrently
 */
public record ReconciliationSettings(
        int scale,
        BigDecimal tolerancePerLine,
        BigDecimal tolerance,
        boolean parallel
) {

    public static final int DEFAULT_SCALE = 2;
    public static final BigDecimal DEFAULT_TOLERANCE_PER_LINE = new BigDecimal("0.01");

    public ReconciliationSettings {
        if (scale < 0) {
            throw new IllegalArgumentException("Currency scale must not be negative: " + scale);
        }
        tolerancePerLine = Objects.requireNonNullElse(tolerancePerLine, DEFAULT_TOLERANCE_PER_LINE).abs();
        tolerance = tolerance == null ? null : tolerance.abs();
    }

    public static ReconciliationSettings defaults() {
        return new ReconciliationSettings(DEFAULT_SCALE, DEFAULT_TOLERANCE_PER_LINE, null, false);
    }

    /**
     * Rounds a monetary amount to the currency precision using banker's rounding.
     *
     * @param amount value to round
     * @return rounded value
     */
    public BigDecimal round(BigDecimal amount) {
        return amount.setScale(scale, RoundingMode.HALF_EVEN);
    }

    /**
     * @param lineCount number of product lines in the document
     * @return residual tolerated for a document of that size
     */
    public BigDecimal toleranceFor(int lineCount) {
        if (tolerance != null) {
            return tolerance;
        }
        return tolerancePerLine.multiply(BigDecimal.valueOf(Math.max(lineCount, 1)));
    }
}
