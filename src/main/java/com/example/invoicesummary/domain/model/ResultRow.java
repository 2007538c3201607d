package com.example.invoicesummary.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Domain DTO for one retained product line of a processed document.
 * Each field maps to a summary column so presentation code can remain trivial.
 * {@code lineTotal} is the reconciled, tax-inclusive value attributed to the line; the line totals of one document
 * add up to its {@code totalPayable}.
 * {@code discountValue} counts the line-level discount plus allocated shares that moved the line towards zero.
 * A share pushing the line away from zero, as a proxy discount does on a returned item of a mixed document, is not
 * a discount on that line; it shows up only in {@code finalNet}.
 */
public record ResultRow(
        String supplier,
        String documentNumber,
        LocalDate documentDate,
        DocumentType documentType,
        String currency,
        BigDecimal totalInvoice,
        BigDecimal totalPayable,
        String product,
        String productCode,
        BigDecimal quantity,
        String unitCode,
        BigDecimal unitPrice,
        BigDecimal value,
        BigDecimal vatRate,
        BigDecimal vatValue,
        BigDecimal discountRate,
        BigDecimal discountValue,
        BigDecimal finalNet,
        BigDecimal lineTotal,
        boolean reconciliationWarning
) {
}
