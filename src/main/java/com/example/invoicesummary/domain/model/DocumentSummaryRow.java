package com.example.invoicesummary.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Document-level summary line: one per selected invoice or credit note.
 */
public record DocumentSummaryRow(
        String documentNumber,
        String supplier,
        LocalDate documentDate,
        LocalDate dueDate,
        BigDecimal payableAmount,
        String currency,
        boolean creditNote
) {
}
