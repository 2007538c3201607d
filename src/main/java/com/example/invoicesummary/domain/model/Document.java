package com.example.invoicesummary.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Domain DTO for an invoice or credit note whose XML has already been parsed and validated.
 * The line order is significant: it is kept in the output and decides where the rounding residual lands.
 */
public record Document(
        DocumentType type,
        String supplierName,
        String documentNumber,
        LocalDate documentDate,
        LocalDate dueDate,
        String currency,
        BigDecimal totalInvoice,
        BigDecimal totalPayable,
        BigDecimal documentLevelDiscount,
        List<DocumentLine> lines
) {

    public static final String DEFAULT_CURRENCY = "RON";

    public Document {
        type = type == null ? DocumentType.INVOICE : type;
        currency = currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency.trim();
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * @return the document-level discount as a non-negative magnitude, zero when the document states none
     */
    public BigDecimal documentLevelDiscountMagnitude() {
        return documentLevelDiscount == null ? BigDecimal.ZERO : documentLevelDiscount.abs();
    }
}
