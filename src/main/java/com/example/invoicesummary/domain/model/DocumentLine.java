package com.example.invoicesummary.domain.model;

import java.math.BigDecimal;

/**
 * Domain DTO describing one priced entry of an invoice or credit note, as handed over by the loading layer.
 * The quantity carries the direction of the line; the unit price is a plain per-unit figure and never signed.
 * The line-level discount is read as a magnitude, its source sign is not trusted.
 */
public record DocumentLine(
        String id,
        BigDecimal quantity,
        BigDecimal unitPrice,
        String unitCode,
        BigDecimal rawAmount,
        String itemName,
        String itemCode,
        BigDecimal vatRate,
        BigDecimal lineLevelDiscount
) {

    public DocumentLine {
        vatRate = vatRate == null ? BigDecimal.ZERO : vatRate;
    }
}
