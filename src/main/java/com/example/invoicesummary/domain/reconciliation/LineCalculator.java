package com.example.invoicesummary.domain.reconciliation;

import com.example.invoicesummary.domain.exception.MalformedLineException;
import com.example.invoicesummary.domain.model.DocumentLine;
import com.example.invoicesummary.domain.model.ReconciliationSettings;

import java.math.BigDecimal;

/**
 * Converts one raw document line into a {@link LineComputation}.
 */
public class LineCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Validates the line and computes its net amount and VAT.
     * The line-level discount always pulls the line towards zero, whatever sign the source gave it.
     *
     * @param line     line as received from the loading layer
     * @param settings currency precision
     * @return normalized computation
     * @throws MalformedLineException when price, amount or quantity are unusable
     */
    public LineComputation compute(DocumentLine line, ReconciliationSettings settings) {
        if (line.quantity() == null || line.quantity().signum() == 0) {
            throw new MalformedLineException(line.id(), "quantity must be non-zero");
        }
        if (line.unitPrice() == null) {
            throw new MalformedLineException(line.id(), "unit price is missing");
        }
        if (line.unitPrice().signum() < 0) {
            throw new MalformedLineException(line.id(), "unit price " + line.unitPrice() + " is negative");
        }
        if (line.rawAmount() == null) {
            throw new MalformedLineException(line.id(), "line amount is missing");
        }

        BigDecimal discount = line.lineLevelDiscount() == null ? BigDecimal.ZERO : line.lineLevelDiscount().abs();
        BigDecimal direction = BigDecimal.valueOf(line.quantity().signum());
        BigDecimal net = line.rawAmount().subtract(direction.multiply(discount));
        return new LineComputation(line, discount, net, vat(net, line.vatRate(), settings));
    }

    /**
     * Computes VAT for a net amount, rounded half-to-even at currency precision.
     *
     * @param net      net amount
     * @param vatRate  percentage, e.g. {@code 19}
     * @param settings currency precision
     * @return rounded VAT value
     */
    static BigDecimal vat(BigDecimal net, BigDecimal vatRate, ReconciliationSettings settings) {
        return settings.round(net.multiply(vatRate).divide(HUNDRED));
    }
}
