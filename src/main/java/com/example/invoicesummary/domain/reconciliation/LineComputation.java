package com.example.invoicesummary.domain.reconciliation;

import com.example.invoicesummary.domain.model.DocumentLine;

import java.math.BigDecimal;

/**
 * Normalized numeric view of one document line, private to a single reconciliation run.
 * Only {@link DiscountAllocator} and {@link ReconciliationCorrector} move the final figures.
 */
public final class LineComputation {

    private final DocumentLine line;
    private final BigDecimal lineDiscount;
    private final BigDecimal netAfterLineDiscount;
    private final BigDecimal vatValue;
    private BigDecimal allocation = BigDecimal.ZERO;
    private BigDecimal finalNet;
    private BigDecimal finalVat;

    LineComputation(DocumentLine line, BigDecimal lineDiscount, BigDecimal netAfterLineDiscount, BigDecimal vatValue) {
        this.line = line;
        this.lineDiscount = lineDiscount;
        this.netAfterLineDiscount = netAfterLineDiscount;
        this.vatValue = vatValue;
        this.finalNet = netAfterLineDiscount;
        this.finalVat = vatValue;
    }

    public DocumentLine line() {
        return line;
    }

    public BigDecimal quantity() {
        return line.quantity();
    }

    public BigDecimal unitPrice() {
        return line.unitPrice();
    }

    public BigDecimal rawAmount() {
        return line.rawAmount();
    }

    public BigDecimal vatRate() {
        return line.vatRate();
    }

    /**
     * @return line-level discount magnitude, never negative
     */
    public BigDecimal lineDiscount() {
        return lineDiscount;
    }

    public BigDecimal netAfterLineDiscount() {
        return netAfterLineDiscount;
    }

    /**
     * @return VAT on the net amount after the line-level discount
     */
    public BigDecimal vatValue() {
        return vatValue;
    }

    /**
     * @return signed sum of every share allocated onto this line
     */
    public BigDecimal allocation() {
        return allocation;
    }

    public BigDecimal finalNet() {
        return finalNet;
    }

    /**
     * @return VAT on {@link #finalNet()} once the line has been settled by the corrector
     */
    public BigDecimal finalVat() {
        return finalVat;
    }

    public BigDecimal finalTotal() {
        return finalNet.add(finalVat);
    }

    /**
     * Portion of the allocations that reduced the absolute value of the line.
     * Allocations pointing away from zero are charges and do not count as discount.
     *
     * @return non-negative discount magnitude coming from document or proxy discounts
     */
    public BigDecimal allocatedDiscount() {
        int direction = rawAmount().signum() != 0 ? rawAmount().signum() : quantity().signum();
        if (allocation.signum() != 0 && allocation.signum() != direction) {
            return allocation.abs();
        }
        return BigDecimal.ZERO;
    }

    /**
     * @return total discount magnitude attributed to the line
     */
    public BigDecimal totalDiscount() {
        return lineDiscount.add(allocatedDiscount());
    }

    void allocate(BigDecimal share) {
        allocation = allocation.add(share);
        finalNet = netAfterLineDiscount.add(allocation);
    }

    void settle(BigDecimal net, BigDecimal vat) {
        finalNet = net;
        finalVat = vat;
    }

    void absorbResidual(BigDecimal residual) {
        finalNet = finalNet.add(residual);
    }
}
