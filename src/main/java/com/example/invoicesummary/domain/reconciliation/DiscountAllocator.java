package com.example.invoicesummary.domain.reconciliation;

import com.example.invoicesummary.domain.exception.UnallocatableDiscountException;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.ReconciliationSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Spreads discount amounts over the product lines of a document, weighted by the absolute line amount.
 * Absolute weights keep invoice and credit-note lines of one document from cancelling each other out.
 */
public class DiscountAllocator {

    private static final Logger log = LoggerFactory.getLogger(DiscountAllocator.class);

    /**
     * Runs at most one allocation pass on the product entries.
     * Discount proxies take precedence; the document-level discount is only a fallback for documents whose
     * line-level figures do not already add up to the invoice total.
     *
     * @param document   document being processed
     * @param classified lines of the document
     * @param settings   precision and tolerance
     * @return the pass that was applied
     * @throws UnallocatableDiscountException when a discount must be spread but every product line is zero
     */
    public AllocationPass allocate(Document document, ClassifiedLines classified, ReconciliationSettings settings) {
        List<LineComputation> products = classified.productEntries();

        if (classified.hasDiscountEntries()) {
            BigDecimal specialDiscount = classified.discountEntries().stream()
                    .map(LineComputation::netAfterLineDiscount)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            log.debug("Document {}: spreading {} from {} discount line(s) over {} product line(s)",
                    document.documentNumber(), specialDiscount, classified.discountEntries().size(), products.size());
            distribute(document, specialDiscount, products);
            return AllocationPass.DISCOUNT_PROXY;
        }

        BigDecimal documentDiscount = document.documentLevelDiscountMagnitude();
        if (documentDiscount.signum() == 0 || document.totalInvoice() == null) {
            return AllocationPass.NONE;
        }

        BigDecimal lineTotal = products.stream()
                .map(entry -> entry.netAfterLineDiscount().add(entry.vatValue()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal gap = document.totalInvoice().subtract(lineTotal).abs();
        BigDecimal tolerance = settings.toleranceFor(products.size());
        if (gap.compareTo(tolerance) <= 0) {
            log.debug("Document {}: line-level figures already match invoice total {}, document discount {} not applied",
                    document.documentNumber(), document.totalInvoice(), documentDiscount);
            return AllocationPass.NONE;
        }

        BigDecimal signedDiscount = documentDiscount.negate().multiply(BigDecimal.valueOf(direction(document, products)));
        log.debug("Document {}: line total {} differs from invoice total {} by {}, spreading document discount {}",
                document.documentNumber(), lineTotal, document.totalInvoice(), gap, signedDiscount);
        distribute(document, signedDiscount, products);
        return AllocationPass.DOCUMENT_DISCOUNT;
    }

    /**
     * Spreads {@code amount} proportionally to {@code |rawAmount|}. The last entry takes the remainder so the
     * shares add up to {@code amount} exactly.
     */
    private void distribute(Document document, BigDecimal amount, List<LineComputation> products) {
        BigDecimal weightSum = products.stream()
                .map(entry -> entry.rawAmount().abs())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (weightSum.signum() == 0) {
            throw new UnallocatableDiscountException(document.documentNumber());
        }

        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < products.size(); i++) {
            LineComputation entry = products.get(i);
            BigDecimal share;
            if (i == products.size() - 1) {
                share = amount.subtract(allocated);
            } else {
                share = amount.multiply(entry.rawAmount().abs()).divide(weightSum, MathContext.DECIMAL128);
                allocated = allocated.add(share);
            }
            entry.allocate(share);
        }
    }

    private int direction(Document document, List<LineComputation> products) {
        if (document.totalInvoice().signum() != 0) {
            return document.totalInvoice().signum();
        }
        int rawSign = products.stream()
                .map(LineComputation::rawAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .signum();
        return rawSign != 0 ? rawSign : 1;
    }
}
