package com.example.invoicesummary.domain.reconciliation;

import java.util.List;

/**
 * Partition of a document's lines into genuine products and discount proxies, both in document order.
 */
public record ClassifiedLines(
        List<LineComputation> productEntries,
        List<LineComputation> discountEntries
) {

    public ClassifiedLines {
        productEntries = List.copyOf(productEntries);
        discountEntries = List.copyOf(discountEntries);
    }

    public boolean hasDiscountEntries() {
        return !discountEntries.isEmpty();
    }
}
