package com.example.invoicesummary.domain.reconciliation;

import com.example.invoicesummary.domain.model.DocumentLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Separates genuine product lines from discounts encoded as negative-quantity pseudo-products.
 */
public class DiscountClassifier {

    private static final List<String> DISCOUNT_KEYWORDS = List.of("discount", "reducere");

    public ClassifiedLines classify(List<LineComputation> lines) {
        List<LineComputation> products = new ArrayList<>();
        List<LineComputation> discounts = new ArrayList<>();
        for (LineComputation computation : lines) {
            if (isDiscountProxy(computation.line())) {
                discounts.add(computation);
            } else {
                products.add(computation);
            }
        }
        return new ClassifiedLines(products, discounts);
    }

    /**
     * A line is a discount proxy when its quantity is negative and its name mentions a discount.
     * Line-level discount fields play no part in the decision.
     *
     * @param line line to inspect
     * @return {@code true} for discount proxies
     */
    public boolean isDiscountProxy(DocumentLine line) {
        if (line.quantity() == null || line.quantity().signum() >= 0 || line.itemName() == null) {
            return false;
        }
        String name = line.itemName().toLowerCase(Locale.ROOT);
        return DISCOUNT_KEYWORDS.stream().anyMatch(name::contains);
    }
}
