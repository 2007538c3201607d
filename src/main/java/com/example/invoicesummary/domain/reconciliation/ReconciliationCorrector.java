package com.example.invoicesummary.domain.reconciliation;

import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.ReconciliationSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;

/**
 * Forces the line totals of a document to add up to its payable amount.
 * Every line is rounded once; the single remaining residual goes to the last product entry in document order.
 */
public class ReconciliationCorrector {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationCorrector.class);

    /**
     * @param document document being processed
     * @param products product entries after allocation, in document order
     * @param settings precision and tolerance
     * @return residual that was applied and whether it is larger than rounding noise
     */
    public CorrectionResult correct(Document document, List<LineComputation> products, ReconciliationSettings settings) {
        BigDecimal sum = BigDecimal.ZERO;
        for (LineComputation entry : products) {
            BigDecimal net = settings.round(entry.finalNet());
            BigDecimal vat = LineCalculator.vat(net, entry.vatRate(), settings);
            entry.settle(net, vat);
            sum = sum.add(net).add(vat);
        }

        BigDecimal payable = settings.round(document.totalPayable());
        BigDecimal residual = payable.subtract(sum);
        if (residual.signum() != 0 && !products.isEmpty()) {
            products.get(products.size() - 1).absorbResidual(residual);
        }

        BigDecimal tolerance = settings.toleranceFor(products.size());
        boolean exceeded = residual.abs().compareTo(tolerance) > 0;
        if (exceeded) {
            log.warn("Document {}: residual {} against payable {} exceeds tolerance {}",
                    document.documentNumber(), residual, payable, tolerance);
        } else if (residual.signum() != 0) {
            log.debug("Document {}: rounding residual {} added to the last line", document.documentNumber(), residual);
        }
        return new CorrectionResult(residual, tolerance, exceeded);
    }
}
