package com.example.invoicesummary.domain.reconciliation;

import com.example.invoicesummary.domain.exception.InvalidDocumentException;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.DocumentLine;
import com.example.invoicesummary.domain.model.ReconciliationSettings;
import com.example.invoicesummary.domain.model.ResultRow;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one document through line computation, classification, allocation and correction.
 * Stateless: every call works on its own {@link LineComputation} list, so documents can be reconciled concurrently.
 */
public class DocumentReconciler {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int RATE_SCALE = 2;

    private final LineCalculator lineCalculator;
    private final DiscountClassifier discountClassifier;
    private final DiscountAllocator discountAllocator;
    private final ReconciliationCorrector reconciliationCorrector;

    public DocumentReconciler() {
        this(new LineCalculator(), new DiscountClassifier(), new DiscountAllocator(), new ReconciliationCorrector());
    }

    public DocumentReconciler(LineCalculator lineCalculator,
                              DiscountClassifier discountClassifier,
                              DiscountAllocator discountAllocator,
                              ReconciliationCorrector reconciliationCorrector) {
        this.lineCalculator = lineCalculator;
        this.discountClassifier = discountClassifier;
        this.discountAllocator = discountAllocator;
        this.reconciliationCorrector = reconciliationCorrector;
    }

    /**
     * @param document parsed document
     * @param settings precision and tolerance
     * @return product rows in document order plus the correction applied
     * @throws com.example.invoicesummary.domain.exception.DocumentProcessingException when the document cannot be reconciled
     */
    public DocumentReconciliation reconcile(Document document, ReconciliationSettings settings) {
        if (document.totalPayable() == null) {
            throw new InvalidDocumentException(document.documentNumber(), "the payable amount");
        }

        List<LineComputation> computations = new ArrayList<>(document.lines().size());
        for (DocumentLine line : document.lines()) {
            computations.add(lineCalculator.compute(line, settings));
        }

        ClassifiedLines classified = discountClassifier.classify(computations);
        AllocationPass pass = discountAllocator.allocate(document, classified, settings);
        CorrectionResult correction = reconciliationCorrector.correct(document, classified.productEntries(), settings);

        List<ResultRow> rows = classified.productEntries().stream()
                .map(entry -> toRow(document, entry, correction, settings))
                .toList();
        return new DocumentReconciliation(rows, pass, correction);
    }

    private ResultRow toRow(Document document,
                            LineComputation entry,
                            CorrectionResult correction,
                            ReconciliationSettings settings) {
        DocumentLine line = entry.line();
        BigDecimal discount = entry.totalDiscount();
        return new ResultRow(
                document.supplierName(),
                document.documentNumber(),
                document.documentDate(),
                document.type(),
                document.currency(),
                document.totalInvoice(),
                document.totalPayable(),
                productName(line),
                line.itemCode() != null && !line.itemCode().isBlank() ? line.itemCode().trim() : null,
                line.quantity(),
                line.unitCode(),
                line.unitPrice(),
                settings.round(line.rawAmount()),
                line.vatRate(),
                entry.finalVat(),
                discountRate(discount, line.rawAmount()),
                settings.round(discount),
                entry.finalNet(),
                entry.finalTotal(),
                correction.toleranceExceeded()
        );
    }

    private String productName(DocumentLine line) {
        if (line.itemName() == null || line.itemName().isBlank()) {
            return "Unknown";
        }
        return line.itemName().trim();
    }

    /**
     * @return discount as a percentage of the raw line amount, {@code null} when the line carries no discount
     */
    private BigDecimal discountRate(BigDecimal discount, BigDecimal rawAmount) {
        if (discount.signum() == 0 || rawAmount.signum() == 0) {
            return null;
        }
        return discount.divide(rawAmount.abs(), MathContext.DECIMAL128)
                .multiply(HUNDRED)
                .setScale(RATE_SCALE, RoundingMode.HALF_UP);
    }
}
