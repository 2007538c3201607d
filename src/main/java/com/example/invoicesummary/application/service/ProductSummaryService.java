package com.example.invoicesummary.application.service;

import com.example.invoicesummary.domain.exception.DocumentProcessingException;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.DocumentFailure;
import com.example.invoicesummary.domain.model.DocumentFilter;
import com.example.invoicesummary.domain.model.DocumentLoadResult;
import com.example.invoicesummary.domain.model.ProductSummary;
import com.example.invoicesummary.domain.model.ReconciliationSettings;
import com.example.invoicesummary.domain.model.ReconciliationWarning;
import com.example.invoicesummary.domain.model.ResultRow;
import com.example.invoicesummary.domain.reconciliation.DocumentReconciler;
import com.example.invoicesummary.domain.reconciliation.DocumentReconciliation;
import com.example.invoicesummary.domain.selection.DocumentSelector;
import com.example.invoicesummary.infrastructure.store.InMemoryDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Application-layer service that builds the per-product breakdown of the stored documents.
 * Each selected document is reconciled on its own; a document that fails is reported and skipped while
 * the rest of the batch still produces rows.
 */
@Service
public class ProductSummaryService {

    private static final Logger log = LoggerFactory.getLogger(ProductSummaryService.class);

    private final InMemoryDocumentStore documentStore;
    private final DocumentSelector documentSelector;
    private final DocumentReconciler documentReconciler;
    private final ReconciliationSettings settings;

    /**
     * Creates the service with the store, the selection and reconciliation engine, and the configured settings.
     *
     * @param documentStore      source of the documents
     * @param documentSelector   filter applied before reconciliation
     * @param documentReconciler per-document pipeline
     * @param settings           precision and tolerance
     */
    public ProductSummaryService(InMemoryDocumentStore documentStore,
                                 DocumentSelector documentSelector,
                                 DocumentReconciler documentReconciler,
                                 ReconciliationSettings settings) {
        this.documentStore = documentStore;
        this.documentSelector = documentSelector;
        this.documentReconciler = documentReconciler;
        this.settings = settings;
    }

    /**
     * Summarizes the stored documents matching the filter.
     * Documents that could not be loaded are reported as failures whatever the filter, since their fields are unknown.
     *
     * @param filter validated selection criteria
     * @return rows in document order plus warnings and failures
     */
    public ProductSummary summarize(DocumentFilter filter) {
        List<DocumentLoadResult> stored = documentStore.loadAll();
        List<DocumentFailure> loadFailures = stored.stream()
                .filter(entry -> !entry.isLoaded())
                .map(entry -> new DocumentFailure(entry.source(), null, "DOCUMENT_LOAD_ERROR", entry.failure()))
                .toList();
        List<Document> documents = documentSelector.select(
                stored.stream().filter(DocumentLoadResult::isLoaded).map(DocumentLoadResult::document).toList(),
                filter);
        log.debug("Product summary: {} of {} stored document(s) selected by {}", documents.size(), stored.size(), filter);

        ProductSummary summary = buildSummary(documents, settings);
        if (loadFailures.isEmpty()) {
            return summary;
        }
        List<DocumentFailure> failures = new ArrayList<>(loadFailures);
        failures.addAll(summary.failures());
        return new ProductSummary(summary.rows(), summary.warnings(), failures);
    }

    /**
     * Reconciles already selected documents with explicit settings.
     *
     * @param documents documents in the order the rows should come out
     * @param settings  precision, tolerance and parallelism
     * @return rows in document order plus warnings and failures
     */
    public ProductSummary buildSummary(List<Document> documents, ReconciliationSettings settings) {
        Stream<Document> stream = settings.parallel() ? documents.parallelStream() : documents.stream();
        List<DocumentOutcome> outcomes = stream
                .map(document -> process(document, settings))
                .toList();

        List<ResultRow> rows = new ArrayList<>();
        List<ReconciliationWarning> warnings = new ArrayList<>();
        List<DocumentFailure> failures = new ArrayList<>();
        for (DocumentOutcome outcome : outcomes) {
            rows.addAll(outcome.rows());
            if (outcome.warning() != null) {
                warnings.add(outcome.warning());
            }
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            }
        }
        return new ProductSummary(rows, warnings, failures);
    }

    private DocumentOutcome process(Document document, ReconciliationSettings settings) {
        try {
            DocumentReconciliation reconciliation = documentReconciler.reconcile(document, settings);
            log.debug("Document {}: {} row(s), allocation {}, residual {}", document.documentNumber(),
                    reconciliation.rows().size(), reconciliation.pass(), reconciliation.correction().residual());
            ReconciliationWarning warning = null;
            if (reconciliation.correction().toleranceExceeded()) {
                warning = new ReconciliationWarning(document.documentNumber(), document.supplierName(),
                        reconciliation.correction().residual(), reconciliation.correction().tolerance());
            }
            return new DocumentOutcome(reconciliation.rows(), warning, null);
        } catch (DocumentProcessingException ex) {
            log.warn("Skipping document {} from {}: {}", document.documentNumber(), document.supplierName(), ex.getMessage());
            DocumentFailure failure = new DocumentFailure(document.documentNumber(), document.supplierName(),
                    ex.getErrorCode(), ex.getMessage());
            return new DocumentOutcome(List.of(), null, failure);
        }
    }

    private record DocumentOutcome(List<ResultRow> rows, ReconciliationWarning warning, DocumentFailure failure) {
    }
}
