package com.example.invoicesummary.application.service;

import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.DocumentFilter;
import com.example.invoicesummary.domain.model.DocumentSummaryRow;
import com.example.invoicesummary.domain.selection.DocumentSelector;
import com.example.invoicesummary.infrastructure.store.InMemoryDocumentStore;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Application-layer service listing the main figures of each selected document.
 */
@Service
public class DocumentSummaryService {

    private static final Comparator<DocumentSummaryRow> BY_DATE_AND_NUMBER = Comparator
            .comparing(DocumentSummaryRow::documentDate)
            .thenComparing(DocumentSummaryRow::documentNumber);

    private final InMemoryDocumentStore documentStore;
    private final DocumentSelector documentSelector;

    public DocumentSummaryService(InMemoryDocumentStore documentStore, DocumentSelector documentSelector) {
        this.documentStore = documentStore;
        this.documentSelector = documentSelector;
    }

	/**
	 * @param filter validated selection criteria
	 * @return one row per matching document, sorted by date then number
	 */
    public List<DocumentSummaryRow> summarize(DocumentFilter filter) {
        return documentSelector.select(documentStore.findAll(), filter).stream()
                .map(this::toRow)
                .sorted(BY_DATE_AND_NUMBER)
                .toList();
    }

    private DocumentSummaryRow toRow(Document document) {
        return new DocumentSummaryRow(
                document.documentNumber(),
                document.supplierName(),
                document.documentDate(),
                document.dueDate(),
                document.totalPayable(),
                document.currency(),
                document.type().isCreditNote()
        );
    }
}
