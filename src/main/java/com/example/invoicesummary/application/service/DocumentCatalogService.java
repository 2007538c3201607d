package com.example.invoicesummary.application.service;

import com.example.invoicesummary.application.exception.UseCaseValidationException;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.infrastructure.store.InMemoryDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that registers parsed documents for later summaries.
 */
@Service
public class DocumentCatalogService {

    private static final Logger log = LoggerFactory.getLogger(DocumentCatalogService.class);

    private final InMemoryDocumentStore documentStore;

    public DocumentCatalogService(InMemoryDocumentStore documentStore) {
        this.documentStore = documentStore;
    }

	/**
	 * Stores the documents in the given order.
	 *
	 * @param documents parsed invoices and credit notes
	 * @return number of documents stored
	 * @throws UseCaseValidationException when the request holds no document
	 */
    public int register(List<Document> documents) {
        if (documents == null || documents.isEmpty()) {
            throw new UseCaseValidationException("Please submit at least one document.");
        }
        documentStore.saveAll(documents);
        log.debug("Registered {} document(s)", documents.size());
        return documents.size();
    }
}
