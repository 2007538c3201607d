package com.example.invoicesummary.infrastructure.store;

import com.example.invoicesummary.domain.exception.InvalidDocumentException;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.DocumentLoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keeps registered documents, and the import files that could not be read, in insertion order.
 * A document with the same supplier and number replaces the earlier one in place.
 */
@Repository
public class InMemoryDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, DocumentLoadResult> entries = new LinkedHashMap<>();

    /**
     * Validates and stores a document.
     *
     * @param document parsed document
     * @throws InvalidDocumentException when a required header field is missing
     */
    public void save(Document document) {
        saveAll(Collections.singletonList(document));
    }

    /**
     * Validates every document first, then stores them in the given order.
     * Nothing is stored when one of them is invalid.
     *
     * @param documents parsed documents
     * @throws InvalidDocumentException when a required header field is missing
     */
    public void saveAll(List<Document> documents) {
        documents.forEach(this::validate);
        synchronized (entries) {
            for (Document document : documents) {
                DocumentLoadResult previous = entries.put(keyOf(document), DocumentLoadResult.loaded(document.documentNumber(), document));
                if (previous != null) {
                    log.debug("Replaced stored document {} from {}", document.documentNumber(), document.supplierName());
                }
            }
        }
    }

    /**
     * Remembers a source that could not be turned into a document.
     *
     * @param source  file name or other origin
     * @param message reason reported in the summaries
     */
    public void recordFailure(String source, String message) {
        synchronized (entries) {
            entries.put("failure:" + source, DocumentLoadResult.failed(source, message));
        }
    }

    /**
     * @return every stored entry, loaded or failed, in insertion order
     */
    public List<DocumentLoadResult> loadAll() {
        synchronized (entries) {
            return List.copyOf(entries.values());
        }
    }

    /**
     * @return successfully loaded documents in insertion order
     */
    public List<Document> findAll() {
        List<Document> documents = new ArrayList<>();
        for (DocumentLoadResult entry : loadAll()) {
            if (entry.isLoaded()) {
                documents.add(entry.document());
            }
        }
        return documents;
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    private String keyOf(Document document) {
        return "document:" + document.supplierName().trim().toLowerCase(Locale.ROOT)
                + "|" + document.documentNumber().trim().toLowerCase(Locale.ROOT);
    }

    private void validate(Document document) {
        if (document == null) {
            throw new InvalidDocumentException(null, "its content");
        }
        if (isBlank(document.documentNumber())) {
            throw new InvalidDocumentException(null, "the document number");
        }
        if (isBlank(document.supplierName())) {
            throw new InvalidDocumentException(document.documentNumber(), "the supplier name");
        }
        if (document.documentDate() == null) {
            throw new InvalidDocumentException(document.documentNumber(), "the document date");
        }
        if (document.totalPayable() == null) {
            throw new InvalidDocumentException(document.documentNumber(), "the payable amount");
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
