package com.example.invoicesummary.domain.model;

/**
 * Outcome of loading one document from the store: either the document or the reason it could not be read.
 */
public record DocumentLoadResult(
        String source,
        Document document,
        String failure
) {

    public static DocumentLoadResult loaded(String source, Document document) {
        return new DocumentLoadResult(source, document, null);
    }

    public static DocumentLoadResult failed(String source, String failure) {
        return new DocumentLoadResult(source, null, failure);
    }

    public boolean isLoaded() {
        return document != null;
    }
}
