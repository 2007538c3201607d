package com.example.invoicesummary.domain.exception;

/**
 * Raised when a single document cannot be turned into summary rows.
 * The product summary records these per document and keeps processing the rest of the batch.
 */
public abstract class DocumentProcessingException extends DomainException {

    private final String errorCode;

    protected DocumentProcessingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * @return stable code reported alongside the failed document
     */
    public String getErrorCode() {
        return errorCode;
    }
}
