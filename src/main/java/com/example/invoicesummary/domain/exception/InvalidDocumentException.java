package com.example.invoicesummary.domain.exception;

/**
 * Raised when a document lacks a header field the summary depends on.
 * Rejected up front by the store; recorded per document when it reaches the engine directly.
 */
public class InvalidDocumentException extends DocumentProcessingException {

	/**
	 * @param documentNumber number of the rejected document, may be {@code null}
	 * @param field          name of the missing field
	 */
    public InvalidDocumentException(String documentNumber, String field) {
        super("INVALID_DOCUMENT", "Document " + (documentNumber != null ? documentNumber : "<unnumbered>") + " is missing " + field + ".");
    }
}
