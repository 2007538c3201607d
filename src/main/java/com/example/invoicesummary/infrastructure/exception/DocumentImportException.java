package com.example.invoicesummary.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals a document file or directory could not be read.
 */
public class DocumentImportException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from the file system or Jackson.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level exception
	 */
    public DocumentImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
