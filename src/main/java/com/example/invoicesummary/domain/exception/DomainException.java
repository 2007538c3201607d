package com.example.invoicesummary.domain.exception;

/**
 * Base type for failures raised by the reconciliation engine and the selection criteria.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of the rejected document, line or filter
	 */
    protected DomainException(String message) {
        super(message);
    }
}
