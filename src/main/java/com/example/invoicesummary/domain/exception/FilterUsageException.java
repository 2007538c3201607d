package com.example.invoicesummary.domain.exception;

/**
 * Raised when the selection criteria are inconsistent, e.g. only one end of the date range is given.
 * Thrown before any document is touched.
 */
public class FilterUsageException extends DomainException {

    public FilterUsageException(String message) {
        super(message);
    }
}
