package com.example.invoicesummary.domain.model;

/**
 * Records why a document produced no rows.
 *
 * @param source         document number, or the import source when the document could not be loaded at all
 * @param supplierName   supplier of the document, {@code null} for load failures
 * @param errorType      stable error code
 * @param message        human readable reason
 */
public record DocumentFailure(
        String source,
        String supplierName,
        String errorType,
        String message
) {
}
