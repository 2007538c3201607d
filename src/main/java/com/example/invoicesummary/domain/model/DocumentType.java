package com.example.invoicesummary.domain.model;

/**
 * Closed set of commercial document kinds handled by the summary.
 * Both kinds share the same field layout; credit notes arrive with their monetary fields already signed negative.
 */
public enum DocumentType {
    INVOICE,
    CREDIT_NOTE;

    /**
     * @return {@code true} for credit notes
     */
    public boolean isCreditNote() {
        return this == CREDIT_NOTE;
    }
}
