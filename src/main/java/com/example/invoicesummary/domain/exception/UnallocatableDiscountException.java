package com.example.invoicesummary.domain.exception;

/**
 * Raised when a discount has to be spread over the product lines but their weights add up to zero.
 */
public class UnallocatableDiscountException extends DocumentProcessingException {

    public UnallocatableDiscountException(String documentNumber) {
        super("UNALLOCATABLE_DISCOUNT",
                "Cannot allocate discount for document " + documentNumber + ": product lines have no value to weight by.");
    }
}
