package com.example.invoicesummary.domain.reconciliation;

/**
 * Which allocation, if any, was applied to a document.
 */
public enum AllocationPass {
    /** Discount proxy lines were spread over the product lines. */
    DISCOUNT_PROXY,
    /** The document-level discount was spread because line-level discounts did not reconcile. */
    DOCUMENT_DISCOUNT,
    NONE
}
