package com.example.invoicesummary.domain.model;

import com.example.invoicesummary.domain.exception.FilterUsageException;

import java.time.LocalDate;

/**
 * Selection criteria applied before documents enter the computation pipeline.
 * Patterns are glob-style ({@code *}, {@code ?}) and anchored to the whole field; {@code null} matches everything.
 * The date range is inclusive and must be supplied as a pair.
 */
public record DocumentFilter(
        String supplierName,
        String invoiceNumber,
        LocalDate startDate,
        LocalDate endDate
) {

    private static final DocumentFilter NONE = new DocumentFilter(null, null, null, null);

    public DocumentFilter {
        supplierName = blankToNull(supplierName);
        invoiceNumber = blankToNull(invoiceNumber);
        if ((startDate == null) != (endDate == null)) {
            throw new FilterUsageException("Both start date and end date must be supplied together.");
        }
        if (startDate != null && startDate.isAfter(endDate)) {
            throw new FilterUsageException("Start date " + startDate + " must be before or equal to end date " + endDate + ".");
        }
    }

    /**
     * @return filter that selects every stored document
     */
    public static DocumentFilter none() {
        return NONE;
    }

    public boolean hasDateRange() {
        return startDate != null;
    }

    public boolean hasCriteria() {
        return supplierName != null || invoiceNumber != null || hasDateRange();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
