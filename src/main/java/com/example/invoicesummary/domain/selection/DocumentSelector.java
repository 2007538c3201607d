package com.example.invoicesummary.domain.selection;

import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.DocumentFilter;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Predicate;

/**
 * Filters a document collection by supplier, invoice number and inclusive date range.
 * Keeps the collection's natural order.
 */
public class DocumentSelector {

    /**
     * @param documents candidate documents
     * @param filter    validated criteria
     * @return matching documents in their original order
     */
    public List<Document> select(List<Document> documents, DocumentFilter filter) {
        return documents.stream()
                .filter(toPredicate(filter))
                .toList();
    }

    /**
     * Builds a predicate for the filter; an empty filter accepts every document.
     *
     * @param filter validated criteria
     * @return document predicate
     */
    public Predicate<Document> toPredicate(DocumentFilter filter) {
        Predicate<Document> predicate = document -> true;
        if (filter.supplierName() != null) {
            WildcardPattern supplier = WildcardPattern.compile(filter.supplierName());
            predicate = predicate.and(document -> supplier.matches(document.supplierName()));
        }
        if (filter.invoiceNumber() != null) {
            WildcardPattern number = WildcardPattern.compile(filter.invoiceNumber());
            predicate = predicate.and(document -> number.matches(document.documentNumber()));
        }
        if (filter.hasDateRange()) {
            LocalDate start = filter.startDate();
            LocalDate end = filter.endDate();
            predicate = predicate.and(document -> document.documentDate() != null
                    && !document.documentDate().isBefore(start)
                    && !document.documentDate().isAfter(end));
        }
        return predicate;
    }
}
