package com.example.invoicesummary.domain.selection;

import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.DocumentFilter;
import com.example.invoicesummary.domain.model.DocumentType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.example.invoicesummary.domain.TestDocuments.document;
import static com.example.invoicesummary.domain.TestDocuments.line;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for supplier, number and date range selection.
 */
class DocumentSelectorTest {

    private final DocumentSelector selector = new DocumentSelector();

    private final Document acmeMarch = stored("ACME Corp SRL", "INV-001", LocalDate.of(2024, 3, 1));
    private final Document otherAcme = stored("Other ACME", "INV-002", LocalDate.of(2024, 3, 31));
    private final Document globexApril = stored("Globex", "CN-010", LocalDate.of(2024, 4, 1));
    private final List<Document> documents = List.of(acmeMarch, otherAcme, globexApril);

    @Test
    void emptyFilterSelectsEverythingInOrder() {
        assertThat(selector.select(documents, DocumentFilter.none()))
                .containsExactly(acmeMarch, otherAcme, globexApril);
    }

    @Test
    void supplierPrefixPattern() {
        DocumentFilter filter = new DocumentFilter("ACME*", null, null, null);

        assertThat(selector.select(documents, filter)).containsExactly(acmeMarch);
    }

    @Test
    void supplierSubstringPattern() {
        DocumentFilter filter = new DocumentFilter("*acme*", null, null, null);

        assertThat(selector.select(documents, filter)).containsExactly(acmeMarch, otherAcme);
    }

    @Test
    void invoiceNumberPattern() {
        DocumentFilter filter = new DocumentFilter(null, "inv-*", null, null);

        assertThat(selector.select(documents, filter)).containsExactly(acmeMarch, otherAcme);
    }

    @Test
    void dateRangeIsInclusive() {
        DocumentFilter filter = new DocumentFilter(null, null, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

        assertThat(selector.select(documents, filter)).containsExactly(acmeMarch, otherAcme);
    }

    @Test
    void criteriaAreCombined() {
        DocumentFilter filter = new DocumentFilter("*ACME*", "INV-002", LocalDate.of(2024, 3, 1), LocalDate.of(2024, 4, 30));

        assertThat(selector.select(documents, filter)).containsExactly(otherAcme);
    }

    private Document stored(String supplier, String number, LocalDate date) {
        return document(DocumentType.INVOICE, supplier, number, date, "10", "10", null,
                line("1", "1", "10", "10", "Pen"));
    }
}
