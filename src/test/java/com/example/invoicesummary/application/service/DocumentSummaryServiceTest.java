package com.example.invoicesummary.application.service;

import com.example.invoicesummary.domain.model.DocumentFilter;
import com.example.invoicesummary.domain.model.DocumentSummaryRow;
import com.example.invoicesummary.domain.model.DocumentType;
import com.example.invoicesummary.domain.selection.DocumentSelector;
import com.example.invoicesummary.infrastructure.store.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.example.invoicesummary.domain.TestDocuments.document;
import static com.example.invoicesummary.domain.TestDocuments.line;
import static org.assertj.core.api.Assertions.assertThat;

class DocumentSummaryServiceTest {

    private final InMemoryDocumentStore store = new InMemoryDocumentStore();
    private final DocumentSummaryService service = new DocumentSummaryService(store, new DocumentSelector());

    @Test
    void rowsAreSortedByDateThenNumber() {
        store.saveAll(List.of(
                document(DocumentType.INVOICE, "ACME Corp SRL", "INV-2", LocalDate.of(2024, 2, 1), "10", "10", null,
                        line("1", "1", "10", "10", "Pen")),
                document(DocumentType.CREDIT_NOTE, "ACME Corp SRL", "CN-1", LocalDate.of(2024, 2, 1), "-5", "-5", null,
                        line("1", "-1", "5", "-5", "Pen")),
                document(DocumentType.INVOICE, "Globex", "INV-1", LocalDate.of(2024, 1, 15), "20", "20", null,
                        line("1", "2", "10", "20", "Pen"))
        ));

        List<DocumentSummaryRow> rows = service.summarize(DocumentFilter.none());

        assertThat(rows).extracting(DocumentSummaryRow::documentNumber).containsExactly("INV-1", "CN-1", "INV-2");
        assertThat(rows.get(1).creditNote()).isTrue();
        assertThat(rows.get(1).payableAmount()).isEqualByComparingTo("-5");
        assertThat(rows.get(1).dueDate()).isEqualTo(LocalDate.of(2024, 3, 2));
        assertThat(rows.get(1).currency()).isEqualTo("RON");
    }

    @Test
    void appliesSupplierFilter() {
        store.saveAll(List.of(
                document(DocumentType.INVOICE, "ACME Corp SRL", "INV-2", LocalDate.of(2024, 2, 1), "10", "10", null,
                        line("1", "1", "10", "10", "Pen")),
                document(DocumentType.INVOICE, "Globex", "INV-1", LocalDate.of(2024, 1, 15), "20", "20", null,
                        line("1", "2", "10", "20", "Pen"))
        ));

        List<DocumentSummaryRow> rows = service.summarize(new DocumentFilter("glob*", null, null, null));

        assertThat(rows).extracting(DocumentSummaryRow::supplier).containsExactly("Globex");
    }
}
