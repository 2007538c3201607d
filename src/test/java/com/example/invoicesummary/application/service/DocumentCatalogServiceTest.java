package com.example.invoicesummary.application.service;

import com.example.invoicesummary.application.exception.UseCaseValidationException;
import com.example.invoicesummary.domain.exception.InvalidDocumentException;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.infrastructure.store.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.invoicesummary.domain.TestDocuments.invoice;
import static com.example.invoicesummary.domain.TestDocuments.line;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentCatalogServiceTest {

    private final InMemoryDocumentStore store = new InMemoryDocumentStore();
    private final DocumentCatalogService service = new DocumentCatalogService(store);

    @Test
    void registerRequiresDocuments() {
        assertThrows(UseCaseValidationException.class, () -> service.register(List.of()));
        assertThrows(UseCaseValidationException.class, () -> service.register(null));
    }

    @Test
    void registerStoresDocumentsInOrder() {
        int registered = service.register(List.of(
                invoice("INV-2", "10", "10", line("1", "1", "10", "10", "Pen")),
                invoice("INV-1", "20", "20", line("1", "2", "10", "20", "Pen"))));

        assertThat(registered).isEqualTo(2);
        assertThat(store.findAll()).extracting(Document::documentNumber).containsExactly("INV-2", "INV-1");
    }

    @Test
    void invalidDocumentRejectsTheWholeBatch() {
        List<Document> documents = List.of(
                invoice("INV-1", "10", "10", line("1", "1", "10", "10", "Pen")),
                invoice("INV-2", "10", null, line("1", "1", "10", "10", "Pen")));

        assertThrows(InvalidDocumentException.class, () -> service.register(documents));
        assertThat(store.findAll()).isEmpty();
    }
}
