package com.example.invoicesummary.infrastructure.store;

import com.example.invoicesummary.domain.exception.InvalidDocumentException;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.domain.model.DocumentLoadResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.invoicesummary.domain.TestDocuments.invoice;
import static com.example.invoicesummary.domain.TestDocuments.line;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryDocumentStoreTest {

    private final InMemoryDocumentStore store = new InMemoryDocumentStore();

    @Test
    void sameSupplierAndNumberReplacesInPlace() {
        store.save(invoice("INV-1", "10", "10", line("1", "1", "10", "10", "Pen")));
        store.save(invoice("INV-2", "20", "20", line("1", "2", "10", "20", "Pen")));
        store.save(invoice("inv-1", "15", "15", line("1", "1", "15", "15", "Pen")));

        List<Document> documents = store.findAll();

        assertThat(documents).extracting(Document::documentNumber).containsExactly("inv-1", "INV-2");
        assertThat(documents.get(0).totalPayable()).isEqualByComparingTo("15");
    }

    @Test
    void failuresAreKeptAlongsideDocuments() {
        store.save(invoice("INV-1", "10", "10", line("1", "1", "10", "10", "Pen")));
        store.recordFailure("broken.json", "Unable to read document broken.json");

        List<DocumentLoadResult> entries = store.loadAll();

        assertThat(entries).extracting(DocumentLoadResult::isLoaded).containsExactly(true, false);
        assertThat(store.findAll()).hasSize(1);
    }

    @Test
    void rejectsDocumentWithoutSupplier() {
        Document document = new Document(null, " ", "INV-1", null, null, null, null, null, null, null);

        InvalidDocumentException ex = assertThrows(InvalidDocumentException.class, () -> store.save(document));
        assertThat(ex.getMessage()).contains("supplier name");
    }

    @Test
    void rejectsNullDocument() {
        assertThrows(InvalidDocumentException.class, () -> store.save(null));
    }

    @Test
    void clearRemovesEverything() {
        store.save(invoice("INV-1", "10", "10", line("1", "1", "10", "10", "Pen")));
        store.clear();

        assertThat(store.loadAll()).isEmpty();
    }
}
