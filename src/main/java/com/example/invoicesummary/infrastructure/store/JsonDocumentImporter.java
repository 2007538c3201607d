package com.example.invoicesummary.infrastructure.store;

import com.example.invoicesummary.domain.exception.InvalidDocumentException;
import com.example.invoicesummary.domain.model.Document;
import com.example.invoicesummary.infrastructure.config.DocumentImportProperties;
import com.example.invoicesummary.infrastructure.exception.DocumentImportException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads documents stored as JSON files (one document per file) into the {@link InMemoryDocumentStore}.
 * Files that cannot be read are recorded in the store so the summaries report them.
 */
@Component
public class JsonDocumentImporter {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentImporter.class);
    private static final String JSON_SUFFIX = ".json";

    private final ObjectMapper objectMapper;
    private final InMemoryDocumentStore store;
    private final DocumentImportProperties properties;

    public JsonDocumentImporter(ObjectMapper objectMapper, InMemoryDocumentStore store, DocumentImportProperties properties) {
        this.objectMapper = objectMapper;
        this.store = store;
        this.properties = properties;
    }

    /**
     * Imports the configured directory once the application is ready.
     * An unreadable directory is recorded as a load failure, like an unreadable file, and does not stop the application.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void importConfiguredDirectory() {
        if (properties == null || properties.directory() == null || properties.directory().isBlank()) {
            return;
        }
        String directory = properties.directory().trim();
        try {
            int imported = importDirectory(Path.of(directory));
            log.info("Imported {} document(s) from {}", imported, directory);
        } catch (DocumentImportException | InvalidPathException ex) {
            log.warn("Document import from {} failed: {}", directory, ex.getMessage());
            store.recordFailure(directory, ex.getMessage());
        }
    }

    /**
     * Reads every {@code *.json} file of a directory, in file name order.
     *
     * @param directory folder to scan
     * @return number of documents stored
     * @throws DocumentImportException when the directory itself cannot be listed
     */
    public int importDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new DocumentImportException("Unable to list documents in " + directory, e);
        }

        int imported = 0;
        for (Path file : files) {
            String source = file.getFileName().toString();
            try {
                store.save(readDocument(file));
                imported++;
            } catch (DocumentImportException | InvalidDocumentException ex) {
                log.warn("Skipping {}: {}", source, ex.getMessage());
                store.recordFailure(source, ex.getMessage());
            }
        }
        return imported;
    }

    /**
     * @param file JSON file holding one document
     * @return parsed document
     * @throws DocumentImportException when the file is unreadable or not a document
     */
    Document readDocument(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), Document.class);
        } catch (IOException e) {
            throw new DocumentImportException("Unable to read document " + file.getFileName(), e);
        }
    }
}
