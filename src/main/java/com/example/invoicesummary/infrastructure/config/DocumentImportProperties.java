package com.example.invoicesummary.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code invoice-summary.import.*}.
 *
 * @param directory folder scanned for {@code *.json} documents at start-up, {@code null} to skip the import
 */
@ConfigurationProperties(prefix = "invoice-summary.import")
public record DocumentImportProperties(String directory) {
}
