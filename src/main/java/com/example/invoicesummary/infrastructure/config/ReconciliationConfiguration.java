package com.example.invoicesummary.infrastructure.config;

import com.example.invoicesummary.domain.model.ReconciliationSettings;
import com.example.invoicesummary.domain.reconciliation.DocumentReconciler;
import com.example.invoicesummary.domain.selection.DocumentSelector;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the Spring-free domain engine as beans.
 */
@Configuration
@EnableConfigurationProperties({ReconciliationProperties.class, DocumentImportProperties.class})
public class ReconciliationConfiguration {

    @Bean
    public ReconciliationSettings reconciliationSettings(ReconciliationProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public DocumentReconciler documentReconciler() {
        return new DocumentReconciler();
    }

    @Bean
    public DocumentSelector documentSelector() {
        return new DocumentSelector();
    }
}
