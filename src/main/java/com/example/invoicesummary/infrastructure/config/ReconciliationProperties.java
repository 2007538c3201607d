package com.example.invoicesummary.infrastructure.config;

import com.example.invoicesummary.domain.model.ReconciliationSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;

/**
 * Binds {@code invoice-summary.reconciliation.*} from {@code application.properties}.
 *
 * @param scale            currency minor-unit precision
 * @param tolerancePerLine residual tolerated per product line
 * @param tolerance        optional absolute tolerance replacing the per-line one
 * @param parallel         evaluate documents concurrently
 */
@ConfigurationProperties(prefix = "invoice-summary.reconciliation")
public record ReconciliationProperties(
        @DefaultValue("2") int scale,
        @DefaultValue("0.01") BigDecimal tolerancePerLine,
        BigDecimal tolerance,
        @DefaultValue("false") boolean parallel
) {

    /**
     * @return immutable settings value handed to the engine
     */
    public ReconciliationSettings toSettings() {
        return new ReconciliationSettings(scale, tolerancePerLine, tolerance, parallel);
    }
}
