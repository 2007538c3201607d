package com.example.invoicesummary.interfaces.api;

/**
 * API-layer DTO acknowledging a document registration.
 */
public record RegistrationResponse(int registered) {
}
