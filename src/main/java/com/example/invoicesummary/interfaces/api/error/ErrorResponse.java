package com.example.invoicesummary.interfaces.api.error;

import java.time.Instant;
import java.util.Map;

/**
 * Error payload returned by every failing endpoint.
 * {@code details} echoes the request values behind the failure and is omitted when there are none.
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {

    public ErrorResponse {
        details = details == null || details.isEmpty() ? null : Map.copyOf(details);
    }

    /**
     * @param status  HTTP status code
     * @param error   stable error code
     * @param message human readable explanation
     * @param path    request path that produced the error
     * @return response without details, stamped with the current time
     */
    public static ErrorResponse of(int status, String error, String message, String path) {
        return of(status, error, message, path, null);
    }

    /**
     * @param details request values that caused the failure, may be {@code null}
     * @return response stamped with the current time
     */
    public static ErrorResponse of(int status, String error, String message, String path, Map<String, Object> details) {
        return new ErrorResponse(Instant.now(), status, error, message, path, details);
    }
}
