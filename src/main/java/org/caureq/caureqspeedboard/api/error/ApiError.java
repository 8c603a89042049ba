package org.caureq.caureqspeedboard.api.error;

import java.time.Instant;
import java.util.Map;

/**
 * JSON error body for every rejected request except token failures, which
 * {@code TokenFilter} answers before any controller runs.
 */
public record ApiError(Instant timestamp,
                       ErrorCode code,
                       String message,
                       String correlationId,
                       Map<String, Object> details) {

    public ApiError {
        details = details == null ? Map.of() : details;
    }

    public static ApiError of(ErrorCode code, String message, String correlationId, Map<String, Object> details) {
        return new ApiError(Instant.now(), code, message, correlationId, details);
    }
}
