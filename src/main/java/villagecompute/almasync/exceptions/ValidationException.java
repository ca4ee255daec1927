/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.exceptions;

/**
 * Exception thrown when a schedule definition is structurally invalid (missing name, unknown type, malformed cron
 * expression).
 *
 * <p>
 * Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
