/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.exceptions;

/**
 * Exception thrown when a call to DHIS2 or ALMA fails.
 *
 * <p>
 * Wraps network errors, timeouts, authentication failures and non-2xx responses. Inside the work unit loop these are
 * handled according to the configured unit failure policy; anywhere else they fail the job.
 */
public class ExternalServiceException extends RuntimeException {

    private final int statusCode;

    public ExternalServiceException(String message) {
        this(message, -1);
    }

    public ExternalServiceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return HTTP status returned by the remote system, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
