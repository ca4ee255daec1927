/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.exceptions;

/**
 * Recorded against a job whose retry budget has been used up.
 *
 * <p>
 * The job runtime never throws this to callers; it is handed to job event listeners so the owning schedule can be
 * moved to {@code failed} with a message carrying the attempt count.
 */
public class RetriesExhaustedException extends RuntimeException {

    private final String jobId;
    private final int attempts;

    public RetriesExhaustedException(String jobId, int attempts, Throwable cause) {
        super("Failed after " + attempts + " attempts: " + (cause != null ? cause.getMessage() : "unknown error"),
                cause);
        this.jobId = jobId;
        this.attempts = attempts;
    }

    public String getJobId() {
        return jobId;
    }

    public int getAttempts() {
        return attempts;
    }
}
