/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.almasync.api.types.JobStatusType;
import villagecompute.almasync.api.types.QueueStatsType;
import villagecompute.almasync.api.types.RepeatableJobType;
import villagecompute.almasync.jobs.JobRuntime;
import villagecompute.almasync.jobs.JobState;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only view of the job queue.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/queue/stats} – job counts per state</li>
 * <li>{@code GET /api/queue/jobs} – jobs, optionally filtered by comma-separated {@code ?state=}</li>
 * <li>{@code GET /api/queue/repeatable} – registered cron definitions</li>
 * </ul>
 */
@Path("/api/queue")
@Produces(MediaType.APPLICATION_JSON)
public class QueueResource {

    private static final Logger LOG = Logger.getLogger(QueueResource.class);

    @Inject
    JobRuntime jobRuntime;

    @GET
    @Path("/stats")
    public Response getStats() {
        try {
            return Response.ok(QueueStatsType.fromStats(jobRuntime.getStats())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to load queue stats");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to load queue stats")).build();
        }
    }

    /**
     * Lists jobs, newest first.
     *
     * @param state
     *            optional comma-separated states, e.g. {@code waiting,active}
     * @return list of jobs
     */
    @GET
    @Path("/jobs")
    public Response listJobs(@QueryParam("state") String state) {
        Set<JobState> states;
        try {
            states = parseStates(state);
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Unknown job state: " + state))
                    .build();
        }

        try {
            List<JobStatusType> jobs = jobRuntime.getJobs(states).stream().map(JobStatusType::fromJob).toList();
            return Response.ok(jobs).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to list jobs");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(new ErrorResponse("Failed to list jobs"))
                    .build();
        }
    }

    @GET
    @Path("/repeatable")
    public Response listRepeatable() {
        try {
            return Response.ok(jobRuntime.getRepeatableJobs().stream().map(RepeatableJobType::fromInfo).toList())
                    .build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to list repeatable jobs");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to list repeatable jobs")).build();
        }
    }

    private static Set<JobState> parseStates(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        Set<JobState> states = EnumSet.noneOf(JobState.class);
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                states.add(JobState.fromValue(part));
            }
        }
        return states;
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
