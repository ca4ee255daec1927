/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import villagecompute.almasync.api.types.CreateScheduleRequestType;
import villagecompute.almasync.api.types.JobStatusType;
import villagecompute.almasync.api.types.ScheduleStatusType;
import villagecompute.almasync.api.types.ScheduleType;
import villagecompute.almasync.api.types.UpdateScheduleRequestType;
import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.exceptions.ConfigurationException;
import villagecompute.almasync.exceptions.ResourceNotFoundException;
import villagecompute.almasync.exceptions.ValidationException;
import villagecompute.almasync.services.SyncScheduler;

import java.util.List;

/**
 * REST endpoints for sync schedules.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/schedules} – list schedules, optionally filtered by {@code ?status=}</li>
 * <li>{@code POST /api/schedules} – create an inactive schedule</li>
 * <li>{@code GET /api/schedules/{id}} – get single schedule</li>
 * <li>{@code PUT /api/schedules/{id}} – partial update; re-arms an active schedule when its job changes</li>
 * <li>{@code DELETE /api/schedules/{id}} – stop and delete</li>
 * <li>{@code POST /api/schedules/{id}/start} – activate and submit the job</li>
 * <li>{@code POST /api/schedules/{id}/stop} – deactivate</li>
 * <li>{@code GET /api/schedules/{id}/status} – schedule plus the state of its current job</li>
 * </ul>
 *
 * <p>
 * Unknown schedules answer 404, invalid definitions and incomplete sync bindings answer 400.
 */
@Path("/api/schedules")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ScheduleResource {

    private static final Logger LOG = Logger.getLogger(ScheduleResource.class);

    @Inject
    SyncScheduler syncScheduler;

    /**
     * Lists schedules, newest first.
     *
     * @param status
     *            optional status filter ({@code idle}, {@code running}, {@code completed}, {@code failed})
     * @return list of schedules
     */
    @GET
    public Response listSchedules(@QueryParam("status") String status) {
        try {
            List<Schedule> schedules = status == null || status.isBlank() ? syncScheduler.list()
                    : syncScheduler.listByStatus(Schedule.Status.fromValue(status));
            return Response.ok(schedules.stream().map(ScheduleType::fromEntity).toList()).build();
        } catch (IllegalArgumentException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to list schedules");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to list schedules")).build();
        }
    }

    /**
     * Creates a schedule. The schedule starts inactive; use {@code /start} to arm it.
     *
     * @param request
     *            schedule definition
     * @return 201 with the created schedule
     */
    @POST
    public Response createSchedule(@Valid CreateScheduleRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }

        try {
            Schedule created = syncScheduler.create(request.toEntity());
            return Response.status(Response.Status.CREATED).entity(ScheduleType.fromEntity(created)).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to create schedule %s", request.name());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to create schedule")).build();
        }
    }

    @GET
    @Path("/{id}")
    public Response getSchedule(@PathParam("id") String id) {
        try {
            return Response.ok(ScheduleType.fromEntity(syncScheduler.get(id))).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to load schedule %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to load schedule")).build();
        }
    }

    /**
     * Applies a partial update. Null fields are left unchanged.
     *
     * @param id
     *            schedule to update
     * @param request
     *            fields to change
     * @return updated schedule
     */
    @PUT
    @Path("/{id}")
    public Response updateSchedule(@PathParam("id") String id, @Valid UpdateScheduleRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }

        try {
            Schedule updated = syncScheduler.update(id, request.toUpdate());
            return Response.ok(ScheduleType.fromEntity(updated)).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        } catch (ValidationException | ConfigurationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to update schedule %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to update schedule")).build();
        }
    }

    @DELETE
    @Path("/{id}")
    public Response deleteSchedule(@PathParam("id") String id) {
        try {
            syncScheduler.delete(id);
            return Response.noContent().build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to delete schedule %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to delete schedule")).build();
        }
    }

    /**
     * Activates a schedule. Starting an already active schedule replaces its job rather than adding a second one.
     *
     * @param id
     *            schedule to start
     * @return the armed schedule
     */
    @POST
    @Path("/{id}/start")
    public Response startSchedule(@PathParam("id") String id) {
        try {
            return Response.ok(ScheduleType.fromEntity(syncScheduler.start(id))).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        } catch (ConfigurationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to start schedule %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to start schedule")).build();
        }
    }

    @POST
    @Path("/{id}/stop")
    public Response stopSchedule(@PathParam("id") String id) {
        try {
            return Response.ok(ScheduleType.fromEntity(syncScheduler.stop(id))).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to stop schedule %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to stop schedule")).build();
        }
    }

    @GET
    @Path("/{id}/status")
    public Response getScheduleStatus(@PathParam("id") String id) {
        try {
            SyncScheduler.ScheduleStatus status = syncScheduler.getStatus(id);
            return Response.ok(new ScheduleStatusType(ScheduleType.fromEntity(status.schedule()),
                    status.job().map(JobStatusType::fromJob).orElse(null))).build();
        } catch (ResourceNotFoundException e) {
            return notFound(e);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to load status of schedule %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to load schedule status")).build();
        }
    }

    private Response notFound(ResourceNotFoundException e) {
        return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
