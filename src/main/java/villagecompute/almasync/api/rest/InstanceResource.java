/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.almasync.api.types.InstancesType;
import villagecompute.almasync.api.types.ProcessorType;
import villagecompute.almasync.config.InstanceRegistry;
import villagecompute.almasync.jobs.JobRuntime;
import villagecompute.almasync.jobs.JobType;

import java.util.List;

/**
 * Lookup endpoints for building schedule forms: configured instance names and registered processors. Credentials are
 * never exposed.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class InstanceResource {

    @Inject
    InstanceRegistry instanceRegistry;

    @Inject
    JobRuntime jobRuntime;

    @GET
    @Path("/instances")
    public Response listInstances() {
        return Response
                .ok(new InstancesType(instanceRegistry.getDhis2InstanceNames().stream().sorted().toList(),
                        instanceRegistry.getAlmaInstanceNames().stream().sorted().toList()))
                .build();
    }

    @GET
    @Path("/processors")
    public Response listProcessors() {
        List<ProcessorType> processors = jobRuntime.getProcessorNames().stream().sorted()
                .map(name -> new ProcessorType(name,
                        JobType.fromProcessorName(name).map(JobType::getDescription).orElse(null)))
                .toList();
        return Response.ok(processors).build();
    }
}
