/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.almasync.api.types.ProgressUpdateType;
import villagecompute.almasync.api.types.ScheduleType;

/**
 * Fan-out of schedule events to connected observers.
 *
 * <p>
 * Every event is serialized once as {@code {"type": ..., "data": ..., "timestamp": ...}} and pushed to each open
 * channel. Channels that are closed or fail on send are dropped. Events are not buffered: an observer that connects
 * later only sees later events.
 *
 * @see villagecompute.almasync.api.ws.StatusSocket for the WebSocket endpoint feeding this broadcaster
 */
@ApplicationScoped
public class StatusBroadcaster {

    private static final Logger LOG = Logger.getLogger(StatusBroadcaster.class);

    /**
     * Event types published on {@code /ws}.
     */
    public enum EventType {
        SCHEDULE_CREATED("schedule_created"),
        SCHEDULE_UPDATE("schedule_update"),
        SCHEDULE_DELETED("schedule_deleted"),
        SCHEDULE_STARTED("schedule_started"),
        SCHEDULE_STOPPED("schedule_stopped"),
        PROGRESS_UPDATE("progress_update");

        private final String value;

        EventType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    /**
     * Wire envelope of an event.
     */
    public record StatusEvent(EventType type, Object data, String timestamp) {
    }

    private final Map<String, StatusChannel> channels = new ConcurrentHashMap<>();

    @Inject
    ObjectMapper objectMapper;

    public StatusBroadcaster() {
    }

    StatusBroadcaster(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(StatusChannel channel) {
        Objects.requireNonNull(channel, "channel is required");
        channels.put(channel.id(), channel);
        LOG.debugf("Status channel %s connected (%d open)", channel.id(), channels.size());
    }

    public void unregister(String channelId) {
        if (channelId != null && channels.remove(channelId) != null) {
            LOG.debugf("Status channel %s disconnected (%d open)", channelId, channels.size());
        }
    }

    public int getChannelCount() {
        return channels.size();
    }

    /**
     * Publishes an event to every open channel.
     *
     * @return number of channels the event was delivered to
     */
    public int broadcast(EventType type, Object data) {
        if (channels.isEmpty()) {
            return 0;
        }

        String message;
        try {
            message = objectMapper.writeValueAsString(new StatusEvent(type, data, Instant.now().toString()));
        } catch (JsonProcessingException e) {
            LOG.errorf(e, "Could not serialize %s event", type.getValue());
            return 0;
        }

        int delivered = 0;
        for (StatusChannel channel : channels.values()) {
            if (!channel.isOpen()) {
                channels.remove(channel.id());
                continue;
            }
            try {
                channel.send(message);
                delivered++;
            } catch (RuntimeException e) {
                channels.remove(channel.id());
                LOG.debugf("Dropped status channel %s after send failure: %s", channel.id(), e.getMessage());
            }
        }
        return delivered;
    }

    public int scheduleCreated(ScheduleType schedule) {
        return broadcast(EventType.SCHEDULE_CREATED, schedule);
    }

    public int scheduleUpdated(ScheduleType schedule) {
        return broadcast(EventType.SCHEDULE_UPDATE, schedule);
    }

    public int scheduleStarted(ScheduleType schedule) {
        return broadcast(EventType.SCHEDULE_STARTED, schedule);
    }

    public int scheduleStopped(ScheduleType schedule) {
        return broadcast(EventType.SCHEDULE_STOPPED, schedule);
    }

    public int scheduleDeleted(String scheduleId) {
        return broadcast(EventType.SCHEDULE_DELETED, Map.of("id", scheduleId));
    }

    public int progress(String scheduleId, double progress, String message) {
        return broadcast(EventType.PROGRESS_UPDATE, new ProgressUpdateType(scheduleId, progress, message));
    }
}
