/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Unit tests for {@link StatusBroadcaster}.
 */
class StatusBroadcasterTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private StatusBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new StatusBroadcaster(objectMapper);
    }

    @Test
    void testBroadcastWithoutObservers() {
        assertEquals(0, broadcaster.progress("s1", 10, "Processing... 10.0%"));
    }

    @Test
    void testProgressEnvelope() throws Exception {
        TestChannel channel = new TestChannel("c1");
        broadcaster.register(channel);

        assertEquals(1, broadcaster.progress("s1", 37.5, "Processing... 37.5%"));

        JsonNode event = objectMapper.readTree(channel.messages.get(0));
        assertEquals("progress_update", event.path("type").asText());
        assertEquals("s1", event.path("data").path("id").asText());
        assertEquals(37.5, event.path("data").path("progress").asDouble());
        assertEquals("Processing... 37.5%", event.path("data").path("message").asText());
        assertTrue(event.hasNonNull("timestamp"));
    }

    @Test
    void testDeletedEventCarriesId() throws Exception {
        TestChannel channel = new TestChannel("c1");
        broadcaster.register(channel);

        broadcaster.scheduleDeleted("s1");

        JsonNode event = objectMapper.readTree(channel.messages.get(0));
        assertEquals("schedule_deleted", event.path("type").asText());
        assertEquals("s1", event.path("data").path("id").asText());
    }

    @Test
    void testFailingChannelIsDroppedOthersStillReceive() {
        TestChannel healthy = new TestChannel("healthy");
        TestChannel broken = new TestChannel("broken");
        broken.failOnSend = true;
        broadcaster.register(healthy);
        broadcaster.register(broken);

        assertEquals(1, broadcaster.progress("s1", 5, null));
        assertEquals(1, broadcaster.getChannelCount());

        assertEquals(1, broadcaster.progress("s1", 6, null));
        assertEquals(2, healthy.messages.size());
    }

    @Test
    void testClosedChannelIsDropped() {
        TestChannel closed = new TestChannel("closed");
        closed.open = false;
        broadcaster.register(closed);

        assertEquals(0, broadcaster.progress("s1", 5, null));
        assertEquals(0, broadcaster.getChannelCount());
        assertTrue(closed.messages.isEmpty());
    }

    @Test
    void testUnregisteredChannelReceivesNothing() {
        TestChannel channel = new TestChannel("c1");
        broadcaster.register(channel);
        broadcaster.unregister("c1");

        broadcaster.progress("s1", 5, null);

        assertTrue(channel.messages.isEmpty());
    }

    private static final class TestChannel implements StatusChannel {

        private final String id;
        private final List<String> messages = new ArrayList<>();
        private boolean open = true;
        private boolean failOnSend;

        TestChannel(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String message) {
            if (failOnSend) {
                throw new IllegalStateException("connection reset");
            }
            messages.add(message);
        }
    }
}
