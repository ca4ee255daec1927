/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.ws;

import org.jboss.logging.Logger;

import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import jakarta.inject.Inject;
import villagecompute.almasync.services.StatusBroadcaster;
import villagecompute.almasync.services.StatusChannel;

/**
 * WebSocket endpoint streaming schedule events.
 *
 * <p>
 * Clients connect to {@code /ws} and receive every event published after they connected:
 *
 * <pre>
 * {"type": "progress_update", "data": {"id": "...", "progress": 37.5, "message": "Processing... 37.5%"},
 *  "timestamp": "2025-03-01T10:00:00Z"}
 * </pre>
 *
 * Inbound messages are ignored.
 */
@WebSocket(
        path = "/ws")
public class StatusSocket {

    private static final Logger LOG = Logger.getLogger(StatusSocket.class);

    @Inject
    StatusBroadcaster broadcaster;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        broadcaster.register(new ConnectionChannel(connection));
        LOG.debugf("WebSocket %s opened (%d observers)", connection.id(), broadcaster.getChannelCount());
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        broadcaster.unregister(connection.id());
    }

    /**
     * Adapts a WebSockets Next connection to a broadcaster channel.
     */
    static final class ConnectionChannel implements StatusChannel {

        private final WebSocketConnection connection;

        ConnectionChannel(WebSocketConnection connection) {
            this.connection = connection;
        }

        @Override
        public String id() {
            return connection.id();
        }

        @Override
        public boolean isOpen() {
            return connection.isOpen();
        }

        @Override
        public void send(String message) {
            connection.sendTextAndAwait(message);
        }
    }
}
