/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.services;

/**
 * One observer connection of the {@link StatusBroadcaster}.
 */
public interface StatusChannel {

    /**
     * Stable identifier, used to unregister the channel.
     */
    String id();

    boolean isOpen();

    /**
     * Sends a serialized event.
     *
     * @throws RuntimeException
     *             if delivery fails; the broadcaster then drops the channel
     */
    void send(String message);
}
