/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.messaging.core;

import java.util.Set;

/**
 * Pub/sub transport between connections. Implementations own the global group index
 * and are responsible for fan-out; callers never queue or retry.
 * Every operation may throw {@link com.courier.common.exception.TransportException}.
 */
public interface ChannelLayer extends AutoCloseable {

    /** Allocates a fresh unicast address for a connection. */
    String newAddress(String prefix);

    void register(String address, ChannelReceiver receiver);

    void unregister(String address);

    void sendToConnection(String address, ChannelEnvelope envelope);

    void joinGroup(String group, String address);

    void leaveGroup(String group, String address);

    void sendToGroup(String group, ChannelEnvelope envelope);

    void sendEvent(String address, ChannelEnvelope event);

    void broadcastEvent(String group, ChannelEnvelope event);

    /** Snapshot of the addresses currently in a group. */
    Set<String> groupMembers(String group);

    @Override
    void close();
}
