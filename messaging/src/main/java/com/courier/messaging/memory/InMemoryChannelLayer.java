/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.messaging.memory;

import com.courier.common.exception.TransportException;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.messaging.core.ChannelLayer;
import com.courier.messaging.core.ChannelReceiver;
import com.courier.messaging.core.Delivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process channel layer. Delivery is synchronous on the caller's thread; group
 * fan-out iterates over a snapshot of the membership taken when the send starts.
 * A receiver that throws is logged and does not stop delivery to the others.
 */
public class InMemoryChannelLayer implements ChannelLayer {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChannelLayer.class);

    private final Map<String, ChannelReceiver> receivers = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> groups = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    @Override
    public String newAddress(String prefix) {
        return prefix + "!" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    @Override
    public void register(String address, ChannelReceiver receiver) {
        ensureOpen();
        if (receivers.putIfAbsent(address, receiver) != null) {
            throw new TransportException("Address already registered: " + address);
        }
        log.debug("Registered receiver for {}", address);
    }

    @Override
    public void unregister(String address) {
        receivers.remove(address);
        for (String group : groups.keySet()) {
            removeMember(group, address);
        }
        log.debug("Unregistered receiver for {}", address);
    }

    @Override
    public void sendToConnection(String address, ChannelEnvelope envelope) {
        ensureOpen();
        deliver(address, envelope.deliveredVia(Delivery.UNICAST, address));
    }

    @Override
    public void joinGroup(String group, String address) {
        ensureOpen();
        // atomic against removeMember dropping an emptied set
        groups.compute(group, (g, members) -> {
            Set<String> joined = members == null ? ConcurrentHashMap.newKeySet() : members;
            joined.add(address);
            return joined;
        });
        log.debug("{} joined group {}", address, group);
    }

    @Override
    public void leaveGroup(String group, String address) {
        ensureOpen();
        removeMember(group, address);
        log.debug("{} left group {}", address, group);
    }

    @Override
    public void sendToGroup(String group, ChannelEnvelope envelope) {
        ensureOpen();
        fanOut(group, envelope.deliveredVia(Delivery.BROADCAST, group));
    }

    @Override
    public void sendEvent(String address, ChannelEnvelope event) {
        ensureOpen();
        deliver(address, event.deliveredVia(Delivery.UNICAST, address));
    }

    @Override
    public void broadcastEvent(String group, ChannelEnvelope event) {
        ensureOpen();
        fanOut(group, event.deliveredVia(Delivery.BROADCAST, group));
    }

    @Override
    public Set<String> groupMembers(String group) {
        Set<String> members = groups.get(group);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    public long getDeliveredCount() { return deliveredCount.get(); }
    public long getDroppedCount() { return droppedCount.get(); }

    public boolean isClosed() { return closed.get(); }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("In-memory channel layer closed ({} delivered, {} dropped)",
                    deliveredCount.get(), droppedCount.get());
            receivers.clear();
            groups.clear();
        }
    }

    private void removeMember(String group, String address) {
        groups.computeIfPresent(group, (g, members) -> {
            members.remove(address);
            return members.isEmpty() ? null : members;
        });
    }

    private void fanOut(String group, ChannelEnvelope envelope) {
        List<String> snapshot = List.copyOf(groupMembers(group));
        log.debug("Fanning out {} to {} member(s) of {}", envelope, snapshot.size(), group);
        for (String address : snapshot) {
            deliver(address, envelope);
        }
    }

    private void deliver(String address, ChannelEnvelope envelope) {
        ChannelReceiver receiver = receivers.get(address);
        if (receiver == null) {
            droppedCount.incrementAndGet();
            log.debug("No receiver for {}, dropping {}", address, envelope);
            return;
        }
        try {
            receiver.onEnvelope(envelope);
            deliveredCount.incrementAndGet();
        } catch (RuntimeException e) {
            droppedCount.incrementAndGet();
            log.error("Receiver for {} failed on {}: {}", address, envelope, e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new TransportException("Channel layer is closed");
        }
    }
}
