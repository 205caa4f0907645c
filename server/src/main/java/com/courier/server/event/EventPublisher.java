/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.event;

import com.courier.common.exception.RoutingException;
import com.courier.common.message.Message;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.messaging.core.ChannelLayer;
import com.courier.messaging.core.EnvelopeKind;
import com.courier.server.broadcast.GroupMessage;
import com.courier.server.broadcast.Origin;
import com.courier.server.registry.MessageType;
import com.courier.server.registry.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Entry point for server-side code (background jobs, other services) that injects
 * events into connections of one connection type. Events not declared in the type's
 * event union are refused before anything is sent.
 */
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final ChannelLayer channelLayer;
    private final SchemaRegistry registry;

    public EventPublisher(ChannelLayer channelLayer, SchemaRegistry registry) {
        this.channelLayer = channelLayer;
        this.registry = registry;
    }

    public void sendEvent(String address, Message event) {
        sendEvent(address, event, Origin.NONE);
    }

    public void sendEvent(String address, Message event, Origin origin) {
        ChannelEnvelope envelope = envelope(event, origin);
        log.debug("Sending event '{}' to {}", event.action(), address);
        channelLayer.sendEvent(address, envelope);
    }

    public void broadcastEvent(String group, Message event) {
        broadcastEvent(List.of(group), event, Origin.NONE);
    }

    public void broadcastEvent(Collection<String> groups, Message event, Origin origin) {
        ChannelEnvelope envelope = envelope(event, origin);
        for (String group : new LinkedHashSet<>(groups)) {
            log.debug("Broadcasting event '{}' to group {}", event.action(), group);
            channelLayer.broadcastEvent(group, envelope);
        }
    }

    private ChannelEnvelope envelope(Message event, Origin origin) {
        MessageType<?> type = registry.eventUnion().typeFor(event.action())
                .orElseThrow(() -> new RoutingException("No event handler declared for '" + event.action() + "'"));
        if (!type.messageClass().isInstance(event)) {
            throw new RoutingException("Event '" + event.action() + "' must be a "
                    + type.messageClass().getSimpleName() + " but was " + event.getClass().getSimpleName());
        }
        return ChannelEnvelope.of(EnvelopeKind.EVENT, registry.codec().encode(event), GroupMessage.originHeaders(origin));
    }
}
