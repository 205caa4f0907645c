/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.event;

import com.courier.common.config.DispatchConfig;
import com.courier.common.exception.TransportException;
import com.courier.common.message.ErrorMessage;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.server.broadcast.GroupBroadcastEnricher;
import com.courier.server.broadcast.GroupMessage;
import com.courier.server.broadcast.Origin;
import com.courier.server.connection.Connection;
import com.courier.server.dispatch.CompletionSignal;
import com.courier.server.dispatch.DispatchContext;
import com.courier.server.dispatch.DispatchOutcome;
import com.courier.server.dispatch.HandlerResult;
import com.courier.server.registry.Direction;
import com.courier.server.registry.HandlerBinding;
import com.courier.server.registry.SchemaRegistry;
import com.courier.server.registry.ValidationOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Runs server-side events delivered by the channel layer through the event handlers of
 * the receiving connection. Events live in their own discriminator space.
 * <p>
 * Where a reply goes depends on how the event arrived, not on the handler: a unicast
 * event's reply is sent to the receiving connection; a broadcast event's reply is
 * enriched against the event's origin and delivered to the receiving connection, which
 * is the group member the channel layer fanned out to. Routing and handler failures are
 * logged and never close the connection.
 */
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final SchemaRegistry registry;
    private final DispatchConfig config;
    private final GroupBroadcastEnricher enricher;

    public EventRouter(SchemaRegistry registry, DispatchConfig config, GroupBroadcastEnricher enricher) {
        this.registry = registry;
        this.config = config;
        this.enricher = enricher;
    }

    public DispatchOutcome routeEvent(Connection connection, ChannelEnvelope envelope) {
        return routeEvent(connection, envelope.getContent(), EventDispatchMode.from(envelope.getDelivery()),
                envelope.getTarget() == null ? List.of() : List.of(envelope.getTarget()),
                GroupMessage.originFrom(envelope));
    }

    /**
     * @param targets the address or groups the event was sent to, for diagnostics
     * @param origin  the event's declared origin; {@link Origin#NONE} when it carries none
     */
    public DispatchOutcome routeEvent(Connection connection, JsonNode rawEvent, EventDispatchMode mode,
                                      Collection<String> targets, Origin origin) {
        if (!connection.getState().canDispatch()) {
            log.warn("Dropping {} event on connection {} in state {}", mode, connection.getId(), connection.getState());
            return DispatchOutcome.DROPPED;
        }
        try (DispatchContext context = DispatchContext.open(connection.getId())) {
            ValidationOutcome outcome = registry.eventUnion().validate(rawEvent);
            String action = outcome.discriminator();
            context.action(action);
            if (config.logReceivedMessages() && !config.isIgnoredForLogging(action)) {
                log.info("Received {} channel event via {}: {}", mode, targets, rawEvent);
            }
            connection.touch();

            if (outcome instanceof ValidationOutcome.Invalid invalid) {
                log.error("Failed to process channel event '{}' on connection {}: {}",
                        action, connection.getId(), invalid.errors());
                if (notifies(mode)) {
                    connection.send(ErrorMessage.validation(invalid.errors()));
                    CompletionSignal.emit(connection, config);
                }
                return DispatchOutcome.REJECTED;
            } else if (outcome instanceof ValidationOutcome.Valid valid) {
                DispatchOutcome result = invoke(connection, valid, mode, origin);
                CompletionSignal.emit(connection, config);
                return result;
            }
            throw new IllegalStateException("Unhandled validation outcome " + outcome);
        }
    }

    private DispatchOutcome invoke(Connection connection, ValidationOutcome.Valid valid,
                                   EventDispatchMode mode, Origin origin) {
        String action = valid.discriminator();
        HandlerBinding binding = registry.handlerTable().lookup(Direction.EVENT, action)
                .orElseThrow(() -> new IllegalStateException("No event binding for validated type '" + action + "'"));
        HandlerResult result;
        try {
            result = HandlerResult.of(binding.invoke(connection, valid.message()));
        } catch (TransportException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to process channel event '{}' on connection {}", action, connection.getId(), e);
            if (notifies(mode)) {
                connection.send(ErrorMessage.handlerFailure());
            }
            return DispatchOutcome.FAILED;
        }
        if (result instanceof HandlerResult.Reply reply) {
            if (mode == EventDispatchMode.UNICAST) {
                connection.send(reply.message());
            } else {
                enricher.deliverLocally(connection, origin, reply.message());
            }
        } else if (!(result instanceof HandlerResult.NoReply)) {
            throw new IllegalStateException("Unhandled handler result " + result);
        }
        return DispatchOutcome.HANDLED;
    }

    private boolean notifies(EventDispatchMode mode) {
        return mode == EventDispatchMode.UNICAST && config.notifyUnicastEventErrors();
    }
}
