/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.dispatch;

import com.courier.common.config.DispatchConfig;
import com.courier.common.exception.TransportException;
import com.courier.common.message.ErrorMessage;
import com.courier.server.connection.Connection;
import com.courier.server.registry.Direction;
import com.courier.server.registry.HandlerBinding;
import com.courier.server.registry.SchemaRegistry;
import com.courier.server.registry.ValidationOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates client frames, invokes the bound handler and emits completion signals.
 * <p>
 * Post-condition of a successful invocation: a non-null return value is sent to the
 * invoking connection only; null sends nothing. Handler exceptions become a generic
 * error frame and never close the connection. {@link TransportException} is not a
 * handler failure and propagates to the caller.
 * <p>
 * Callers must serialize calls per connection; the connection actor does.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final SchemaRegistry registry;
    private final DispatchConfig config;

    public Dispatcher(SchemaRegistry registry, DispatchConfig config) {
        this.registry = registry;
        this.config = config;
    }

    public DispatchOutcome dispatch(Connection connection, String frame) {
        if (!admit(connection)) {
            return DispatchOutcome.DROPPED;
        }
        return process(connection, registry.clientUnion().validate(frame), frame);
    }

    public DispatchOutcome dispatch(Connection connection, JsonNode frame) {
        if (!admit(connection)) {
            return DispatchOutcome.DROPPED;
        }
        return process(connection, registry.clientUnion().validate(frame), frame);
    }

    private boolean admit(Connection connection) {
        if (!connection.getState().canDispatch()) {
            log.warn("Dropping client message on connection {} in state {}", connection.getId(), connection.getState());
            return false;
        }
        connection.touch();
        return true;
    }

    private DispatchOutcome process(Connection connection, ValidationOutcome outcome, Object frame) {
        try (DispatchContext context = DispatchContext.open(connection.getId())) {
            String action = outcome.discriminator();
            context.action(action);
            if (config.logReceivedMessages() && !config.isIgnoredForLogging(action)) {
                log.info("Received websocket json: {}", frame);
            }
            DispatchOutcome result;
            if (outcome instanceof ValidationOutcome.Valid valid) {
                result = invoke(connection, valid);
            } else if (outcome instanceof ValidationOutcome.Invalid invalid) {
                log.debug("Rejected message '{}' on connection {}: {}", action, connection.getId(), invalid.errors());
                connection.send(ErrorMessage.validation(invalid.errors()));
                result = DispatchOutcome.REJECTED;
            } else {
                throw new IllegalStateException("Unhandled validation outcome " + outcome);
            }
            CompletionSignal.emit(connection, config);
            return result;
        }
    }

    private DispatchOutcome invoke(Connection connection, ValidationOutcome.Valid valid) {
        String action = valid.discriminator();
        HandlerBinding binding = registry.handlerTable().lookup(Direction.CLIENT, action)
                .orElseThrow(() -> new IllegalStateException("No client binding for validated type '" + action + "'"));
        HandlerResult result;
        try {
            result = HandlerResult.of(binding.invoke(connection, valid.message()));
        } catch (TransportException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to process message '{}' on connection {}", action, connection.getId(), e);
            connection.send(ErrorMessage.handlerFailure());
            return DispatchOutcome.FAILED;
        }
        if (result instanceof HandlerResult.Reply reply) {
            connection.send(reply.message());
        } else if (!(result instanceof HandlerResult.NoReply)) {
            throw new IllegalStateException("Unhandled handler result " + result);
        }
        return DispatchOutcome.HANDLED;
    }
}
