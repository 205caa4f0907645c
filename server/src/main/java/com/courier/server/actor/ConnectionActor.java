/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.courier.server.actor;

import com.courier.common.exception.AuthenticationException;
import com.courier.common.exception.TransportException;
import com.courier.common.message.AuthenticationMessage;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.messaging.core.ChannelLayer;
import com.courier.server.auth.AuthResult;
import com.courier.server.connection.CloseReason;
import com.courier.server.connection.Connection;
import com.courier.server.connection.ConnectionState;
import com.courier.server.connection.ConnectionType;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Pekko Typed Actor owning one connection. The mailbox is the per-connection queue:
 * client frames and channel deliveries are handled strictly one at a time, so a
 * handler that blocks holds back the next frame of its own connection only.
 */
public class ConnectionActor extends AbstractBehavior<ConnectionProtocol.Command> {

    private static final Logger log = LoggerFactory.getLogger(ConnectionActor.class);

    private final Connection connection;
    private final ConnectionPipeline pipeline;
    private final ChannelLayer channelLayer;
    private final Consumer<String> onClosed;
    private long processedFrames = 0;

    private ConnectionActor(ActorContext<ConnectionProtocol.Command> context, Connection connection,
                            ConnectionPipeline pipeline, ChannelLayer channelLayer, Consumer<String> onClosed) {
        super(context);
        this.connection = connection;
        this.pipeline = pipeline;
        this.channelLayer = channelLayer;
        this.onClosed = onClosed;
        log.debug("ConnectionActor started: {}", context.getSelf().path());
    }

    public static Behavior<ConnectionProtocol.Command> create(Connection connection, ConnectionPipeline pipeline,
                                                              ChannelLayer channelLayer, Consumer<String> onClosed) {
        return Behaviors.setup(ctx -> new ConnectionActor(ctx, connection, pipeline, channelLayer, onClosed));
    }

    @Override
    public Receive<ConnectionProtocol.Command> createReceive() {
        return newReceiveBuilder()
                .onMessage(ConnectionProtocol.Connect.class, this::onConnect)
                .onMessage(ConnectionProtocol.ClientFrame.class, this::onClientFrame)
                .onMessage(ConnectionProtocol.ChannelDelivery.class, this::onChannelDelivery)
                .onMessage(ConnectionProtocol.Close.class, this::onClose)
                .onMessage(ConnectionProtocol.Disconnect.class, this::onDisconnect)
                .onMessage(ConnectionProtocol.GetStatus.class, this::onGetStatus)
                .onSignal(PostStop.class, signal -> {
                    cleanup();
                    return this;
                })
                .build();
    }

    private Behavior<ConnectionProtocol.Command> onConnect(ConnectionProtocol.Connect cmd) {
        if (connection.getState() != ConnectionState.CONNECTING) {
            log.warn("Ignoring connect for connection {} in state {}", connection.getId(), connection.getState());
            cmd.replyTo().tell(status());
            return this;
        }
        ConnectionType type = connection.getType();
        connection.setState(ConnectionState.AUTHENTICATING);
        AuthResult auth = authenticate(cmd);
        if (cmd.abandoned().get()) {
            log.warn("Connection {} was abandoned by its caller during authentication", connection.getId());
            return closeAndStop(CloseReason.SERVER_ERROR, cmd.replyTo());
        }
        try {
            if (type.config().sendAuthenticationMessage()) {
                connection.send(new AuthenticationMessage(
                        new AuthenticationMessage.Payload(auth.statusCode(), auth.statusText(), auth.data())));
            }
            if (!auth.authenticated()) {
                log.info("Authentication failed for connection {}: {} {}",
                        connection.getId(), auth.statusCode(), auth.statusText());
                return closeAndStop(CloseReason.AUTHENTICATION_FAILED, cmd.replyTo());
            }
            connection.setIdentity(auth.identity());
            ActorRef<ConnectionProtocol.Command> self = getContext().getSelf();
            channelLayer.register(connection.getAddress(),
                    envelope -> self.tell(new ConnectionProtocol.ChannelDelivery(envelope)));

            Set<String> groups = new LinkedHashSet<>(type.groups());
            groups.addAll(type.groupResolver().groupsFor(connection));
            groups.forEach(connection::joinGroup);

            connection.setState(ConnectionState.OPEN);
            type.postAuthentication().run(connection);
        } catch (Exception e) {
            log.error("Failed to open connection {}", connection.getId(), e);
            return closeAndStop(CloseReason.SERVER_ERROR, cmd.replyTo());
        }
        log.info("Connection {} open on {} as {} in groups {}", connection.getId(), type.name(),
                connection.getIdentity() == null ? "anonymous" : connection.getIdentity().id(), connection.getGroups());
        cmd.replyTo().tell(status());
        return this;
    }

    private AuthResult authenticate(ConnectionProtocol.Connect cmd) {
        try {
            AuthResult result = connection.getType().authenticator().authenticate(cmd.request());
            if (result != null) {
                return result;
            }
            log.error("Authenticator returned no result for connection {}", connection.getId());
        } catch (AuthenticationException e) {
            log.info("Connection {} rejected by authenticator: {}", connection.getId(), e.getMessage());
            return AuthResult.failure(401, "Unauthorized", Map.of("detail", e.getMessage()));
        } catch (Exception e) {
            log.error("Authenticator failed for connection {}", connection.getId(), e);
        }
        return AuthResult.failure(500, "Internal Server Error", null);
    }

    private Behavior<ConnectionProtocol.Command> onClientFrame(ConnectionProtocol.ClientFrame cmd) {
        try {
            pipeline.dispatcher().dispatch(connection, cmd.text());
        } catch (TransportException e) {
            log.error("Transport failure [{}] while dispatching on connection {}: {}", e.getErrorCode(), connection.getId(), e.getMessage(), e);
        }
        processedFrames++;
        return this;
    }

    private Behavior<ConnectionProtocol.Command> onChannelDelivery(ConnectionProtocol.ChannelDelivery cmd) {
        ChannelEnvelope envelope = cmd.envelope();
        if (!connection.getState().canDispatch()) {
            log.warn("Dropping {} on connection {} in state {}", envelope, connection.getId(), connection.getState());
            return this;
        }
        try {
            switch (envelope.getKind()) {
                case DIRECT -> connection.sendJson(envelope.getContent());
                case GROUP_MESSAGE -> pipeline.enricher().deliver(connection, envelope);
                case EVENT -> pipeline.eventRouter().routeEvent(connection, envelope);
                default -> throw new IllegalStateException("Unhandled envelope kind " + envelope.getKind());
            }
        } catch (TransportException e) {
            log.error("Transport failure delivering {} to connection {}: {}", envelope, connection.getId(), e.getMessage(), e);
        }
        return this;
    }

    private Behavior<ConnectionProtocol.Command> onClose(ConnectionProtocol.Close cmd) {
        connection.close(cmd.reason());
        cleanup();
        return Behaviors.stopped();
    }

    private Behavior<ConnectionProtocol.Command> onDisconnect(ConnectionProtocol.Disconnect cmd) {
        log.info("Connection {} disconnected with code {}", connection.getId(), cmd.code());
        connection.setState(ConnectionState.CLOSING);
        cleanup();
        return Behaviors.stopped();
    }

    private Behavior<ConnectionProtocol.Command> onGetStatus(ConnectionProtocol.GetStatus cmd) {
        cmd.replyTo().tell(status());
        return this;
    }

    private Behavior<ConnectionProtocol.Command> closeAndStop(CloseReason reason,
                                                             ActorRef<ConnectionProtocol.ConnectionStatus> replyTo) {
        try {
            connection.close(reason);
        } catch (TransportException e) {
            log.warn("Could not close socket of connection {}: {}", connection.getId(), e.getMessage());
        }
        cleanup();
        replyTo.tell(status());
        return Behaviors.stopped();
    }

    private void cleanup() {
        if (connection.getState() == ConnectionState.CLOSED) {
            return;
        }
        connection.setState(ConnectionState.CLOSING);
        try {
            channelLayer.unregister(connection.getAddress());
        } catch (TransportException e) {
            log.warn("Could not unregister {} from channel layer: {}", connection.getAddress(), e.getMessage());
        }
        connection.setState(ConnectionState.CLOSED);
        onClosed.accept(connection.getId());
    }

    private ConnectionProtocol.ConnectionStatus status() {
        return new ConnectionProtocol.ConnectionStatus(connection.getId(), connection.getAddress(),
                connection.getState(), connection.getIdentity(), connection.getGroups(), processedFrames,
                connection.getLastActivity());
    }
}
