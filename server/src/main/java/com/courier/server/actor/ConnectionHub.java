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

import com.courier.messaging.core.ChannelLayer;
import com.courier.server.auth.HandshakeRequest;
import com.courier.server.broadcast.GroupBroadcastEnricher;
import com.courier.server.connection.ClientSink;
import com.courier.server.connection.CloseReason;
import com.courier.server.connection.Connection;
import com.courier.server.connection.ConnectionType;
import com.courier.server.event.EventPublisher;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.ActorSystem;
import org.apache.pekko.actor.typed.Props;
import org.apache.pekko.actor.typed.javadsl.AskPattern;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the actor system and spawns one {@link ConnectionActor} per accepted socket.
 * Connections run concurrently with each other; each one processes its own frames in order.
 */
public class ConnectionHub implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHub.class);

    private final ChannelLayer channelLayer;
    private final Duration askTimeout;
    private final ActorSystem<Void> actorSystem;
    private final Map<ConnectionType, ConnectionPipeline> pipelines = new ConcurrentHashMap<>();
    private final Map<String, ConnectionHandle> connections = new ConcurrentHashMap<>();

    public ConnectionHub(ChannelLayer channelLayer, String systemName, Duration askTimeout) {
        this.channelLayer = channelLayer;
        this.askTimeout = askTimeout;
        this.actorSystem = ActorSystem.create(Behaviors.empty(), systemName);
        log.info("Courier actor system '{}' initialized", systemName);
    }

    /**
     * Spawns the connection actor and runs the authentication gate. The returned handle
     * reports whether the connection was accepted; rejected connections are already closed.
     * When the gate does not answer within the ask timeout the stage fails and the
     * connection is closed rather than left open without a handle.
     */
    public CompletionStage<ConnectionHandle> connect(ConnectionType type, HandshakeRequest request, ClientSink sink) {
        ConnectionPipeline pipeline = pipelines.computeIfAbsent(type, t -> ConnectionPipeline.create(t, channelLayer));
        String id = UUID.randomUUID().toString().replace("-", "").substring(0, 16);
        String address = channelLayer.newAddress(type.name());
        GroupBroadcastEnricher enricher = pipeline.enricher();
        Connection connection = new Connection(id, address, type, sink, channelLayer, enricher);

        ActorRef<ConnectionProtocol.Command> actor = actorSystem.systemActorOf(
                ConnectionActor.create(connection, pipeline, channelLayer, connections::remove),
                "connection-" + id, Props.empty());
        log.debug("Spawned actor for connection {} on {}", id, type.name());

        AtomicBoolean abandoned = new AtomicBoolean(false);
        return AskPattern.<ConnectionProtocol.Command, ConnectionProtocol.ConnectionStatus>ask(
                        actor,
                        replyTo -> new ConnectionProtocol.Connect(request, replyTo, abandoned),
                        askTimeout,
                        actorSystem.scheduler())
                .whenComplete((status, failure) -> {
                    if (failure != null) {
                        // the actor may still be authenticating or may already be open
                        abandoned.set(true);
                        log.warn("Connection {} did not open within {}, closing it: {}", id, askTimeout, failure.getMessage());
                        actor.tell(new ConnectionProtocol.Close(CloseReason.SERVER_ERROR));
                    }
                })
                .thenApply(status -> {
                    ConnectionHandle handle = new ConnectionHandle(actor, actorSystem.scheduler(), askTimeout, status);
                    if (handle.isAccepted()) {
                        connections.put(id, handle);
                    }
                    return handle;
                });
    }

    /** Publisher for events handled by connections of the given type. */
    public EventPublisher eventPublisher(ConnectionType type) {
        return new EventPublisher(channelLayer, type.registry());
    }

    public Optional<ConnectionHandle> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public int getActiveCount() {
        return connections.size();
    }

    public ChannelLayer getChannelLayer() { return channelLayer; }

    @Override
    public void close() {
        actorSystem.terminate();
        log.info("Courier actor system terminated");
    }
}
