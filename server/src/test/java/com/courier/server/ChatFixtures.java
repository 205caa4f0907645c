/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server;

import com.courier.common.config.DispatchConfig;
import com.courier.common.message.Message;
import com.courier.common.model.Identity;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.messaging.core.ChannelLayer;
import com.courier.server.actor.ConnectionPipeline;
import com.courier.server.connection.Connection;
import com.courier.server.connection.ConnectionState;
import com.courier.server.connection.ConnectionType;
import com.courier.server.registry.HandlerDeclaration;
import com.courier.server.registry.MessageType;
import com.courier.server.registry.SchemaRegistry;
import com.courier.server.testing.RecordingClientSink;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Chat-style connection type shared by the dispatch tests, plus helpers that wire
 * connections to a channel layer without actors so delivery is synchronous.
 */
public final class ChatFixtures {

    public record Ping() implements Message {
        @Override
        public String action() { return "ping"; }
    }

    public record Pong() implements Message {
        @Override
        public String action() { return "pong"; }
    }

    public record ChatPayload(String text) {}

    public record Chat(ChatPayload payload) implements Message {
        @Override
        public String action() { return "chat"; }
    }

    public record ChatNotify(ChatPayload payload) implements Message {
        @Override
        public String action() { return "chat_notify"; }
    }

    public record Boom() implements Message {
        @Override
        public String action() { return "boom"; }
    }

    public record JobPayload(String jobId) {}

    public record JobDone(JobPayload payload) implements Message {
        @Override
        public String action() { return "job_done"; }
    }

    public record JobResult(JobPayload payload) implements Message {
        @Override
        public String action() { return "job_result"; }
    }

    /** Event reusing a client discriminator; the two spaces are independent. */
    public record PingEvent() implements Message {
        @Override
        public String action() { return "ping"; }
    }

    public record SilentEvent() implements Message {
        @Override
        public String action() { return "silent"; }
    }

    public record FailingEvent() implements Message {
        @Override
        public String action() { return "failing"; }
    }

    public static final MessageType<Ping> PING = MessageType.of("ping", Ping.class);
    public static final MessageType<Chat> CHAT = MessageType.of("chat", Chat.class);
    public static final MessageType<Boom> BOOM = MessageType.of("boom", Boom.class);
    public static final MessageType<JobDone> JOB_DONE = MessageType.of("job_done", JobDone.class);
    public static final MessageType<PingEvent> PING_EVENT = MessageType.of("ping", PingEvent.class);
    public static final MessageType<SilentEvent> SILENT = MessageType.of("silent", SilentEvent.class);
    public static final MessageType<FailingEvent> FAILING = MessageType.of("failing", FailingEvent.class);

    /** Names of handlers in invocation order. */
    public final List<String> invocations = new CopyOnWriteArrayList<>();

    public SchemaRegistry registry() {
        return SchemaRegistry.builder()
                .client(HandlerDeclaration.on(PING).returning(Pong.class)
                        .handle((connection, ping) -> {
                            invocations.add("ping");
                            return new Pong();
                        }))
                .client(HandlerDeclaration.on(CHAT).documents(ChatNotify.class)
                        .handle((connection, chat) -> {
                            invocations.add("chat");
                            connection.broadcast(new ChatNotify(chat.payload()));
                            return null;
                        }))
                .client(HandlerDeclaration.on(BOOM)
                        .handle((connection, boom) -> {
                            invocations.add("boom");
                            throw new IllegalStateException("boom");
                        }))
                .event(HandlerDeclaration.on(JOB_DONE).returning(JobResult.class)
                        .handle((connection, done) -> {
                            invocations.add("job_done");
                            return new JobResult(done.payload());
                        }))
                .event(HandlerDeclaration.on(PING_EVENT).returning(Pong.class)
                        .handle((connection, ping) -> {
                            invocations.add("ping_event");
                            return new Pong();
                        }))
                .event(HandlerDeclaration.on(SILENT)
                        .handle((connection, silent) -> {
                            invocations.add("silent");
                            return null;
                        }))
                .event(HandlerDeclaration.on(FAILING)
                        .handle((connection, failing) -> {
                            invocations.add("failing");
                            throw new IllegalArgumentException("event failed");
                        }))
                .build();
    }

    public ConnectionType connectionType(DispatchConfig config) {
        return ConnectionType.builder("chat").config(config).registry(registry()).build();
    }

    public static DispatchConfig withCompletion() {
        return DispatchConfig.builder().completionSignalsEnabled(true).build();
    }

    /**
     * Opens a connection outside the actor system and registers it on the channel layer
     * with a receiver that processes envelopes on the sender's thread.
     */
    public static Connection open(ConnectionType type, ChannelLayer layer, ConnectionPipeline pipeline,
                                  RecordingClientSink sink, Identity identity, String... groups) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        Connection connection = new Connection(id, layer.newAddress(type.name()), type, sink, layer, pipeline.enricher());
        connection.setIdentity(identity);
        layer.register(connection.getAddress(), envelope -> deliver(connection, pipeline, envelope));
        connection.setState(ConnectionState.OPEN);
        for (String group : groups) {
            connection.joinGroup(group);
        }
        return connection;
    }

    private static void deliver(Connection connection, ConnectionPipeline pipeline, ChannelEnvelope envelope) {
        switch (envelope.getKind()) {
            case DIRECT -> connection.sendJson(envelope.getContent());
            case GROUP_MESSAGE -> pipeline.enricher().deliver(connection, envelope);
            case EVENT -> pipeline.eventRouter().routeEvent(connection, envelope);
            default -> throw new IllegalStateException("Unhandled kind " + envelope.getKind());
        }
    }
}
