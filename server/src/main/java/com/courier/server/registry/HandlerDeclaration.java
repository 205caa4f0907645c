/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.exception.ConstructionException;
import com.courier.common.message.Message;
import com.courier.common.util.Names;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One handler as declared by application code, before it is bound in a registry.
 * <pre>
 * HandlerDeclaration.on(PING).returning(Pong.class).handle((conn, ping) -&gt; new Pong()).build();
 * </pre>
 * The route name defaults to {@code handle_<discriminator>}; explicit names are normalized
 * to snake_case.
 *
 * @param <I> input message
 * @param <O> reply message or {@link Void}
 */
public final class HandlerDeclaration<I extends Message, O> {

    private final MessageType<I> inputType;
    private final Class<O> outputType;
    private final MessageHandler<I, O> handler;
    private final HandlerMetadata metadata;

    private HandlerDeclaration(Builder<I, O> builder) {
        this.inputType = builder.inputType;
        this.outputType = builder.outputType;
        this.handler = builder.handler;
        this.metadata = new HandlerMetadata(builder.name, builder.summary, builder.description,
                builder.tags, builder.documentedOutputs);
    }

    public static <I extends Message> Builder<I, Void> on(MessageType<I> inputType) {
        if (inputType == null) {
            throw new ConstructionException("Handler declared without an input message type");
        }
        return new Builder<>(inputType, Void.class);
    }

    public MessageType<I> inputType() { return inputType; }
    public Class<O> outputType() { return outputType; }
    public MessageHandler<I, O> handler() { return handler; }
    public HandlerMetadata metadata() { return metadata; }
    public String name() { return metadata.name(); }

    public boolean hasReply() {
        return outputType != Void.class;
    }

    public static final class Builder<I extends Message, O> {
        private final MessageType<I> inputType;
        private final Class<O> outputType;
        private MessageHandler<I, O> handler;
        private String name;
        private String summary;
        private String description;
        private final List<String> tags = new ArrayList<>();
        private final List<Class<? extends Message>> documentedOutputs = new ArrayList<>();

        private Builder(MessageType<I> inputType, Class<O> outputType) {
            this.inputType = inputType;
            this.outputType = outputType;
        }

        /** Declares the reply type. Must be called before {@link #handle}. */
        public <R extends Message> Builder<I, R> returning(Class<R> replyType) {
            if (handler != null) {
                throw new IllegalStateException("returning() must be declared before handle()");
            }
            Builder<I, R> next = new Builder<>(inputType, replyType);
            next.name = name;
            next.summary = summary;
            next.description = description;
            next.tags.addAll(tags);
            next.documentedOutputs.addAll(documentedOutputs);
            return next;
        }

        public Builder<I, O> handle(MessageHandler<I, O> handler) {
            this.handler = handler;
            return this;
        }

        public Builder<I, O> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<I, O> summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder<I, O> description(String description) {
            this.description = description;
            return this;
        }

        public Builder<I, O> tags(String... tags) {
            this.tags.addAll(Arrays.asList(tags));
            return this;
        }

        /**
         * Output types listed for documentation only, e.g. messages the handler sends
         * explicitly or broadcasts. They never change dispatch behaviour.
         */
        @SafeVarargs
        public final Builder<I, O> documents(Class<? extends Message>... outputs) {
            this.documentedOutputs.addAll(Arrays.asList(outputs));
            return this;
        }

        public HandlerDeclaration<I, O> build() {
            if (handler == null) {
                throw new ConstructionException("Handler for '" + inputType.discriminator() + "' has no handler function");
            }
            name = name == null || name.isBlank()
                    ? "handle_" + Names.toSnakeCase(inputType.discriminator())
                    : Names.toSnakeCase(name);
            if (outputType != Void.class && !documentedOutputs.isEmpty()
                    && documentedOutputs.stream().noneMatch(d -> d.isAssignableFrom(outputType))) {
                throw new ConstructionException("Handler " + name + " returns " + outputType.getSimpleName()
                        + " but documents only " + documentedOutputs.stream().map(Class::getSimpleName).toList());
            }
            return new HandlerDeclaration<>(this);
        }
    }
}
