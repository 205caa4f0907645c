/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.exception.ConstructionException;
import com.courier.common.message.AuthenticationMessage;
import com.courier.common.message.CompleteMessage;
import com.courier.common.message.ErrorMessage;
import com.courier.common.message.GroupCompleteMessage;
import com.courier.common.message.Message;
import com.courier.common.message.MessageCodec;
import com.courier.common.config.DispatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Client and event unions plus the handler table for one connection type.
 * Built once at startup from an ordered list of declarations; construction fails fast
 * on duplicate discriminators so an inconsistent registry never serves traffic.
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private static final List<Class<? extends Message>> SYSTEM_MESSAGES = List.of(
            ErrorMessage.class, CompleteMessage.class, GroupCompleteMessage.class, AuthenticationMessage.class);

    private final MessageCodec codec;
    private final DiscriminatedUnion clientUnion;
    private final DiscriminatedUnion eventUnion;
    private final HandlerTable handlerTable;
    private final Set<Class<? extends Message>> outgoingTypes;

    private SchemaRegistry(MessageCodec codec, DiscriminatedUnion clientUnion, DiscriminatedUnion eventUnion,
                           HandlerTable handlerTable, Set<Class<? extends Message>> outgoingTypes) {
        this.codec = codec;
        this.clientUnion = clientUnion;
        this.eventUnion = eventUnion;
        this.handlerTable = handlerTable;
        this.outgoingTypes = Set.copyOf(outgoingTypes);
    }

    public static Builder builder() {
        return new Builder(DispatchConfig.DEFAULT_DISCRIMINATOR_FIELD);
    }

    public static Builder builder(String discriminatorField) {
        return new Builder(discriminatorField);
    }

    public MessageCodec codec() { return codec; }
    public String discriminatorField() { return codec.discriminatorField(); }
    public DiscriminatedUnion clientUnion() { return clientUnion; }
    public DiscriminatedUnion eventUnion() { return eventUnion; }
    public HandlerTable handlerTable() { return handlerTable; }

    /** Every message type this connection type may send: declared replies, documented outputs and system messages. */
    public Set<Class<? extends Message>> outgoingTypes() { return outgoingTypes; }

    public static final class Builder {
        private final String discriminatorField;
        private final List<HandlerDeclaration<?, ?>> clientDeclarations = new ArrayList<>();
        private final List<HandlerDeclaration<?, ?>> eventDeclarations = new ArrayList<>();

        private Builder(String discriminatorField) {
            this.discriminatorField = discriminatorField;
        }

        public Builder client(HandlerDeclaration<?, ?> declaration) {
            clientDeclarations.add(declaration);
            return this;
        }

        public Builder client(HandlerDeclaration.Builder<?, ?> declaration) {
            return client(declaration.build());
        }

        public Builder event(HandlerDeclaration<?, ?> declaration) {
            eventDeclarations.add(declaration);
            return this;
        }

        public Builder event(HandlerDeclaration.Builder<?, ?> declaration) {
            return event(declaration.build());
        }

        public SchemaRegistry build() {
            MessageCodec codec = new MessageCodec(discriminatorField);
            Map<Direction, Map<String, HandlerBinding>> bindings = new EnumMap<>(Direction.class);
            bindings.put(Direction.CLIENT, bind(Direction.CLIENT, clientDeclarations));
            bindings.put(Direction.EVENT, bind(Direction.EVENT, eventDeclarations));

            Set<Class<? extends Message>> outgoing = new LinkedHashSet<>();
            for (Map<String, HandlerBinding> byDiscriminator : bindings.values()) {
                for (HandlerBinding binding : byDiscriminator.values()) {
                    if (binding.outputType() != Void.class) {
                        outgoing.add(binding.outputType().asSubclass(Message.class));
                    }
                    outgoing.addAll(binding.metadata().documentedOutputs());
                }
            }
            outgoing.addAll(SYSTEM_MESSAGES);

            SchemaRegistry registry = new SchemaRegistry(codec,
                    new DiscriminatedUnion(codec, types(bindings.get(Direction.CLIENT))),
                    new DiscriminatedUnion(codec, types(bindings.get(Direction.EVENT))),
                    new HandlerTable(bindings),
                    outgoing);
            log.info("Schema registry built: {} client handler(s), {} event handler(s), discriminator '{}'",
                    clientDeclarations.size(), eventDeclarations.size(), discriminatorField);
            return registry;
        }

        private static Map<String, HandlerBinding> bind(Direction direction, List<HandlerDeclaration<?, ?>> declarations) {
            Map<String, HandlerBinding> byDiscriminator = new LinkedHashMap<>();
            for (HandlerDeclaration<?, ?> declaration : declarations) {
                HandlerBinding binding = new HandlerBinding(direction, declaration);
                HandlerBinding existing = byDiscriminator.putIfAbsent(binding.discriminator(), binding);
                if (existing != null) {
                    throw new ConstructionException("Duplicate " + direction.name().toLowerCase()
                            + " discriminator '" + binding.discriminator() + "' declared by "
                            + existing.name() + " and " + binding.name());
                }
                log.debug("Bound {} handler {} to '{}'", direction, binding.name(), binding.discriminator());
            }
            return byDiscriminator;
        }

        private static Map<String, MessageType<?>> types(Map<String, HandlerBinding> bindings) {
            Map<String, MessageType<?>> types = new LinkedHashMap<>();
            bindings.forEach((discriminator, binding) -> types.put(discriminator, binding.inputType()));
            return types;
        }
    }
}
