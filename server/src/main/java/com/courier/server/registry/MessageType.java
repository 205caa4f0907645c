/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.exception.ConstructionException;
import com.courier.common.message.Message;
import com.courier.common.message.ValidationError;
import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Objects;

/**
 * Immutable descriptor binding a discriminator value to a message record type.
 *
 * @param <M> the message record
 */
public final class MessageType<M extends Message> {

    private final String discriminator;
    private final Class<M> messageClass;
    private final Class<?> payloadType;

    private MessageType(String discriminator, Class<M> messageClass) {
        this.discriminator = discriminator;
        this.messageClass = messageClass;
        this.payloadType = findPayloadType(messageClass);
    }

    public static <M extends Message> MessageType<M> of(String discriminator, Class<M> messageClass) {
        if (discriminator == null || discriminator.isBlank()) {
            throw new ConstructionException("Message type needs a discriminator value");
        }
        Objects.requireNonNull(messageClass, "messageClass");
        if (!messageClass.isRecord()) {
            throw new ConstructionException("Message type '" + discriminator + "' must be a record: "
                    + messageClass.getName());
        }
        return new MessageType<>(discriminator, messageClass);
    }

    private static Class<?> findPayloadType(Class<?> messageClass) {
        for (RecordComponent component : messageClass.getRecordComponents()) {
            if ("payload".equals(component.getName())) {
                return component.getType();
            }
        }
        return null;
    }

    public String discriminator() { return discriminator; }

    public Class<M> messageClass() { return messageClass; }

    /** Type of the {@code payload} component, or null when the message carries none. */
    public Class<?> payloadType() { return payloadType; }

    /**
     * Structurally checks a wire object against this type. Error locations start with
     * the discriminator value.
     */
    public List<ValidationError> validate(JsonNode node) {
        return PayloadValidator.validate(messageClass, node, List.of(discriminator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageType<?> other)) return false;
        return discriminator.equals(other.discriminator) && messageClass.equals(other.messageClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(discriminator, messageClass);
    }

    @Override
    public String toString() {
        return "MessageType{" + discriminator + " -> " + messageClass.getSimpleName() + "}";
    }
}
