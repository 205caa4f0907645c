/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.message.Message;
import com.courier.common.message.MessageCodec;
import com.courier.common.message.ValidationError;
import com.courier.common.util.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Closed set of message types keyed by discriminator. Selects the unique type named
 * by the frame's discriminator field, then validates the rest of the frame against it.
 * Immutable and safe to share between connections.
 */
public final class DiscriminatedUnion {

    private final MessageCodec codec;
    private final Map<String, MessageType<?>> types;

    DiscriminatedUnion(MessageCodec codec, Map<String, MessageType<?>> types) {
        this.codec = codec;
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public String discriminatorField() { return codec.discriminatorField(); }

    public Set<String> discriminators() { return types.keySet(); }

    public Optional<MessageType<?>> typeFor(String discriminator) {
        return Optional.ofNullable(types.get(discriminator));
    }

    public ValidationOutcome validate(String frame) {
        JsonNode node;
        try {
            node = JsonUtil.readTree(frame);
        } catch (JsonProcessingException e) {
            return new ValidationOutcome.Invalid(null, List.of(
                    ValidationError.of("json_invalid", "Invalid JSON: " + e.getOriginalMessage())));
        }
        return validate(node);
    }

    public ValidationOutcome validate(JsonNode node) {
        String field = codec.discriminatorField();
        if (node == null || !node.isObject()) {
            return new ValidationOutcome.Invalid(null, List.of(
                    ValidationError.of("model_type", "Input should be a valid dictionary")));
        }
        JsonNode tag = node.get(field);
        if (tag == null || tag.isNull()) {
            return new ValidationOutcome.Invalid(null, List.of(ValidationError.of("missing",
                    "Unable to extract tag using discriminator '" + field + "'", field)));
        }
        String discriminator = tag.isTextual() ? tag.asText() : tag.toString();
        MessageType<?> type = tag.isTextual() ? types.get(discriminator) : null;
        if (type == null) {
            return new ValidationOutcome.Invalid(discriminator, List.of(ValidationError.of("unknown_discriminator",
                    "Input tag '" + discriminator + "' found using '" + field
                            + "' does not match any of the expected tags: " + expectedTags(), field)));
        }
        List<ValidationError> errors = type.validate(node);
        if (!errors.isEmpty()) {
            return new ValidationOutcome.Invalid(discriminator, errors);
        }
        try {
            Message message = codec.decode((ObjectNode) node, type.messageClass());
            return new ValidationOutcome.Valid(type, message, (ObjectNode) node);
        } catch (IllegalArgumentException e) {
            return new ValidationOutcome.Invalid(discriminator, List.of(
                    ValidationError.of("value_error", e.getMessage(), discriminator)));
        }
    }

    private String expectedTags() {
        return types.keySet().stream().map(t -> "'" + t + "'").collect(Collectors.joining(", "));
    }
}
