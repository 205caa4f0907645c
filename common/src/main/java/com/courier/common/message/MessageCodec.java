/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.message;

import com.courier.common.util.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Converts between {@link Message} records and wire objects, writing the discriminator
 * under a configurable field name.
 */
public final class MessageCodec {

    private final String discriminatorField;

    public MessageCodec(String discriminatorField) {
        this.discriminatorField = Objects.requireNonNull(discriminatorField, "discriminatorField");
    }

    public String discriminatorField() { return discriminatorField; }

    public ObjectNode encode(Message message) {
        ObjectNode out = JsonUtil.newObject();
        out.put(discriminatorField, message.action());
        ObjectNode body = JsonUtil.toObjectNode(message);
        body.remove(discriminatorField);
        out.setAll(body);
        return out;
    }

    public String encodeToString(Message message) {
        return JsonUtil.toJson(encode(message));
    }

    /**
     * Binds an already validated wire object to its record type. The discriminator
     * field is stripped first; unknown fields are ignored.
     */
    public <M extends Message> M decode(ObjectNode node, Class<M> type) {
        ObjectNode body = node.deepCopy();
        body.remove(discriminatorField);
        try {
            return JsonUtil.mapper().treeToValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot bind " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
