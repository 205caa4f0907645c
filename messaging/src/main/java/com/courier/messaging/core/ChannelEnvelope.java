/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.messaging.core;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope wrapping any content traversing the channel layer. Immutable; the layer
 * stamps the delivery mode and target with {@link #deliveredVia(Delivery, String)}.
 */
public final class ChannelEnvelope {

    public static final String HEADER_ORIGIN_ADDRESS = "origin_address";
    public static final String HEADER_ORIGIN_USER_ID = "origin_user_id";
    public static final String HEADER_ORIGIN_USER_NAME = "origin_user_name";
    public static final String HEADER_EXCLUDE_ORIGIN = "exclude_origin";

    private final String messageId;
    private final EnvelopeKind kind;
    private final ObjectNode content;
    private final Map<String, String> headers;
    private final Instant timestamp;
    private final Delivery delivery;
    private final String target;

    private ChannelEnvelope(String messageId, EnvelopeKind kind, ObjectNode content, Map<String, String> headers,
                            Instant timestamp, Delivery delivery, String target) {
        this.messageId = messageId;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.content = Objects.requireNonNull(content, "content");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.timestamp = timestamp;
        this.delivery = delivery;
        this.target = target;
    }

    public static ChannelEnvelope of(EnvelopeKind kind, ObjectNode content, Map<String, String> headers) {
        return new ChannelEnvelope(UUID.randomUUID().toString(), kind, content, headers, Instant.now(), null, null);
    }

    public static ChannelEnvelope direct(ObjectNode content) {
        return of(EnvelopeKind.DIRECT, content, Map.of());
    }

    public static ChannelEnvelope event(ObjectNode content) {
        return of(EnvelopeKind.EVENT, content, Map.of());
    }

    public ChannelEnvelope withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ChannelEnvelope(messageId, kind, content, copy, timestamp, delivery, target);
    }

    public ChannelEnvelope deliveredVia(Delivery delivery, String target) {
        return new ChannelEnvelope(messageId, kind, content, headers, timestamp, delivery, target);
    }

    public String getMessageId() { return messageId; }
    public EnvelopeKind getKind() { return kind; }
    /** Shared between recipients; copy before mutating. */
    public ObjectNode getContent() { return content; }
    public Map<String, String> getHeaders() { return headers; }
    public String getHeader(String name) { return headers.get(name); }
    public Instant getTimestamp() { return timestamp; }
    public Delivery getDelivery() { return delivery; }
    public String getTarget() { return target; }

    @Override
    public String toString() {
        return "ChannelEnvelope{" + kind + ", id=" + messageId + ", delivery=" + delivery + ", target=" + target + "}";
    }
}
