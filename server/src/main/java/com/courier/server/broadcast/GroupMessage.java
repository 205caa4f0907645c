/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.broadcast;

import com.courier.common.model.Identity;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.messaging.core.EnvelopeKind;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encoded outbound message plus the origin data each recipient needs to compute its flags.
 */
public record GroupMessage(ObjectNode content, Origin origin, boolean excludeOrigin) {

    public ChannelEnvelope toEnvelope() {
        return ChannelEnvelope.of(EnvelopeKind.GROUP_MESSAGE, content, originHeaders(origin))
                .withHeader(ChannelEnvelope.HEADER_EXCLUDE_ORIGIN, Boolean.toString(excludeOrigin));
    }

    public static GroupMessage fromEnvelope(ChannelEnvelope envelope) {
        return new GroupMessage(envelope.getContent(), originFrom(envelope),
                Boolean.parseBoolean(envelope.getHeader(ChannelEnvelope.HEADER_EXCLUDE_ORIGIN)));
    }

    public static Map<String, String> originHeaders(Origin origin) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (origin.address() != null) {
            headers.put(ChannelEnvelope.HEADER_ORIGIN_ADDRESS, origin.address());
        }
        if (origin.identity() != null) {
            headers.put(ChannelEnvelope.HEADER_ORIGIN_USER_ID, origin.identity().id());
            if (origin.identity().name() != null) {
                headers.put(ChannelEnvelope.HEADER_ORIGIN_USER_NAME, origin.identity().name());
            }
        }
        return headers;
    }

    /** Reads the origin carried in an envelope's headers; {@link Origin#NONE} when absent. */
    public static Origin originFrom(ChannelEnvelope envelope) {
        String userId = envelope.getHeader(ChannelEnvelope.HEADER_ORIGIN_USER_ID);
        Identity identity = userId == null ? null
                : new Identity(userId, envelope.getHeader(ChannelEnvelope.HEADER_ORIGIN_USER_NAME));
        return new Origin(envelope.getHeader(ChannelEnvelope.HEADER_ORIGIN_ADDRESS), identity);
    }
}
