/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.messaging.core;

/**
 * What a {@link ChannelEnvelope} carries to a connection.
 */
public enum EnvelopeKind {
    /** Encoded frame to forward verbatim to the client socket. */
    DIRECT,
    /** Group broadcast that the recipient enriches before sending. */
    GROUP_MESSAGE,
    /** Server-side event to run through the recipient's event handlers. */
    EVENT
}
