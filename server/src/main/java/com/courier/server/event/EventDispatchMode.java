/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.event;

import com.courier.messaging.core.Delivery;

/**
 * How an event reached the receiving connection. Decides where a handler's reply goes.
 */
public enum EventDispatchMode {
    /** Sent to this connection's address; the reply goes back to this connection. */
    UNICAST,
    /** Fanned out to a group; the reply is group-enriched against the event's origin. */
    BROADCAST;

    public static EventDispatchMode from(Delivery delivery) {
        return delivery == Delivery.BROADCAST ? BROADCAST : UNICAST;
    }
}
