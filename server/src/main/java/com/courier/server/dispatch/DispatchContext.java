/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.dispatch;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC scope for one unit of dispatch work.
 */
public final class DispatchContext implements AutoCloseable {

    public static final String MESSAGE_ID = "message_id";
    public static final String RECEIVED_ACTION = "received_action";
    public static final String CONNECTION_ID = "connection_id";

    private DispatchContext() {}

    public static DispatchContext open(String connectionId) {
        MDC.put(MESSAGE_ID, UUID.randomUUID().toString().substring(0, 8));
        MDC.put(CONNECTION_ID, connectionId);
        return new DispatchContext();
    }

    public void action(String action) {
        if (action != null) {
            MDC.put(RECEIVED_ACTION, action);
        }
    }

    @Override
    public void close() {
        MDC.remove(MESSAGE_ID);
        MDC.remove(RECEIVED_ACTION);
        MDC.remove(CONNECTION_ID);
    }
}
