/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.connection;

/**
 * Lifecycle of one socket. Only {@link #OPEN} dispatches client messages and events.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATING,
    OPEN,
    CLOSING,
    CLOSED;

    public boolean canDispatch() {
        return this == OPEN;
    }
}
