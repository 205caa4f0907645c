/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.connection;

/**
 * Outbound side of the client socket, supplied by the web adapter.
 * Implementations may throw {@link com.courier.common.exception.TransportException}.
 */
public interface ClientSink {

    void send(String frame);

    void close(int code, String reason);
}
