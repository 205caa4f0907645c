/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.connection;

/**
 * Close codes sent to the client when the server ends a connection.
 */
public record CloseReason(int code, String reason) {

    public static final CloseReason NORMAL = new CloseReason(1000, "Normal closure");
    public static final CloseReason AUTHENTICATION_FAILED = new CloseReason(4003, "Authentication failed");
    public static final CloseReason SERVER_ERROR = new CloseReason(1011, "Internal error");
}
