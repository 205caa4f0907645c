/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.exception;

/**
 * Failure of a channel layer primitive. Fatal to the send, not to the connection.
 */
public class TransportException extends CourierException {
    public TransportException(String message) {
        super("COURIER_TRANSPORT", message);
    }

    public TransportException(String message, Throwable cause) {
        super("COURIER_TRANSPORT", message, cause);
    }
}
