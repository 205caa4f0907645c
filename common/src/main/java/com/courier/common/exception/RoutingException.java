/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.exception;

public class RoutingException extends CourierException {
    public RoutingException(String message) {
        super("COURIER_ROUTING", message);
    }

    public RoutingException(String message, Throwable cause) {
        super("COURIER_ROUTING", message, cause);
    }
}
