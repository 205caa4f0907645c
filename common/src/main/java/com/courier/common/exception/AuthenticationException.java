/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.courier.common.exception;

public class AuthenticationException extends CourierException {
    public AuthenticationException(String message) {
        super("COURIER_AUTH_FAILED", message);
    }
}
