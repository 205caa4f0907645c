/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.exception;

/**
 * Base exception for all Courier errors.
 */
public class CourierException extends RuntimeException {
    private final String errorCode;

    public CourierException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CourierException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
