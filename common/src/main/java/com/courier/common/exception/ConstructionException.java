/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.exception;

/**
 * Raised while building a schema registry: duplicate discriminators, missing input
 * types or documented outputs that contradict the handler's return type.
 */
public class ConstructionException extends CourierException {
    public ConstructionException(String message) {
        super("COURIER_CONSTRUCTION", message);
    }
}
