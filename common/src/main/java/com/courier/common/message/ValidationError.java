/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.message;

import java.util.List;

/**
 * One structural problem found in an inbound frame.
 *
 * @param type machine-readable kind, e.g. {@code missing} or {@code unknown_discriminator}
 * @param loc  path to the offending value; strings for fields, integers for list indexes
 * @param msg  human-readable description
 */
public record ValidationError(String type, List<Object> loc, String msg) {

    public ValidationError {
        loc = List.copyOf(loc);
    }

    public static ValidationError of(String type, String msg, Object... loc) {
        return new ValidationError(type, List.of(loc), msg);
    }
}
