/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.message;

import java.util.List;
import java.util.Map;

/**
 * Outbound {@code error} frame. The payload is either a list of {@link ValidationError}
 * or a {@code {"detail": ...}} object for handler failures.
 */
public record ErrorMessage(Object payload) implements Message {

    public static final String ACTION = "error";
    public static final String HANDLER_FAILURE_DETAIL = "Failed to process message";

    public static ErrorMessage validation(List<ValidationError> errors) {
        return new ErrorMessage(List.copyOf(errors));
    }

    public static ErrorMessage detail(String detail) {
        return new ErrorMessage(Map.of("detail", detail));
    }

    public static ErrorMessage handlerFailure() {
        return detail(HANDLER_FAILURE_DETAIL);
    }

    @Override
    public String action() { return ACTION; }
}
