/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AuthenticationMessage(Payload payload) implements Message {

    public static final String ACTION = "authentication";

    public record Payload(@JsonProperty("status_code") int statusCode,
                          @JsonProperty("status_text") String statusText,
                          Object data) {
    }

    @Override
    public String action() { return ACTION; }
}
