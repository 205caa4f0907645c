/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.auth;

import java.util.Map;

/**
 * What the web adapter knows about a socket when it is accepted. Header names are
 * matched case-insensitively by {@link #header(String)}.
 */
public record HandshakeRequest(String path,
                               Map<String, String> headers,
                               Map<String, String> queryParams) {

    public HandshakeRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        queryParams = queryParams == null ? Map.of() : Map.copyOf(queryParams);
    }

    public static HandshakeRequest of(String path) {
        return new HandshakeRequest(path, Map.of(), Map.of());
    }

    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public String queryParam(String name) {
        return queryParams.get(name);
    }
}
