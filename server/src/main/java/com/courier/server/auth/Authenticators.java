/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.auth;

import com.courier.common.model.Identity;

import java.util.Map;

public final class Authenticators {

    private Authenticators() {}

    /** Accepts every connection anonymously. */
    public static Authenticator allowAll() {
        return request -> AuthResult.success(null);
    }

    /**
     * Resolves a bearer token from the {@code Authorization} header, falling back to the
     * {@code token} query parameter. Unknown or absent tokens are rejected with 401.
     */
    public static Authenticator bearerTokens(Map<String, Identity> tokens) {
        Map<String, Identity> known = Map.copyOf(tokens);
        return request -> {
            String token = null;
            String header = request.header("Authorization");
            if (header != null && header.regionMatches(true, 0, "Bearer ", 0, 7)) {
                token = header.substring(7).trim();
            } else if (request.queryParam("token") != null) {
                token = request.queryParam("token");
            }
            Identity identity = token == null ? null : known.get(token);
            if (identity == null) {
                return AuthResult.failure(401, "Unauthorized",
                        Map.of("detail", "Authentication credentials were not provided or are invalid."));
            }
            return AuthResult.success(identity);
        };
    }
}
