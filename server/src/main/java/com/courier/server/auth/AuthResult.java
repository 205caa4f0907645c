/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.auth;

import com.courier.common.model.Identity;

/**
 * Outcome of the authentication gate. The status fields are echoed to the client in
 * the {@code authentication} message.
 *
 * @param identity null for anonymous connections
 */
public record AuthResult(boolean authenticated, Identity identity, int statusCode, String statusText, Object data) {

    public static AuthResult success(Identity identity) {
        return new AuthResult(true, identity, 200, "OK", null);
    }

    public static AuthResult success(Identity identity, Object data) {
        return new AuthResult(true, identity, 200, "OK", data);
    }

    public static AuthResult failure(int statusCode, String statusText, Object data) {
        return new AuthResult(false, null, statusCode, statusText, data);
    }
}
