/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.auth;

/**
 * Pre-dispatch gate run once per connection. Permission evaluation beyond yielding an
 * identity or rejecting is left to the application.
 * <p>
 * Throwing {@link com.courier.common.exception.AuthenticationException} rejects with 401
 * and the exception message as detail; any other exception rejects with 500.
 */
@FunctionalInterface
public interface Authenticator {

    AuthResult authenticate(HandshakeRequest request) throws Exception;
}
