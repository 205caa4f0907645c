/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.model;

import java.util.Objects;

/**
 * Authenticated principal attached to a connection. Two identities are the same
 * user when their ids are equal.
 */
public record Identity(String id, String name) {

    public Identity {
        Objects.requireNonNull(id, "id");
    }

    public static Identity of(String id) {
        return new Identity(id, id);
    }

    public boolean sameUser(Identity other) {
        return other != null && id.equals(other.id);
    }
}
