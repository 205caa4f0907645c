/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A typed message travelling over a connection. Implementations are records whose
 * components form the wire body; the discriminator is supplied by {@link #action()}
 * and written under the configured discriminator field by {@link MessageCodec}.
 */
public interface Message {

    @JsonIgnore
    String action();
}
