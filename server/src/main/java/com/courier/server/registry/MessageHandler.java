/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

import com.courier.common.message.Message;
import com.courier.server.connection.Connection;

/**
 * Application logic bound to one discriminator.
 *
 * @param <I> validated input message
 * @param <O> reply message, or {@link Void} when the handler manages its own output
 */
@FunctionalInterface
public interface MessageHandler<I extends Message, O> {

    /**
     * @return the reply to unicast back to the connection, or null for no implicit send
     */
    O handle(Connection connection, I message) throws Exception;
}
