/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.dispatch;

import com.courier.common.message.Message;

/**
 * What a handler invocation produced.
 */
public sealed interface HandlerResult permits HandlerResult.Reply, HandlerResult.NoReply {

    record Reply(Message message) implements HandlerResult {}

    record NoReply() implements HandlerResult {}

    static HandlerResult of(Object returned) {
        if (returned == null) {
            return new NoReply();
        }
        if (returned instanceof Message message) {
            return new Reply(message);
        }
        throw new IllegalStateException("Handler returned " + returned.getClass().getName()
                + " which is not a message");
    }
}
