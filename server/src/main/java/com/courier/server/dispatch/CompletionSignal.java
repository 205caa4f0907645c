/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.dispatch;

import com.courier.common.config.DispatchConfig;
import com.courier.common.message.CompleteMessage;
import com.courier.common.message.GroupCompleteMessage;
import com.courier.common.message.Message;
import com.courier.server.connection.Connection;

public enum CompletionSignal {
    MESSAGE_COMPLETE(new CompleteMessage()),
    GROUP_COMPLETE(new GroupCompleteMessage());

    private final Message message;

    CompletionSignal(Message message) {
        this.message = message;
    }

    public Message toMessage() { return message; }

    public String action() { return message.action(); }

    /**
     * Ends a unit of work on a connection with {@code complete}. No-op when signals are
     * disabled.
     */
    public static void emit(Connection connection, DispatchConfig config) {
        if (config.completionSignalsEnabled()) {
            connection.send(MESSAGE_COMPLETE.toMessage());
        }
    }

    /**
     * Follows a group message delivered to {@code recipient}. Sent by the recipient after
     * its own copy, so it never overtakes the message it closes.
     */
    public static void emitGroupComplete(Connection recipient) {
        if (recipient.getType().config().completionSignalsEnabled()) {
            recipient.send(GROUP_COMPLETE.toMessage());
        }
    }
}
