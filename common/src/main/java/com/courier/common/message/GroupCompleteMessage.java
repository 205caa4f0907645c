/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.message;

/**
 * Sent after {@link CompleteMessage} when the unit of work started at least one group broadcast.
 */
public record GroupCompleteMessage() implements Message {

    public static final String ACTION = "group_complete";

    @Override
    public String action() { return ACTION; }
}
