/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.common.message;

/**
 * Marks the end of the outbound frames produced for one inbound message or event.
 */
public record CompleteMessage() implements Message {

    public static final String ACTION = "complete";

    @Override
    public String action() { return ACTION; }
}
