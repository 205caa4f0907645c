/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.messaging.core;

/**
 * How an envelope reached the receiving connection.
 */
public enum Delivery {
    UNICAST,
    BROADCAST
}
