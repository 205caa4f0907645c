/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.messaging.core;

/**
 * Callback interface for envelopes addressed to one connection.
 * Implementations must be thread-safe.
 */
@FunctionalInterface
public interface ChannelReceiver {
    /**
     * Called when an envelope arrives for the registered address, either sent to it
     * directly or fanned out through one of its groups.
     * @param envelope the envelope, already stamped with delivery mode and target
     */
    void onEnvelope(ChannelEnvelope envelope);
}
