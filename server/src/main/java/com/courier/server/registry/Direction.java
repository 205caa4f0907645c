/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.registry;

/**
 * Which discriminator space a handler is bound in.
 */
public enum Direction {
    /** Frames sent by the client over the socket. */
    CLIENT,
    /** Events injected through the channel layer by server-side code. */
    EVENT
}
