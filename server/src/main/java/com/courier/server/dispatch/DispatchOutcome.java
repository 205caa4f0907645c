/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.dispatch;

public enum DispatchOutcome {
    /** Handler ran and returned. */
    HANDLED,
    /** Input failed validation or routing; no handler ran. */
    REJECTED,
    /** Handler threw; a generic error was reported. */
    FAILED,
    /** Connection was not open. */
    DROPPED
}
