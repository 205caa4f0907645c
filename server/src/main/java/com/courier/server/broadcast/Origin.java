/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.broadcast;

import com.courier.common.model.Identity;

/**
 * Where a broadcast came from. Both parts are nullable: events published by background
 * jobs usually have no origin connection and no identity.
 */
public record Origin(String address, Identity identity) {

    public static final Origin NONE = new Origin(null, null);
}
