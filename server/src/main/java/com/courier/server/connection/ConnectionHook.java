/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.connection;

@FunctionalInterface
public interface ConnectionHook {

    void run(Connection connection) throws Exception;
}
