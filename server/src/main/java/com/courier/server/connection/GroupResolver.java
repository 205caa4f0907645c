/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.connection;

import java.util.Collection;

/**
 * Computes the groups an authenticated connection joins, e.g. from its identity or path.
 */
@FunctionalInterface
public interface GroupResolver {

    Collection<String> groupsFor(Connection connection) throws Exception;
}
