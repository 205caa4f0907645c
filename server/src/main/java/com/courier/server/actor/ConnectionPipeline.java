/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.courier.server.actor;

import com.courier.messaging.core.ChannelLayer;
import com.courier.server.broadcast.GroupBroadcastEnricher;
import com.courier.server.connection.ConnectionType;
import com.courier.server.dispatch.Dispatcher;
import com.courier.server.event.EventRouter;

/**
 * Stateless dispatch components shared by every connection of one type on one channel layer.
 */
public record ConnectionPipeline(Dispatcher dispatcher, EventRouter eventRouter, GroupBroadcastEnricher enricher) {

    public static ConnectionPipeline create(ConnectionType type, ChannelLayer channelLayer) {
        GroupBroadcastEnricher enricher = new GroupBroadcastEnricher(channelLayer, type.registry().codec());
        return new ConnectionPipeline(
                new Dispatcher(type.registry(), type.config()),
                new EventRouter(type.registry(), type.config(), enricher),
                enricher);
    }
}
