/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.broadcast;

import com.courier.common.message.Message;
import com.courier.common.message.MessageCodec;
import com.courier.common.model.Identity;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.messaging.core.ChannelLayer;
import com.courier.server.connection.Connection;
import com.courier.server.dispatch.CompletionSignal;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;

/**
 * Sends group messages through the channel layer and, on the receiving side, injects
 * {@code isMine} and {@code isCurrent} before the frame reaches the client.
 * <p>
 * A connection that belongs to several target groups receives one copy per group.
 * No ordering is guaranteed between different recipients.
 */
public class GroupBroadcastEnricher {

    private static final Logger log = LoggerFactory.getLogger(GroupBroadcastEnricher.class);

    public static final String IS_MINE = "isMine";
    public static final String IS_CURRENT = "isCurrent";

    private final ChannelLayer channelLayer;
    private final MessageCodec codec;

    public GroupBroadcastEnricher(ChannelLayer channelLayer, MessageCodec codec) {
        this.channelLayer = channelLayer;
        this.codec = codec;
    }

    /**
     * Issues one group send per target group. Transport failures propagate to the caller.
     */
    public void broadcast(Origin origin, Message message, Collection<String> targetGroups, boolean excludeOrigin) {
        ChannelEnvelope envelope = new GroupMessage(codec.encode(message), origin, excludeOrigin).toEnvelope();
        for (String group : new LinkedHashSet<>(targetGroups)) {
            log.debug("Broadcasting '{}' to group {} (excludeOrigin={})", message.action(), group, excludeOrigin);
            channelLayer.sendToGroup(group, envelope);
        }
    }

    /**
     * Recipient side of {@link #broadcast}: enriches and sends to the client, followed by
     * {@code group_complete} when signals are on, unless this recipient is the excluded origin.
     *
     * @return true when a frame was sent
     */
    public boolean deliver(Connection recipient, ChannelEnvelope envelope) {
        GroupMessage groupMessage = GroupMessage.fromEnvelope(envelope);
        Origin origin = groupMessage.origin();
        if (groupMessage.excludeOrigin() && isCurrent(origin, recipient.getAddress())) {
            return false;
        }
        recipient.sendJson(enrich(groupMessage.content(), origin, recipient.getAddress(), recipient.getIdentity()));
        CompletionSignal.emitGroupComplete(recipient);
        return true;
    }

    /**
     * Sends a message to one recipient with flags computed against an origin, without
     * going through the channel layer. Used when each group member computes its own
     * reply to a broadcast event. Followed by {@code group_complete} like a channel-layer copy.
     */
    public void deliverLocally(Connection recipient, Origin origin, Message message) {
        recipient.sendJson(enrich(codec.encode(message), origin, recipient.getAddress(), recipient.getIdentity()));
        CompletionSignal.emitGroupComplete(recipient);
    }

    public static ObjectNode enrich(ObjectNode content, Origin origin, String recipientAddress, Identity recipientIdentity) {
        ObjectNode enriched = content.deepCopy();
        enriched.put(IS_MINE, isMine(origin, recipientIdentity));
        enriched.put(IS_CURRENT, isCurrent(origin, recipientAddress));
        return enriched;
    }

    static boolean isMine(Origin origin, Identity recipientIdentity) {
        return origin.identity() != null && origin.identity().sameUser(recipientIdentity);
    }

    static boolean isCurrent(Origin origin, String recipientAddress) {
        return origin.address() != null && origin.address().equals(recipientAddress);
    }
}
