/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.connection;

import com.courier.common.config.DispatchConfig;
import com.courier.common.message.Message;
import com.courier.common.model.Identity;
import com.courier.common.util.JsonUtil;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.messaging.core.ChannelLayer;
import com.courier.server.broadcast.GroupBroadcastEnricher;
import com.courier.server.broadcast.Origin;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One live socket. Group membership is only touched from the connection's own actor,
 * so it is not synchronized; state and identity are volatile because status queries
 * may read them from elsewhere.
 */
public class Connection {

    private static final Logger log = LoggerFactory.getLogger(Connection.class);

    private final String id;
    private final String address;
    private final ConnectionType type;
    private final ClientSink sink;
    private final ChannelLayer channelLayer;
    private final GroupBroadcastEnricher enricher;
    private final Set<String> groups = new LinkedHashSet<>();

    private volatile Identity identity;
    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile Instant lastActivity = Instant.now();

    public Connection(String id, String address, ConnectionType type, ClientSink sink,
                      ChannelLayer channelLayer, GroupBroadcastEnricher enricher) {
        this.id = id;
        this.address = address;
        this.type = type;
        this.sink = sink;
        this.channelLayer = channelLayer;
        this.enricher = enricher;
    }

    public String getId() { return id; }
    public String getAddress() { return address; }
    public ConnectionType getType() { return type; }
    public Identity getIdentity() { return identity; }
    public void setIdentity(Identity identity) { this.identity = identity; }
    public ConnectionState getState() { return state; }
    public Instant getLastActivity() { return lastActivity; }
    public Set<String> getGroups() { return Set.copyOf(groups); }

    public void setState(ConnectionState state) {
        if (this.state != state) {
            log.debug("Connection {} {} -> {}", id, this.state, state);
            this.state = state;
        }
    }

    public Origin origin() {
        return new Origin(address, identity);
    }

    public void touch() {
        lastActivity = Instant.now();
    }

    public void send(Message message) {
        sendJson(type.registry().codec().encode(message));
    }

    public void sendJson(ObjectNode content) {
        String frame = JsonUtil.toJson(content);
        DispatchConfig config = type.config();
        if (config.logSentMessages()) {
            JsonNode action = content.get(config.discriminatorField());
            if (action == null || !config.isIgnoredForLogging(action.asText())) {
                log.info("Sent websocket json: {}", frame);
            }
        }
        sink.send(frame);
        touch();
    }

    public void joinGroup(String group) {
        channelLayer.joinGroup(group, address);
        groups.add(group);
    }

    public void leaveGroup(String group) {
        channelLayer.leaveGroup(group, address);
        groups.remove(group);
    }

    /** Broadcasts to every group this connection belongs to. */
    public void broadcast(Message message) {
        broadcast(message, groups, false);
    }

    public void broadcast(Message message, Collection<String> targetGroups, boolean excludeOrigin) {
        List<String> targets = List.copyOf(targetGroups);
        if (targets.isEmpty()) {
            log.debug("Connection {} broadcast '{}' with no target groups", id, message.action());
            return;
        }
        enricher.broadcast(origin(), message, targets, excludeOrigin);
    }

    /** Relays an encoded message to another connection, which forwards it verbatim. */
    public void sendToConnection(String targetAddress, Message message) {
        channelLayer.sendToConnection(targetAddress,
                ChannelEnvelope.direct(type.registry().codec().encode(message)));
    }

    public void close(CloseReason reason) {
        if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) {
            return;
        }
        setState(ConnectionState.CLOSING);
        log.info("Closing connection {} ({} {})", id, reason.code(), reason.reason());
        sink.close(reason.code(), reason.reason());
    }

    @Override
    public String toString() {
        return "Connection{" + id + ", " + address + ", " + state + "}";
    }
}
