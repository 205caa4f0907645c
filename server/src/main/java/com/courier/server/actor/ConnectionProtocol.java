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

import com.courier.common.model.Identity;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.server.auth.HandshakeRequest;
import com.courier.server.connection.CloseReason;
import com.courier.server.connection.ConnectionState;
import org.apache.pekko.actor.typed.ActorRef;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Protocol messages for connection actors.
 */
public final class ConnectionProtocol {

    private ConnectionProtocol() {}

    /** Sealed interface for all connection commands */
    public sealed interface Command permits Connect, ClientFrame, ChannelDelivery, Close, Disconnect, GetStatus {}

    /**
     * Runs the authentication gate and opens the connection. {@code abandoned} is set by the
     * caller once it stops waiting for the reply; the actor then closes instead of opening.
     */
    public record Connect(HandshakeRequest request, ActorRef<ConnectionStatus> replyTo,
                          AtomicBoolean abandoned) implements Command {

        public Connect(HandshakeRequest request, ActorRef<ConnectionStatus> replyTo) {
            this(request, replyTo, new AtomicBoolean(false));
        }
    }

    /** Text frame received from the client socket */
    public record ClientFrame(String text) implements Command {}

    /** Envelope delivered by the channel layer to this connection's address */
    public record ChannelDelivery(ChannelEnvelope envelope) implements Command {}

    /** Server-initiated close */
    public record Close(CloseReason reason) implements Command {}

    /** The client socket went away */
    public record Disconnect(int code) implements Command {}

    public record GetStatus(ActorRef<ConnectionStatus> replyTo) implements Command {}

    /** Status snapshot */
    public record ConnectionStatus(String connectionId,
                                   String address,
                                   ConnectionState state,
                                   Identity identity,
                                   Set<String> groups,
                                   long processedFrames,
                                   Instant lastActivity) {}
}
