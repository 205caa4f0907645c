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

import com.courier.server.connection.CloseReason;
import com.courier.server.connection.ConnectionState;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Scheduler;
import org.apache.pekko.actor.typed.javadsl.AskPattern;

import java.time.Duration;
import java.util.concurrent.CompletionStage;

/**
 * What the web adapter holds for an accepted socket: forwards frames and lifecycle
 * events to the connection actor.
 */
public final class ConnectionHandle {

    private final ActorRef<ConnectionProtocol.Command> actor;
    private final Scheduler scheduler;
    private final Duration askTimeout;
    private final ConnectionProtocol.ConnectionStatus openingStatus;

    ConnectionHandle(ActorRef<ConnectionProtocol.Command> actor, Scheduler scheduler, Duration askTimeout,
                     ConnectionProtocol.ConnectionStatus openingStatus) {
        this.actor = actor;
        this.scheduler = scheduler;
        this.askTimeout = askTimeout;
        this.openingStatus = openingStatus;
    }

    public String getConnectionId() { return openingStatus.connectionId(); }
    public String getAddress() { return openingStatus.address(); }

    /** Whether the authentication gate accepted the connection. */
    public boolean isAccepted() {
        return openingStatus.state() == ConnectionState.OPEN;
    }

    public ConnectionProtocol.ConnectionStatus getOpeningStatus() { return openingStatus; }

    public void receive(String frame) {
        actor.tell(new ConnectionProtocol.ClientFrame(frame));
    }

    public void disconnected(int code) {
        actor.tell(new ConnectionProtocol.Disconnect(code));
    }

    public void close(CloseReason reason) {
        actor.tell(new ConnectionProtocol.Close(reason));
    }

    /** Answered after every frame received before this call has been processed. */
    public CompletionStage<ConnectionProtocol.ConnectionStatus> status() {
        return AskPattern.<ConnectionProtocol.Command, ConnectionProtocol.ConnectionStatus>ask(
                actor, ConnectionProtocol.GetStatus::new, askTimeout, scheduler);
    }
}
