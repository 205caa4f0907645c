/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.connection;

import com.courier.common.config.DispatchConfig;
import com.courier.common.exception.TransportException;
import com.courier.common.model.Identity;
import com.courier.messaging.memory.InMemoryChannelLayer;
import com.courier.server.ChatFixtures;
import com.courier.server.actor.ConnectionPipeline;
import com.courier.server.testing.RecordingClientSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionTest {

    private final InMemoryChannelLayer layer = new InMemoryChannelLayer();
    private final ConnectionType type = new ChatFixtures().connectionType(DispatchConfig.defaults());
    private final ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);

    @AfterEach
    void tearDown() {
        layer.close();
    }

    @Test
    void sendToConnectionRelaysMessageVerbatim() {
        RecordingClientSink senderSink = new RecordingClientSink();
        RecordingClientSink targetSink = new RecordingClientSink();
        Connection sender = ChatFixtures.open(type, layer, pipeline, senderSink, Identity.of("alice"));
        Connection target = ChatFixtures.open(type, layer, pipeline, targetSink, Identity.of("bob"));

        sender.sendToConnection(target.getAddress(), new ChatFixtures.Pong());

        assertThat(targetSink.drain()).singleElement()
                .satisfies(frame -> assertThat(frame.toString()).isEqualTo("{\"action\":\"pong\"}"));
        assertThat(senderSink.drain()).isEmpty();
    }

    @Test
    void groupMembershipIsMirroredOnChannelLayer() {
        Connection connection = ChatFixtures.open(type, layer, pipeline, new RecordingClientSink(), null, "lobby");

        connection.joinGroup("room_1");
        connection.leaveGroup("lobby");

        assertThat(connection.getGroups()).containsExactly("room_1");
        assertThat(layer.groupMembers("room_1")).containsExactly(connection.getAddress());
        assertThat(layer.groupMembers("lobby")).isEmpty();
    }

    @Test
    void closeIsSentOnceAndLaterSendsFail() {
        RecordingClientSink sink = new RecordingClientSink();
        Connection connection = ChatFixtures.open(type, layer, pipeline, sink, null);

        connection.close(CloseReason.NORMAL);
        connection.close(CloseReason.SERVER_ERROR);

        assertThat(connection.getState()).isEqualTo(ConnectionState.CLOSING);
        assertThat(sink.getClosed()).isEqualTo(new RecordingClientSink.Closed(1000, "Normal closure"));
        assertThatThrownBy(() -> connection.send(new ChatFixtures.Pong()))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void originCarriesAddressAndIdentity() {
        Connection connection = ChatFixtures.open(type, layer, pipeline, new RecordingClientSink(), Identity.of("alice"));

        assertThat(connection.origin().address()).isEqualTo(connection.getAddress());
        assertThat(connection.origin().identity()).isEqualTo(Identity.of("alice"));
    }
}
