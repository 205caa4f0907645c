/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.event;

import com.courier.common.config.DispatchConfig;
import com.courier.common.exception.RoutingException;
import com.courier.common.model.Identity;
import com.courier.common.util.JsonUtil;
import com.courier.messaging.memory.InMemoryChannelLayer;
import com.courier.messaging.testing.CapturingChannelLayer;
import com.courier.server.ChatFixtures;
import com.courier.server.ChatFixtures.JobDone;
import com.courier.server.ChatFixtures.JobPayload;
import com.courier.server.actor.ConnectionPipeline;
import com.courier.server.broadcast.Origin;
import com.courier.server.connection.Connection;
import com.courier.server.connection.ConnectionState;
import com.courier.server.connection.ConnectionType;
import com.courier.server.dispatch.DispatchOutcome;
import com.courier.server.testing.RecordingClientSink;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRouterTest {

    private final InMemoryChannelLayer layer = new InMemoryChannelLayer();
    private final ChatFixtures fixtures = new ChatFixtures();

    @AfterEach
    void tearDown() {
        layer.close();
    }

    private static List<String> frames(RecordingClientSink sink) {
        return sink.drain().stream().map(ObjectNode::toString).toList();
    }

    private static JobDone jobDone(String id) {
        return new JobDone(new JobPayload(id));
    }

    @Test
    void broadcastEventReachesEveryGroupMemberWithFlagsAgainstNoOrigin() {
        ConnectionType type = fixtures.connectionType(ChatFixtures.withCompletion());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink a = new RecordingClientSink();
        RecordingClientSink b = new RecordingClientSink();
        RecordingClientSink outsider = new RecordingClientSink();
        ChatFixtures.open(type, layer, pipeline, a, Identity.of("alice"), "room_1");
        ChatFixtures.open(type, layer, pipeline, b, null, "room_1");
        ChatFixtures.open(type, layer, pipeline, outsider, Identity.of("carol"), "room_2");

        new EventPublisher(layer, type.registry()).broadcastEvent("room_1", jobDone("j1"));

        String expected = "{\"action\":\"job_result\",\"payload\":{\"jobId\":\"j1\"},\"isMine\":false,\"isCurrent\":false}";
        assertThat(frames(a)).containsExactly(expected, "{\"action\":\"group_complete\"}", "{\"action\":\"complete\"}");
        assertThat(frames(b)).containsExactly(expected, "{\"action\":\"group_complete\"}", "{\"action\":\"complete\"}");
        assertThat(outsider.drain()).isEmpty();
        assertThat(fixtures.invocations).containsExactly("job_done", "job_done");
    }

    @Test
    void broadcastEventFlagsAreComputedAgainstDeclaredOrigin() {
        ConnectionType type = fixtures.connectionType(DispatchConfig.defaults());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink aliceSink = new RecordingClientSink();
        RecordingClientSink bobSink = new RecordingClientSink();
        Connection alice = ChatFixtures.open(type, layer, pipeline, aliceSink, Identity.of("alice"), "room_1");
        ChatFixtures.open(type, layer, pipeline, bobSink, Identity.of("bob"), "room_1");

        new EventPublisher(layer, type.registry())
                .broadcastEvent(List.of("room_1"), jobDone("j2"), alice.origin());

        ObjectNode own = aliceSink.drain().get(0);
        assertThat(own.get("isMine").asBoolean()).isTrue();
        assertThat(own.get("isCurrent").asBoolean()).isTrue();
        ObjectNode other = bobSink.drain().get(0);
        assertThat(other.get("isMine").asBoolean()).isFalse();
        assertThat(other.get("isCurrent").asBoolean()).isFalse();
    }

    @Test
    void unicastEventReplyGoesToThatConnectionOnly() {
        ConnectionType type = fixtures.connectionType(ChatFixtures.withCompletion());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink targetSink = new RecordingClientSink();
        RecordingClientSink otherSink = new RecordingClientSink();
        Connection target = ChatFixtures.open(type, layer, pipeline, targetSink, null, "room_1");
        ChatFixtures.open(type, layer, pipeline, otherSink, null, "room_1");

        new EventPublisher(layer, type.registry()).sendEvent(target.getAddress(), jobDone("j3"));

        assertThat(frames(targetSink)).containsExactly(
                "{\"action\":\"job_result\",\"payload\":{\"jobId\":\"j3\"}}", "{\"action\":\"complete\"}");
        assertThat(otherSink.drain()).isEmpty();
    }

    @Test
    void eventAndClientDiscriminatorsAreIndependent() {
        ConnectionType type = fixtures.connectionType(DispatchConfig.defaults());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        Connection target = ChatFixtures.open(type, layer, pipeline, new RecordingClientSink(), null);

        new EventPublisher(layer, type.registry()).sendEvent(target.getAddress(), new ChatFixtures.PingEvent());

        assertThat(fixtures.invocations).containsExactly("ping_event");
    }

    @Test
    void noneResultSendsNothingButCompletes() {
        ConnectionType type = fixtures.connectionType(ChatFixtures.withCompletion());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink sink = new RecordingClientSink();
        Connection target = ChatFixtures.open(type, layer, pipeline, sink, null);

        new EventPublisher(layer, type.registry()).sendEvent(target.getAddress(), new ChatFixtures.SilentEvent());

        assertThat(frames(sink)).containsExactly("{\"action\":\"complete\"}");
    }

    @Test
    void unknownEventIsDroppedSilentlyByDefault() {
        ConnectionType type = fixtures.connectionType(ChatFixtures.withCompletion());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink sink = new RecordingClientSink();
        Connection target = ChatFixtures.open(type, layer, pipeline, sink, null);
        ObjectNode raw = JsonUtil.newObject().put("action", "nope");

        DispatchOutcome outcome = pipeline.eventRouter().routeEvent(target, raw, EventDispatchMode.UNICAST,
                List.of(target.getAddress()), Origin.NONE);

        assertThat(outcome).isEqualTo(DispatchOutcome.REJECTED);
        assertThat(sink.drain()).isEmpty();
        assertThat(target.getState()).isEqualTo(ConnectionState.OPEN);
    }

    @Test
    void unicastRoutingErrorCanBeReportedToTheConnection() {
        DispatchConfig config = ChatFixtures.withCompletion().toBuilder().notifyUnicastEventErrors(true).build();
        ConnectionType type = fixtures.connectionType(config);
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink sink = new RecordingClientSink();
        Connection target = ChatFixtures.open(type, layer, pipeline, sink, null, "room_1");
        ObjectNode raw = JsonUtil.newObject().put("action", "nope");

        pipeline.eventRouter().routeEvent(target, raw, EventDispatchMode.UNICAST, List.of(target.getAddress()), Origin.NONE);
        pipeline.eventRouter().routeEvent(target, raw, EventDispatchMode.BROADCAST, List.of("room_1"), Origin.NONE);

        List<ObjectNode> received = sink.drain();
        assertThat(received).extracting(f -> f.get("action").asText()).containsExactly("error", "complete");
        assertThat(received.get(0).get("payload").get(0).get("type").asText()).isEqualTo("unknown_discriminator");
    }

    @Test
    void handlerFailureIsLoggedAndConnectionSurvives() {
        ConnectionType type = fixtures.connectionType(ChatFixtures.withCompletion());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink sink = new RecordingClientSink();
        Connection target = ChatFixtures.open(type, layer, pipeline, sink, null);
        EventPublisher publisher = new EventPublisher(layer, type.registry());

        publisher.sendEvent(target.getAddress(), new ChatFixtures.FailingEvent());
        publisher.sendEvent(target.getAddress(), jobDone("j4"));

        assertThat(sink.drain()).extracting(f -> f.get("action").asText())
                .containsExactly("complete", "job_result", "complete");
        assertThat(fixtures.invocations).containsExactly("failing", "job_done");
    }

    @Test
    void eventsAreDroppedWhenConnectionIsNotOpen() {
        ConnectionType type = fixtures.connectionType(ChatFixtures.withCompletion());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink sink = new RecordingClientSink();
        Connection target = ChatFixtures.open(type, layer, pipeline, sink, null);
        target.setState(ConnectionState.CLOSING);

        DispatchOutcome outcome = pipeline.eventRouter().routeEvent(target,
                type.registry().codec().encode(jobDone("j5")), EventDispatchMode.UNICAST, List.of(), Origin.NONE);

        assertThat(outcome).isEqualTo(DispatchOutcome.DROPPED);
        assertThat(sink.drain()).isEmpty();
        assertThat(fixtures.invocations).isEmpty();
    }

    @Test
    void publisherRefusesEventsOutsideTheEventUnion() {
        ConnectionType type = fixtures.connectionType(DispatchConfig.defaults());
        EventPublisher publisher = new EventPublisher(layer, type.registry());

        assertThatThrownBy(() -> publisher.sendEvent("anyone",
                new ChatFixtures.Chat(new ChatFixtures.ChatPayload("x"))))
                .isInstanceOf(RoutingException.class)
                .hasMessageContaining("'chat'");
        assertThatThrownBy(() -> publisher.broadcastEvent("room", new ChatFixtures.Ping()))
                .isInstanceOf(RoutingException.class)
                .hasMessageContaining("PingEvent");
    }

    @Test
    void capturingLayerRecordsBroadcastsWithoutDelivering() {
        ConnectionType type = fixtures.connectionType(DispatchConfig.defaults());
        ConnectionPipeline pipeline = ConnectionPipeline.create(type, layer);
        RecordingClientSink sink = new RecordingClientSink();
        ChatFixtures.open(type, layer, pipeline, sink, null, "room_1");
        CapturingChannelLayer capturing = new CapturingChannelLayer(layer);

        new EventPublisher(capturing, type.registry()).broadcastEvent("room_1", jobDone("j6"));

        assertThat(capturing.getBroadcasts()).singleElement().satisfies(captured -> {
            assertThat(captured.target()).isEqualTo("room_1");
            assertThat(captured.event().getContent().get("payload").get("jobId").asText()).isEqualTo("j6");
        });
        assertThat(sink.drain()).isEmpty();
        assertThat(fixtures.invocations).isEmpty();
    }
}
