/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.messaging.testing;

import com.courier.common.util.JsonUtil;
import com.courier.messaging.core.ChannelEnvelope;
import com.courier.messaging.core.Delivery;
import com.courier.messaging.memory.InMemoryChannelLayer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class CapturingChannelLayerTest {

    private static ChannelEnvelope jobDone() {
        return ChannelEnvelope.event(JsonUtil.newObject().put("action", "job_done"));
    }

    @Test
    void capturesAndSuppressesEventsByDefault() {
        InMemoryChannelLayer inner = new InMemoryChannelLayer();
        List<ChannelEnvelope> delivered = new CopyOnWriteArrayList<>();
        inner.register("a", delivered::add);
        inner.joinGroup("room", "a");
        CapturingChannelLayer capturing = new CapturingChannelLayer(inner);
        assertThat(capturing.isSuppressing()).isTrue();

        capturing.broadcastEvent("room", jobDone());
        capturing.sendEvent("a", jobDone());

        assertThat(delivered).isEmpty();
        assertThat(capturing.getCaptured()).extracting(CapturingChannelLayer.CapturedEvent::delivery)
                .containsExactly(Delivery.BROADCAST, Delivery.UNICAST);
        assertThat(capturing.getBroadcasts()).singleElement()
                .satisfies(c -> assertThat(c.target()).isEqualTo("room"));
    }

    @Test
    void forwardsEventsWhenNotSuppressing() {
        InMemoryChannelLayer inner = new InMemoryChannelLayer();
        List<ChannelEnvelope> delivered = new CopyOnWriteArrayList<>();
        inner.register("a", delivered::add);
        inner.joinGroup("room", "a");
        CapturingChannelLayer capturing = new CapturingChannelLayer(inner, false);

        capturing.broadcastEvent("room", jobDone());

        assertThat(delivered).hasSize(1);
        assertThat(capturing.getCaptured()).hasSize(1);
        capturing.clear();
        assertThat(capturing.getCaptured()).isEmpty();
    }
}
