/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.courier.server.testing;

import com.courier.common.exception.TransportException;
import com.courier.common.message.CompleteMessage;
import com.courier.common.message.GroupCompleteMessage;
import com.courier.common.util.JsonUtil;
import com.courier.server.connection.ClientSink;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory client socket for tests. Frames are parsed as they arrive and can be
 * drained up to a completion marker.
 */
public class RecordingClientSink implements ClientSink {

    /** Close frame seen by the client. */
    public record Closed(int code, String reason) {}

    private final String discriminatorField;
    private final BlockingQueue<ObjectNode> frames = new LinkedBlockingQueue<>();
    private final List<ObjectNode> history = new ArrayList<>();
    private volatile Closed closed;

    public RecordingClientSink() {
        this("action");
    }

    public RecordingClientSink(String discriminatorField) {
        this.discriminatorField = discriminatorField;
    }

    @Override
    public void send(String frame) {
        if (closed != null) {
            throw new TransportException("Socket closed");
        }
        ObjectNode node = JsonUtil.fromJson(frame, ObjectNode.class);
        synchronized (history) {
            history.add(node);
        }
        frames.add(node);
    }

    @Override
    public void close(int code, String reason) {
        closed = new Closed(code, reason);
    }

    public Closed getClosed() { return closed; }

    /** Every frame ever sent, including ones already drained. */
    public List<ObjectNode> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    /** Waits for the next frame; null on timeout. */
    public ObjectNode receive(Duration timeout) throws InterruptedException {
        return frames.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Frames received so far that have not been drained. */
    public List<ObjectNode> drain() {
        List<ObjectNode> out = new ArrayList<>();
        frames.drainTo(out);
        return out;
    }

    /**
     * Collects frames up to the next {@code complete} marker. With {@code waitGroupComplete}
     * it keeps collecting until the {@code group_complete} that trails a delivered group
     * copy. Markers are not included in the result.
     *
     * @throws AssertionError when the expected marker does not arrive within the timeout
     */
    public List<ObjectNode> receiveAllUntilComplete(Duration timeout, boolean waitGroupComplete)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        String until = waitGroupComplete ? GroupCompleteMessage.ACTION : CompleteMessage.ACTION;
        List<ObjectNode> out = new ArrayList<>();
        while (true) {
            long remaining = deadline - System.nanoTime();
            ObjectNode frame = remaining > 0 ? frames.poll(remaining, TimeUnit.NANOSECONDS) : null;
            if (frame == null) {
                throw new AssertionError("No '" + until + "' within " + timeout + "; got " + out);
            }
            String action = actionOf(frame);
            if (until.equals(action)) {
                return out;
            }
            if (!CompleteMessage.ACTION.equals(action) && !GroupCompleteMessage.ACTION.equals(action)) {
                out.add(frame);
            }
        }
    }

    public List<ObjectNode> receiveAllUntilComplete(Duration timeout) throws InterruptedException {
        return receiveAllUntilComplete(timeout, false);
    }

    public String actionOf(ObjectNode frame) {
        JsonNode action = frame.get(discriminatorField);
        return action == null ? null : action.asText();
    }
}
