package io.abrserver.web;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.notify.SubscriberChannel;
import io.abrserver.util.Jsons;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

// send() only enqueues; the connection thread drains the queue.
final class SseChannel implements SubscriberChannel {
    static final int MAX_PENDING_FRAMES = 1024;

    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>(MAX_PENDING_FRAMES);
    private volatile boolean closed;

    @Override
    public void send(ObjectNode message) throws IOException {
        if (closed) {
            throw new IOException("Event stream closed");
        }
        String frame = frame(message.path("target").asText("message"), Jsons.toCompactJson(message));
        if (!frames.offer(frame)) {
            throw new IOException("Event stream backlog full (" + MAX_PENDING_FRAMES + " frames)");
        }
    }

    String next(long timeout, TimeUnit unit) throws InterruptedException {
        return frames.poll(timeout, unit);
    }

    int pending() {
        return frames.size();
    }

    void close() {
        closed = true;
        frames.clear();
    }

    static String frame(String event, String data) {
        return "event: " + event + "\ndata: " + data.replace("\r", " ").replace("\n", " ") + "\n\n";
    }
}
