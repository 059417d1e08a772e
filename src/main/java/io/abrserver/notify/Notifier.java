package io.abrserver.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.model.InboundTopic;
import io.abrserver.model.Notification;
import io.abrserver.model.NotificationTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

// One lock guards both registries and is never held while delivering or handling.
public final class Notifier {
    private static final Logger LOG = LoggerFactory.getLogger(Notifier.class);

    private final String schemaRef;
    private final Object registryLock = new Object();
    private final Map<String, SubscriberChannel> subscribers = new LinkedHashMap<>();
    private final Map<InboundTopic, LinkedHashMap<String, InboundHandler>> handlers = new EnumMap<>(InboundTopic.class);

    public Notifier(String schemaRef) {
        this.schemaRef = schemaRef;
    }

    public String subscribe(SubscriberChannel channel) {
        String id = UUID.randomUUID().toString();
        synchronized (registryLock) {
            subscribers.put(id, channel);
        }
        LOG.debug("Subscribed notifier channel {}", id);
        return id;
    }

    public boolean unsubscribe(String id) {
        boolean removed;
        synchronized (registryLock) {
            removed = id != null && subscribers.remove(id) != null;
        }
        if (removed) {
            LOG.debug("Unsubscribed notifier channel {}", id);
        }
        return removed;
    }

    public int subscriberCount() {
        synchronized (registryLock) {
            return subscribers.size();
        }
    }

    public Notification notification(NotificationTarget target) {
        return new Notification(schemaRef, target);
    }

    public int broadcast(NotificationTarget target) {
        return broadcast(notification(target));
    }

    public int broadcast(Notification notification) {
        List<Map.Entry<String, SubscriberChannel>> snapshot;
        synchronized (registryLock) {
            snapshot = new ArrayList<>(subscribers.entrySet());
        }
        ObjectNode payload = notification.toJson();
        int delivered = 0;
        for (Map.Entry<String, SubscriberChannel> entry : snapshot) {
            try {
                entry.getValue().send(payload.deepCopy());
                delivered++;
            } catch (Exception e) {
                LOG.warn("Delivery of '{}' to subscriber {} failed: {}",
                        notification.target().wireName(), entry.getKey(), e.toString());
            }
        }
        return delivered;
    }

    public String registerHandler(InboundTopic topic, InboundHandler handler) {
        String id = UUID.randomUUID().toString();
        synchronized (registryLock) {
            handlers.computeIfAbsent(topic, t -> new LinkedHashMap<>()).put(id, handler);
        }
        return id;
    }

    public boolean unregisterHandler(InboundTopic topic, String id) {
        synchronized (registryLock) {
            LinkedHashMap<String, InboundHandler> forTopic = handlers.get(topic);
            return forTopic != null && forTopic.remove(id) != null;
        }
    }

    public int handlerCount(InboundTopic topic) {
        synchronized (registryLock) {
            LinkedHashMap<String, InboundHandler> forTopic = handlers.get(topic);
            return forTopic == null ? 0 : forTopic.size();
        }
    }

    public int dispatchInbound(JsonNode message, String senderId) {
        String route = message == null ? "" : message.path("target").asText("");
        Optional<InboundTopic> topic = InboundTopic.fromWire(route);
        if (topic.isEmpty()) {
            LOG.error("Incoming route '{}' from {} does not exist", route, senderId);
            return 0;
        }
        List<Map.Entry<String, InboundHandler>> snapshot;
        synchronized (registryLock) {
            LinkedHashMap<String, InboundHandler> forTopic = handlers.get(topic.get());
            snapshot = forTopic == null ? List.of() : new ArrayList<>(forTopic.entrySet());
        }
        if (snapshot.isEmpty()) {
            LOG.error("No handler registered for incoming route '{}' from {}", route, senderId);
            return 0;
        }
        int completed = 0;
        for (Map.Entry<String, InboundHandler> entry : snapshot) {
            try {
                entry.getValue().handle(message, senderId);
                completed++;
            } catch (RuntimeException e) {
                LOG.error("Handler {} for route '{}' failed", entry.getKey(), route, e);
            }
        }
        return completed;
    }
}
