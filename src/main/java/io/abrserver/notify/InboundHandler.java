package io.abrserver.notify;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface InboundHandler {
    void handle(JsonNode message, String senderId);
}
