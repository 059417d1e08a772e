package io.abrserver.notify;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

public interface SubscriberChannel {
    void send(ObjectNode message) throws IOException;
}
