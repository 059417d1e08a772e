package io.abrserver.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.util.Jsons;

public record Notification(String schemaRef, NotificationTarget target) {
    public ObjectNode toJson() {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("$schema", schemaRef);
        node.put("target", target.wireName());
        return node;
    }
}
