package io.abrserver.model;

import java.util.Optional;

public enum InboundTopic {
    THUMBNAIL("thumbnail"),
    SAVE_LOCAL_ASSET("save-local-asset");

    private final String wireName;

    InboundTopic(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<InboundTopic> fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (InboundTopic value : values()) {
            if (value.wireName.equals(raw.trim())) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
