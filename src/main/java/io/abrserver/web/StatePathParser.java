package io.abrserver.web;

import io.abrserver.model.StatePath;

import java.util.ArrayList;
import java.util.List;

// Keys containing "/" are double-quoted: state/"a/b"/c addresses ["a/b", "c"].
public final class StatePathParser {
    private StatePathParser() {
    }

    public static StatePath parse(String prefix, String requestPath) {
        String rest = requestPath == null ? "" : requestPath;
        if (prefix != null && !prefix.isEmpty() && rest.startsWith(prefix)) {
            rest = rest.substring(prefix.length());
        }
        return parse(rest);
    }

    public static StatePath parse(String path) {
        List<String> segments = new ArrayList<>();
        String[] parts = (path == null ? "" : path).split("\"", -1);
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty()) {
                continue;
            }
            if (i % 2 == 1) {
                segments.add(part);
                continue;
            }
            for (String piece : part.split("/")) {
                if (!piece.isEmpty()) {
                    segments.add(piece);
                }
            }
        }
        return new StatePath(segments);
    }
}
