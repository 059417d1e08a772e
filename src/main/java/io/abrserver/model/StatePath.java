package io.abrserver.model;

import java.util.ArrayList;
import java.util.List;

public record StatePath(List<String> segments) {
    public static final StatePath ROOT = new StatePath(List.of());

    public StatePath {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public static StatePath of(String... segments) {
        return new StatePath(List.of(segments));
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int size() {
        return segments.size();
    }

    public String last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("Root path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    public StatePath parent() {
        if (segments.isEmpty()) {
            return ROOT;
        }
        return new StatePath(segments.subList(0, segments.size() - 1));
    }

    public StatePath child(String segment) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new StatePath(next);
    }

    @Override
    public String toString() {
        return String.join("/", segments);
    }
}
