package io.abrserver.state;

import com.fasterxml.jackson.databind.JsonNode;
import io.abrserver.model.StatePath;

import java.util.ArrayList;
import java.util.List;

public record Diff(List<Edit> edits) {
    public static final Diff EMPTY = new Diff(List.of());

    public Diff {
        edits = edits == null ? List.of() : List.copyOf(edits);
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int size() {
        return edits.size();
    }

    public Diff inverse() {
        List<Edit> out = new ArrayList<>(edits.size());
        for (int i = edits.size() - 1; i >= 0; i--) {
            out.add(edits.get(i).inverse());
        }
        return new Diff(out);
    }

    public enum Op {
        ADD,
        REMOVE,
        REPLACE
    }

    public record Edit(Op op, StatePath path, JsonNode before, JsonNode after) {
        public Edit {
            before = before == null ? null : before.deepCopy();
            after = after == null ? null : after.deepCopy();
        }

        public Edit inverse() {
            return switch (op) {
                case ADD -> new Edit(Op.REMOVE, path, after, null);
                case REMOVE -> new Edit(Op.ADD, path, null, before);
                case REPLACE -> new Edit(Op.REPLACE, path, after, before);
            };
        }
    }
}
