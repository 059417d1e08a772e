package io.abrserver.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.model.StatePath;
import io.abrserver.util.Jsons;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

final class DocumentTree {
    private DocumentTree() {
    }

    static Optional<JsonNode> get(JsonNode root, StatePath path) {
        JsonNode current = root;
        for (String segment : path.segments()) {
            current = child(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(current);
    }

    static void set(JsonNode root, StatePath path, JsonNode value) {
        if (path.isRoot()) {
            throw new IllegalArgumentException("Root replacement must be handled by the caller");
        }
        JsonNode current = root;
        List<String> segments = path.segments();
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            JsonNode next = child(current, segment);
            if (next == null) {
                if (!current.isObject()) {
                    throw new IllegalArgumentException("Cannot create '" + segment + "' inside non-object at "
                            + new StatePath(segments.subList(0, i)));
                }
                next = ((ObjectNode) current).putObject(segment);
            } else if (!next.isContainerNode()) {
                throw new IllegalArgumentException("Cannot descend into scalar at "
                        + new StatePath(segments.subList(0, i + 1)));
            }
            current = next;
        }
        putChild(current, path.last(), value, path);
    }

    static boolean remove(JsonNode root, StatePath path) {
        if (path.isRoot()) {
            throw new IllegalArgumentException("Root removal must be handled by the caller");
        }
        Optional<JsonNode> parent = get(root, path.parent());
        if (parent.isEmpty()) {
            return false;
        }
        JsonNode container = parent.get();
        String key = path.last();
        if (container.isObject()) {
            return ((ObjectNode) container).remove(key) != null;
        }
        if (container.isArray()) {
            int index = index(key);
            if (index >= 0 && index < container.size()) {
                ((ArrayNode) container).remove(index);
                return true;
            }
        }
        return false;
    }

    static int removeAll(JsonNode root, String key) {
        int removed = 0;
        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            JsonNode node = stack.pop();
            if (node.isObject()) {
                ObjectNode object = (ObjectNode) node;
                if (object.remove(key) != null) {
                    removed++;
                }
                object.elements().forEachRemaining(child -> {
                    if (child.isContainerNode()) {
                        stack.push(child);
                    }
                });
            } else if (node.isArray()) {
                node.elements().forEachRemaining(child -> {
                    if (child.isContainerNode()) {
                        stack.push(child);
                    }
                });
            }
        }
        return removed;
    }

    static List<ObjectNode> findObjects(JsonNode root, Predicate<ObjectNode> condition) {
        List<ObjectNode> out = new ArrayList<>();
        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            JsonNode node = stack.pop();
            if (node.isObject() && condition.test((ObjectNode) node)) {
                out.add((ObjectNode) node);
            }
            if (node.isContainerNode()) {
                List<JsonNode> children = new ArrayList<>();
                node.elements().forEachRemaining(children::add);
                for (int i = children.size() - 1; i >= 0; i--) {
                    if (children.get(i).isContainerNode()) {
                        stack.push(children.get(i));
                    }
                }
            }
        }
        return out;
    }

    static JsonNode copyOf(JsonNode node) {
        return node == null ? Jsons.mapper().nullNode() : node.deepCopy();
    }

    static JsonNode child(JsonNode container, String segment) {
        if (container == null) {
            return null;
        }
        if (container.isObject()) {
            return container.get(segment);
        }
        if (container.isArray()) {
            int index = index(segment);
            return index >= 0 && index < container.size() ? container.get(index) : null;
        }
        return null;
    }

    static void putChild(JsonNode container, String segment, JsonNode value, StatePath fullPath) {
        if (container.isObject()) {
            ((ObjectNode) container).set(segment, value);
            return;
        }
        if (container.isArray()) {
            ArrayNode array = (ArrayNode) container;
            int index = index(segment);
            if (index >= 0 && index < array.size()) {
                array.set(index, value);
                return;
            }
            if (index == array.size()) {
                array.add(value);
                return;
            }
        }
        throw new IllegalArgumentException("Cannot write at " + fullPath + ": parent is not a container");
    }

    private static int index(String segment) {
        if (segment == null || segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }
}
