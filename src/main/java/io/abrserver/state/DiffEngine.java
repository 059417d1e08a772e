package io.abrserver.state;

import com.fasterxml.jackson.databind.JsonNode;
import io.abrserver.model.StatePath;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * For any trees {@code a} and {@code b}: {@code apply(a, diff(a, b))} equals {@code b} and
 * {@code applyInverse(b, diff(a, b))} equals {@code a}. Arrays whose length changed are replaced
 * wholesale, so edits never shift indices.
 */
public final class DiffEngine {

    public Diff diff(JsonNode before, JsonNode after) {
        List<Diff.Edit> edits = new ArrayList<>();
        compare(before, after, StatePath.ROOT, edits);
        return edits.isEmpty() ? Diff.EMPTY : new Diff(edits);
    }

    public JsonNode apply(JsonNode root, Diff diff) {
        JsonNode result = DocumentTree.copyOf(root);
        for (Diff.Edit edit : diff.edits()) {
            result = applyEdit(result, edit);
        }
        return result;
    }

    public JsonNode applyInverse(JsonNode root, Diff diff) {
        return apply(root, diff.inverse());
    }

    private void compare(JsonNode before, JsonNode after, StatePath at, List<Diff.Edit> edits) {
        if (before.isObject() && after.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> left = before.fields();
            while (left.hasNext()) {
                Map.Entry<String, JsonNode> entry = left.next();
                JsonNode other = after.get(entry.getKey());
                if (other == null) {
                    edits.add(new Diff.Edit(Diff.Op.REMOVE, at.child(entry.getKey()), entry.getValue(), null));
                } else {
                    compare(entry.getValue(), other, at.child(entry.getKey()), edits);
                }
            }
            Iterator<Map.Entry<String, JsonNode>> right = after.fields();
            while (right.hasNext()) {
                Map.Entry<String, JsonNode> entry = right.next();
                if (!before.has(entry.getKey())) {
                    edits.add(new Diff.Edit(Diff.Op.ADD, at.child(entry.getKey()), null, entry.getValue()));
                }
            }
            return;
        }
        if (before.isArray() && after.isArray() && before.size() == after.size()) {
            for (int i = 0; i < before.size(); i++) {
                compare(before.get(i), after.get(i), at.child(Integer.toString(i)), edits);
            }
            return;
        }
        if (!sameValue(before, after)) {
            edits.add(new Diff.Edit(Diff.Op.REPLACE, at, before, after));
        }
    }

    private JsonNode applyEdit(JsonNode root, Diff.Edit edit) {
        StatePath path = edit.path();
        if (path.isRoot()) {
            if (edit.op() != Diff.Op.REPLACE) {
                throw new IllegalStateException("Only REPLACE can target the document root");
            }
            return edit.after().deepCopy();
        }
        JsonNode parent = DocumentTree.get(root, path.parent())
                .orElseThrow(() -> new IllegalStateException("Diff does not apply: missing parent of " + path));
        switch (edit.op()) {
            case ADD, REPLACE -> DocumentTree.putChild(parent, path.last(), edit.after().deepCopy(), path);
            case REMOVE -> {
                if (!DocumentTree.remove(root, path)) {
                    throw new IllegalStateException("Diff does not apply: nothing to remove at " + path);
                }
            }
        }
        return root;
    }

    // Jackson distinguishes IntNode(1) from LongNode(1) and DoubleNode(1.0); the document does not.
    private static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }
}
