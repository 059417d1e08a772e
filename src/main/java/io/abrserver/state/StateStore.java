package io.abrserver.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.asset.AssetPipeline;
import io.abrserver.model.NotificationTarget;
import io.abrserver.model.StatePath;
import io.abrserver.notify.Notifier;
import io.abrserver.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * {@code editLock} makes staging, validation and commit of one mutation atomic; {@code stateLock}
 * guards the committed document, both stacks and backup writes. Neither is held while broadcasting
 * or downloading.
 */
public final class StateStore {
    private static final Logger LOG = LoggerFactory.getLogger(StateStore.class);
    static final String LOCAL_ASSETS_KEY = "localVisAssets";

    private final SchemaValidator validator;
    private final DiffEngine diffEngine;
    private final BackupStore backups;
    private final Notifier notifier;
    private final AssetPipeline assets;
    private final int historyLimit;
    private final JsonNode defaultDocument;

    private final Object editLock = new Object();
    private final Object stateLock = new Object();
    private final Deque<Diff> undoStack = new ArrayDeque<>();
    private final Deque<Diff> redoStack = new ArrayDeque<>();
    private JsonNode committed;
    private JsonNode pending;

    public StateStore(
            SchemaValidator validator,
            DiffEngine diffEngine,
            BackupStore backups,
            Notifier notifier,
            AssetPipeline assets,
            int historyLimit
    ) {
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be > 0");
        }
        this.validator = validator;
        this.diffEngine = diffEngine;
        this.backups = backups;
        this.notifier = notifier;
        this.assets = assets;
        this.historyLimit = historyLimit;

        ObjectNode initial = Jsons.mapper().createObjectNode();
        initial.set("version", validator.defaultVersion()
                .orElseThrow(() -> new IllegalArgumentException("State schema declares no default for 'version'")));
        validator.firstViolation(initial).ifPresent(v -> {
            throw new IllegalStateException("Default state does not validate: " + v);
        });
        this.defaultDocument = initial;
        this.committed = initial.deepCopy();
        this.pending = initial.deepCopy();
        LOG.info("State initialized with schema version {}", initial.get("version"));
    }

    public JsonNode defaultDocument() {
        return defaultDocument.deepCopy();
    }

    public Optional<JsonNode> get(StatePath path) {
        synchronized (stateLock) {
            return DocumentTree.get(committed, path).map(JsonNode::deepCopy);
        }
    }

    public JsonNode document() {
        synchronized (stateLock) {
            return committed.deepCopy();
        }
    }

    public CommitOutcome set(StatePath path, JsonNode value) {
        JsonNode copy = DocumentTree.copyOf(value);
        return mutate(doc -> {
            if (path.isRoot()) {
                return copy;
            }
            DocumentTree.set(doc, path, copy);
            return doc;
        });
    }

    public CommitOutcome remove(StatePath path) {
        return mutate(doc -> {
            if (path.isRoot()) {
                return defaultDocument.deepCopy();
            }
            DocumentTree.remove(doc, path);
            return doc;
        });
    }

    public CommitOutcome removeAll(String key) {
        return mutate(doc -> {
            JsonNode working;
            synchronized (stateLock) {
                working = committed.deepCopy();
            }
            int removed = DocumentTree.removeAll(working, key);
            LOG.debug("removeAll '{}' removed {} field(s)", key, removed);
            return working;
        });
    }

    public void undo() {
        synchronized (editLock) {
            synchronized (stateLock) {
                Diff diff = undoStack.pollFirst();
                if (diff == null) {
                    throw new EmptyHistoryException("Nothing to undo");
                }
                committed = diffEngine.applyInverse(committed, diff);
                pushBounded(redoStack, diff);
                pending = committed.deepCopy();
            }
        }
        notifier.broadcast(NotificationTarget.STATE);
    }

    public void redo() {
        synchronized (editLock) {
            synchronized (stateLock) {
                Diff diff = redoStack.pollFirst();
                if (diff == null) {
                    throw new EmptyHistoryException("Nothing to redo");
                }
                committed = diffEngine.apply(committed, diff);
                pushBounded(undoStack, diff);
                pending = committed.deepCopy();
            }
        }
        notifier.broadcast(NotificationTarget.STATE);
    }

    public int undoDepth() {
        synchronized (stateLock) {
            return undoStack.size();
        }
    }

    public int redoDepth() {
        synchronized (stateLock) {
            return redoStack.size();
        }
    }

    public int historyLimit() {
        return historyLimit;
    }

    private CommitOutcome mutate(UnaryOperator<JsonNode> edit) {
        boolean changed;
        JsonNode snapshot;
        synchronized (editLock) {
            try {
                pending = edit.apply(pending);
            } catch (RuntimeException e) {
                resetPending();
                throw e;
            }

            Optional<SchemaValidator.Violation> violation = validator.firstViolation(pending);
            if (violation.isPresent()) {
                resetPending();
                SchemaValidator.Violation v = violation.get();
                LOG.debug("Rejected mutation at {}: {}", v.path(), v.message());
                throw new SchemaValidationException(v.path(), v.message());
            }

            synchronized (stateLock) {
                // The backup goes first; if it cannot be written nothing is committed.
                try {
                    backups.write(pending);
                } catch (RuntimeException e) {
                    resetPending();
                    LOG.error("Mutation discarded, backup failed", e);
                    throw e;
                }
                Diff diff = diffEngine.diff(committed, pending);
                changed = !diff.isEmpty();
                if (changed) {
                    pushBounded(undoStack, diff);
                    redoStack.clear();
                    committed = pending.deepCopy();
                }
                snapshot = committed;
            }
        }
        notifier.broadcast(NotificationTarget.STATE);
        return resolveAssets(changed, snapshot);
    }

    private CommitOutcome resolveAssets(boolean changed, JsonNode snapshot) {
        if (assets == null) {
            return new CommitOutcome(changed, List.of(), List.of());
        }
        List<String> referenced = unresolvedAssetReferences(snapshot);
        if (referenced.isEmpty()) {
            return new CommitOutcome(changed, List.of(), List.of());
        }
        List<String> failures = new ArrayList<>();
        for (String assetId : referenced) {
            try {
                failures.addAll(assets.resolve(assetId, null));
            } catch (IllegalArgumentException e) {
                LOG.warn("Skipping asset reference '{}': {}", assetId, e.getMessage());
                failures.add(assetId);
            }
        }
        if (!failures.isEmpty()) {
            LOG.warn("Failed to download assets: {}", failures);
        }
        notifier.broadcast(NotificationTarget.ASSET_CACHE);
        return new CommitOutcome(changed, referenced, failures);
    }

    static List<String> unresolvedAssetReferences(JsonNode document) {
        JsonNode local = document.get(LOCAL_ASSETS_KEY);
        if (local == null) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (ObjectNode input : DocumentTree.findObjects(document, node ->
                node.path("inputValue").isTextual() && "VisAsset".equals(node.path("inputGenre").asText()))) {
            String id = input.get("inputValue").textValue();
            if (!local.has(id)) {
                ids.add(id);
            }
        }
        return List.copyOf(ids);
    }

    private void resetPending() {
        synchronized (stateLock) {
            pending = committed.deepCopy();
        }
    }

    private void pushBounded(Deque<Diff> stack, Diff diff) {
        stack.push(diff);
        while (stack.size() > historyLimit) {
            stack.removeLast();
        }
    }
}
