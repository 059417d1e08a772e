package io.abrserver.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.asset.AssetPipeline;
import io.abrserver.asset.FakeAssetFetcher;
import io.abrserver.model.StatePath;
import io.abrserver.notify.Notifier;
import io.abrserver.notify.RecordingChannel;
import io.abrserver.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class StateStoreTest {
    private static final String LIBRARY = "http://library.test/visassets/";
    private static final SchemaValidator SCHEMA = SchemaValidator.of(Jsons.parse("""
            {
              "type": "object",
              "required": ["version"],
              "properties": {
                "version": {"type": "integer", "default": 1},
                "count": {"type": "integer"},
                "widgets": {
                  "type": "object",
                  "additionalProperties": {"type": "object", "properties": {"color": {"type": "string"}}}
                }
              }
            }
            """));

    private Path root;
    private Notifier notifier;
    private RecordingChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("abr-state-");
        notifier = new Notifier("/api/schemas/ws-outgoing.json");
        channel = new RecordingChannel();
        notifier.subscribe(channel);
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(root);
    }

    @Test
    void startsFromDefaultVersion() {
        StateStore store = store(10, null);
        Assertions.assertEquals(Jsons.parse("{\"version\":1}"), store.document());
        Assertions.assertEquals(Jsons.parse("{\"version\":1}"), store.defaultDocument());
        Assertions.assertTrue(store.get(StatePath.of("widgets")).isEmpty());
    }

    @Test
    void setUndoRedoWidgetScenario() {
        StateStore store = store(10, null);

        CommitOutcome outcome = store.set(StatePath.of("widgets", "a"), Jsons.parse("{\"color\":\"red\"}"));
        Assertions.assertTrue(outcome.changed());
        Assertions.assertEquals("red", store.get(StatePath.of("widgets", "a", "color")).orElseThrow().asText());

        store.undo();
        Assertions.assertTrue(store.get(StatePath.of("widgets")).isEmpty());

        store.redo();
        Assertions.assertEquals(Jsons.parse("{\"a\":{\"color\":\"red\"}}"), store.get(StatePath.of("widgets")).orElseThrow());
        Assertions.assertEquals(List.of("state", "state", "state"), channel.targets());
    }

    @Test
    void failedSetLeavesStateAndHistoryUnchanged() {
        StateStore store = store(10, null);
        store.set(StatePath.of("count"), Jsons.parse("1"));
        store.set(StatePath.of("count"), Jsons.parse("2"));
        store.undo();
        JsonNode before = store.document();
        int notifications = channel.received().size();

        SchemaValidationException error = Assertions.assertThrows(SchemaValidationException.class,
                () -> store.set(StatePath.of("count"), Jsons.parse("\"many\"")));

        Assertions.assertEquals("Schema validation failed - count: " + error.detail(), error.getMessage());
        Assertions.assertTrue(error.detail().contains("integer"), error.detail());
        Assertions.assertEquals(StatePath.of("count"), error.path());
        Assertions.assertEquals(before, store.document());
        Assertions.assertEquals(1, store.undoDepth());
        Assertions.assertEquals(1, store.redoDepth());
        Assertions.assertEquals(notifications, channel.received().size());

        // The rejected edit must not leak into the next commit.
        store.set(StatePath.of("widgets", "b"), Jsons.parse("{}"));
        Assertions.assertEquals(1, store.get(StatePath.of("count")).orElseThrow().asInt());
    }

    @Test
    void successfulCommitClearsRedo() {
        StateStore store = store(10, null);
        store.set(StatePath.of("count"), Jsons.parse("1"));
        store.set(StatePath.of("count"), Jsons.parse("2"));
        store.undo();
        Assertions.assertEquals(1, store.redoDepth());

        store.set(StatePath.of("count"), Jsons.parse("5"));

        Assertions.assertEquals(0, store.redoDepth());
        Assertions.assertThrows(EmptyHistoryException.class, store::redo);
    }

    @Test
    void unchangedCommitDoesNotTouchHistory() {
        StateStore store = store(10, null);
        store.set(StatePath.of("count"), Jsons.parse("1"));
        store.undo();
        store.redo();

        CommitOutcome outcome = store.set(StatePath.of("count"), Jsons.parse("1"));

        Assertions.assertFalse(outcome.changed());
        Assertions.assertEquals(1, store.undoDepth());
    }

    @Test
    void removeAllAtThreeDepthsCommitsOnce() {
        StateStore store = store(10, null);
        JsonNode doc = Jsons.parse("""
                {"version": 1, "tag": "top", "widgets": {"a": {"tag": "mid", "inner": {"tag": "deep", "keep": 1}}},
                 "list": [{"tag": "in-array"}]}
                """);
        store.set(StatePath.ROOT, doc);
        int undoBefore = store.undoDepth();
        int notificationsBefore = channel.received().size();

        CommitOutcome outcome = store.removeAll("tag");

        Assertions.assertTrue(outcome.changed());
        Assertions.assertEquals(undoBefore + 1, store.undoDepth());
        Assertions.assertEquals(notificationsBefore + 1, channel.received().size());
        Assertions.assertEquals(Jsons.parse("""
                {"version": 1, "widgets": {"a": {"inner": {"keep": 1}}}, "list": [{}]}
                """), store.document());

        store.undo();
        Assertions.assertEquals(doc, store.document());
    }

    @Test
    void undoAndRedoNStepsRoundTrip() {
        StateStore store = store(50, null);
        JsonNode initial = store.document();
        int steps = 12;
        for (int i = 0; i < steps; i++) {
            if (i % 3 == 2) {
                store.remove(StatePath.of("widgets", "w" + (i - 1)));
            } else {
                store.set(StatePath.of("widgets", "w" + i), Jsons.parse("{\"color\":\"c" + i + "\"}"));
            }
            store.set(StatePath.of("count"), Jsons.parse(Integer.toString(i)));
        }
        JsonNode last = store.document();
        int depth = store.undoDepth();
        Assertions.assertEquals(steps * 2, depth);

        for (int i = 0; i < depth; i++) {
            store.undo();
        }
        Assertions.assertEquals(initial, store.document());
        Assertions.assertThrows(EmptyHistoryException.class, store::undo);

        for (int i = 0; i < depth; i++) {
            store.redo();
        }
        Assertions.assertEquals(last, store.document());
    }

    @Test
    void emptyHistoryMessages() {
        StateStore store = store(10, null);
        EmptyHistoryException undo = Assertions.assertThrows(EmptyHistoryException.class, store::undo);
        EmptyHistoryException redo = Assertions.assertThrows(EmptyHistoryException.class, store::redo);
        Assertions.assertEquals("Nothing to undo", undo.getMessage());
        Assertions.assertEquals("Nothing to redo", redo.getMessage());
        Assertions.assertTrue(channel.received().isEmpty());
    }

    @Test
    void historyIsBounded() {
        StateStore store = store(3, null);
        for (int i = 0; i < 5; i++) {
            store.set(StatePath.of("count"), Jsons.parse(Integer.toString(i)));
        }
        Assertions.assertEquals(3, store.undoDepth());
        store.undo();
        store.undo();
        store.undo();
        Assertions.assertEquals(1, store.get(StatePath.of("count")).orElseThrow().asInt());
    }

    @Test
    void removeOfMissingPathIsNoOp() {
        StateStore store = store(10, null);
        CommitOutcome outcome = store.remove(StatePath.of("nothing", "here"));
        Assertions.assertFalse(outcome.changed());
        Assertions.assertEquals(0, store.undoDepth());
        Assertions.assertEquals(Jsons.parse("{\"version\":1}"), store.document());
    }

    @Test
    void removeRootResetsToDefault() {
        StateStore store = store(10, null);
        store.set(StatePath.of("widgets", "a"), Jsons.parse("{\"color\":\"red\"}"));
        store.remove(StatePath.ROOT);
        Assertions.assertEquals(Jsons.parse("{\"version\":1}"), store.document());
        store.undo();
        Assertions.assertTrue(store.get(StatePath.of("widgets", "a")).isPresent());
    }

    @Test
    void removingRequiredFieldIsRejected() {
        StateStore store = store(10, null);
        SchemaValidationException error = Assertions.assertThrows(SchemaValidationException.class,
                () -> store.remove(StatePath.of("version")));
        Assertions.assertTrue(error.path().isRoot());
        Assertions.assertTrue(error.getMessage().startsWith("Schema validation failed - : "), error.getMessage());
        Assertions.assertTrue(error.detail().contains("'version'"), error.detail());
        Assertions.assertEquals(Jsons.parse("{\"version\":1}"), store.document());
    }

    @Test
    void writingThroughScalarFailsWithoutSideEffects() {
        StateStore store = store(10, null);
        store.set(StatePath.of("count"), Jsons.parse("3"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> store.set(StatePath.of("count", "x"), Jsons.parse("1")));
        Assertions.assertEquals(3, store.get(StatePath.of("count")).orElseThrow().asInt());
        Assertions.assertEquals(1, store.undoDepth());
    }

    @Test
    void getReturnsDetachedCopy() {
        StateStore store = store(10, null);
        store.set(StatePath.of("widgets", "a"), Jsons.parse("{\"color\":\"red\"}"));
        JsonNode widgets = store.get(StatePath.of("widgets")).orElseThrow();
        ((ObjectNode) widgets).removeAll();
        Assertions.assertTrue(store.get(StatePath.of("widgets", "a")).isPresent());
    }

    @Test
    void everyCommitIsBackedUp() {
        StateStore store = store(10, null);
        store.set(StatePath.of("count"), Jsons.parse("7"));
        BackupStore backups = new BackupStore(root.resolve("state-backup.json"), Duration.ofHours(1));
        Assertions.assertEquals(7, backups.latest().orElseThrow().document().path("count").asInt());
    }

    @Test
    void commitResolvesReferencedAssets() {
        FakeAssetFetcher fetcher = new FakeAssetFetcher()
                .serve(LIBRARY + "abc123/artifact.json",
                        "{\"type\":\"colormap\",\"preview\":\"thumbnail.png\",\"artifactData\":{\"colormap\":\"colormap.xml\"}}")
                .serve(LIBRARY + "abc123/thumbnail.png", "png")
                .serve(LIBRARY + "abc123/colormap.xml", "<ColorMaps/>");
        try (AssetPipeline assets = new AssetPipeline(root.resolve("visassets"), LIBRARY, fetcher, 2)) {
            StateStore store = store(10, assets);
            JsonNode doc = Jsons.parse("""
                    {"version": 1,
                     "localVisAssets": {"local-1": {}},
                     "dataImpressions": {
                       "i1": {"inputValues": {
                         "Colormap": {"inputGenre": "VisAsset", "inputValue": "abc123"},
                         "Local": {"inputGenre": "VisAsset", "inputValue": "local-1"},
                         "Var": {"inputGenre": "Variable", "inputValue": "temperature"}
                       }}
                     }}
                    """);

            CommitOutcome outcome = store.set(StatePath.ROOT, doc);

            Assertions.assertEquals(List.of("abc123"), outcome.resolvedAssets());
            Assertions.assertTrue(outcome.failedDownloads().isEmpty());
            Assertions.assertTrue(Files.exists(root.resolve("visassets/abc123/colormap.xml")));
            Assertions.assertEquals(List.of("state", "asset-cache-update"), channel.targets());
        }
    }

    @Test
    void assetFailuresDoNotFailTheCommit() {
        try (AssetPipeline assets = new AssetPipeline(root.resolve("visassets"), LIBRARY, new FakeAssetFetcher(), 2)) {
            StateStore store = store(10, assets);
            store.set(StatePath.of("localVisAssets"), Jsons.parse("{}"));
            CommitOutcome outcome = store.set(StatePath.of("input"),
                    Jsons.parse("{\"inputGenre\":\"VisAsset\",\"inputValue\":\"gone\"}"));

            Assertions.assertTrue(outcome.changed());
            Assertions.assertEquals(1, outcome.failedDownloads().size());
            Assertions.assertTrue(store.get(StatePath.of("input")).isPresent());
            Assertions.assertEquals(List.of("state", "state", "asset-cache-update"), channel.targets());
        }
    }

    @Test
    void commitWithoutAssetReferencesSkipsCacheNotification() {
        try (AssetPipeline assets = new AssetPipeline(root.resolve("visassets"), LIBRARY, new FakeAssetFetcher(), 2)) {
            StateStore store = store(10, assets);
            store.set(StatePath.of("count"), Jsons.parse("1"));
            Assertions.assertEquals(List.of("state"), channel.targets());
        }
    }

    @Test
    void documentWithoutLocalAssetsTriggersNoDownloads() {
        FakeAssetFetcher fetcher = new FakeAssetFetcher();
        try (AssetPipeline assets = new AssetPipeline(root.resolve("visassets"), LIBRARY, fetcher, 2)) {
            StateStore store = store(10, assets);
            CommitOutcome outcome = store.set(StatePath.of("input"),
                    Jsons.parse("{\"inputGenre\":\"VisAsset\",\"inputValue\":\"abc123\"}"));

            Assertions.assertTrue(outcome.changed());
            Assertions.assertTrue(outcome.resolvedAssets().isEmpty());
            Assertions.assertTrue(fetcher.requested().isEmpty());
            Assertions.assertEquals(List.of("state"), channel.targets());
        }
        Assertions.assertEquals(List.of(), StateStore.unresolvedAssetReferences(
                Jsons.parse("{\"a\": {\"inputGenre\": \"VisAsset\", \"inputValue\": \"x\"}}")));
    }

    @Test
    void failedBackupDiscardsTheMutation() throws IOException {
        Path blocked = root.resolve("blocked");
        Files.createDirectories(blocked);
        Files.writeString(blocked.resolve("occupant"), "x");
        StateStore store = new StateStore(SCHEMA, new DiffEngine(),
                new BackupStore(blocked, Duration.ofHours(1)), notifier, null, 10);

        RuntimeException error = Assertions.assertThrows(RuntimeException.class,
                () -> store.set(StatePath.of("count"), Jsons.parse("5")));

        Assertions.assertTrue(error.getMessage().startsWith("Failed to write state backup"), error.getMessage());
        Assertions.assertEquals(Jsons.parse("{\"version\":1}"), store.document());
        Assertions.assertEquals(0, store.undoDepth());
        Assertions.assertTrue(channel.received().isEmpty());

        Files.delete(blocked.resolve("occupant"));
        Files.delete(blocked);
        store.set(StatePath.of("widgets", "a"), Jsons.parse("{\"color\":\"blue\"}"));
        Assertions.assertFalse(store.document().has("count"));
        Assertions.assertEquals(1, store.undoDepth());
        Assertions.assertEquals(List.of("state"), channel.targets());
    }

    @Test
    void findsUnresolvedReferencesInDocumentOrder() {
        JsonNode doc = Jsons.parse("""
                {"localVisAssets": {"l": {}},
                 "a": {"inputGenre": "VisAsset", "inputValue": "x"},
                 "b": [{"inputGenre": "VisAsset", "inputValue": "y"}, {"inputGenre": "VisAsset", "inputValue": "x"}],
                 "c": {"inputGenre": "VisAsset", "inputValue": "l"},
                 "d": {"inputGenre": "Primitive", "inputValue": "z"}}
                """);
        Assertions.assertEquals(List.of("x", "y"), StateStore.unresolvedAssetReferences(doc));
    }

    @Test
    void concurrentWritersAllCommit() throws Exception {
        StateStore store = store(500, null);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int writer = t;
            threads.add(new Thread(() -> {
                for (int i = 0; i < 25; i++) {
                    store.set(StatePath.of("widgets", "w" + writer + "-" + i), Jsons.parse("{\"color\":\"x\"}"));
                }
            }));
        }
        threads.forEach(Thread::start);
        for (Thread thread : threads) {
            thread.join();
        }
        Assertions.assertEquals(100, store.get(StatePath.of("widgets")).orElseThrow().size());
        Assertions.assertEquals(100, store.undoDepth());
    }

    private StateStore store(int historyLimit, AssetPipeline assets) {
        BackupStore backups = new BackupStore(root.resolve("state-backup.json"), Duration.ofHours(1));
        return new StateStore(SCHEMA, new DiffEngine(), backups, notifier, assets, historyLimit);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
