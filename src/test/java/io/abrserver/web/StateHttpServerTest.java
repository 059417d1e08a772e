package io.abrserver.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.abrserver.asset.FakeAssetFetcher;
import io.abrserver.config.AbrServerConfig;
import io.abrserver.config.AbrSettings;
import io.abrserver.runtime.AbrServerRuntime;
import io.abrserver.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

final class StateHttpServerTest {
    private Path root;
    private AbrServerRuntime runtime;
    private StateHttpServer server;
    private HttpClient client;

    @BeforeEach
    void start() throws Exception {
        root = Files.createTempDirectory("abr-http-");
        AbrSettings defaults = AbrSettings.defaults();
        AbrSettings settings = new AbrSettings(defaults.backupRetentionSeconds(), 10, defaults.assetLibraryUrl(),
                false, 1, defaults.notificationSchemaRef(), null);
        runtime = new AbrServerRuntime(new AbrServerConfig(root), settings, new FakeAssetFetcher());
        runtime.init();
        server = new StateHttpServer(runtime, new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        server.start();
        client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void stop() throws IOException {
        server.close();
        runtime.close();
        deleteRecursively(root);
    }

    @Test
    void putThenGetByPath() throws Exception {
        HttpResponse<String> put = send("PUT", "/api/state/scene/\"camera/main\"", "{\"fov\": 45}");
        Assertions.assertEquals(200, put.statusCode());

        JsonNode nested = Jsons.parse(send("GET", "/api/state/scene/\"camera/main\"/fov", null).body());
        Assertions.assertEquals(45, nested.path("state").asInt());

        JsonNode whole = Jsons.parse(send("GET", "/api/state", null).body());
        Assertions.assertEquals("0.2.0", whole.at("/state/version").asText());
        Assertions.assertEquals(45, whole.at("/state/scene/camera~1main/fov").asInt());

        JsonNode missing = Jsons.parse(send("GET", "/api/state/nowhere", null).body());
        Assertions.assertTrue(missing.path("state").isNull());
    }

    @Test
    void invalidWritesAndEmptyHistoryAreClientErrors() throws Exception {
        HttpResponse<String> invalid = send("PUT", "/api/state/version", "\"latest\"");
        Assertions.assertEquals(400, invalid.statusCode());
        Assertions.assertTrue(invalid.body().startsWith("Schema validation failed - version: "), invalid.body());

        HttpResponse<String> garbage = send("PUT", "/api/state/name", "{not json");
        Assertions.assertEquals(400, garbage.statusCode());

        HttpResponse<String> undo = send("POST", "/api/undo", null);
        Assertions.assertEquals(400, undo.statusCode());
        Assertions.assertEquals("Nothing to undo", undo.body());
        Assertions.assertEquals("0.2.0", runtime.state().document().path("version").asText());
    }

    @Test
    void undoRedoAndRemovals() throws Exception {
        send("PUT", "/api/state/name", "\"first\"");
        send("PUT", "/api/state/uiData", "{\"name\": \"panel\", \"open\": true}");

        Assertions.assertEquals("OK", send("DELETE", "/api/remove/name", null).body());
        Assertions.assertFalse(runtime.state().document().has("name"));
        Assertions.assertFalse(runtime.state().document().path("uiData").has("name"));

        Assertions.assertEquals(200, send("POST", "/api/undo", null).statusCode());
        Assertions.assertEquals("first", runtime.state().document().path("name").asText());
        Assertions.assertEquals(200, send("POST", "/api/redo", null).statusCode());
        Assertions.assertFalse(runtime.state().document().has("name"));

        Assertions.assertEquals("OK", send("DELETE", "/api/remove-path/uiData/open", null).body());
        Assertions.assertFalse(runtime.state().document().path("uiData").has("open"));
        Assertions.assertEquals(400, send("DELETE", "/api/remove/", null).statusCode());
    }

    @Test
    void wrongMethodIsRejected() throws Exception {
        HttpResponse<String> response = send("POST", "/api/state", "{}");
        Assertions.assertEquals(405, response.statusCode());
        Assertions.assertEquals("GET,PUT", response.headers().firstValue("Allow").orElse(""));
    }

    @Test
    void routesDoNotAnswerLongerSiblingPaths() throws Exception {
        Assertions.assertEquals(404, send("GET", "/api/stateful/x", null).statusCode());
        Assertions.assertEquals(404, send("POST", "/api/undone", null).statusCode());
        Assertions.assertEquals(404, send("GET", "/eventsource", null).statusCode());
        Assertions.assertEquals(200, send("GET", "/api/state", null).statusCode());
        Assertions.assertEquals(200, send("GET", "/api/state/", null).statusCode());
    }

    @Test
    void servesBundledSchemasOnly() throws Exception {
        HttpResponse<String> outgoing = send("GET", "/api/schemas/ws-outgoing.json", null);
        Assertions.assertEquals(200, outgoing.statusCode());
        Assertions.assertEquals("asset-cache-update", Jsons.parse(outgoing.body()).at("/properties/target/enum/1").asText());

        Assertions.assertEquals(404, send("GET", "/api/schemas/unknown.json", null).statusCode());
    }

    @Test
    void inboundMessagesAreDispatched() throws Exception {
        HttpResponse<String> accepted = send("POST", "/api/messages?subscriber=engine-1",
                "{\"target\": \"thumbnail\", \"content\": \"aGVsbG8=\"}");
        Assertions.assertEquals(202, accepted.statusCode());
        Assertions.assertEquals("hello", Files.readString(runtime.thumbnails().latest()));

        HttpResponse<String> rejected = send("POST", "/api/messages?subscriber=engine-1", "{\"content\": 1}");
        Assertions.assertEquals(400, rejected.statusCode());
        Assertions.assertEquals("Message rejected", rejected.body());

        Assertions.assertEquals(400, send("POST", "/api/messages", "{\"target\": \"thumbnail\"}").statusCode());
    }

    @Test
    void localAssetsAreSavedListedAndRemoved() throws Exception {
        send("PUT", "/api/state/localVisAssets/draft",
                "{\"artifactJson\": {\"type\": \"glyph\"}, \"artifactDataContents\": {\"mesh.obj\": \"v 0 0 0\"}}");

        HttpResponse<String> saved = send("POST", "/api/save-local-visasset/draft", null);
        Assertions.assertEquals(200, saved.statusCode());
        String assetId = Jsons.parse(saved.body()).path("assetId").asText();

        JsonNode listed = Jsons.parse(send("GET", "/api/visassets", null).body());
        Assertions.assertEquals(assetId, listed.path(assetId).path("uuid").asText());

        Assertions.assertEquals(400, send("POST", "/api/save-local-visasset/missing", null).statusCode());
        Assertions.assertEquals(200, send("DELETE", "/api/remove-visasset/" + assetId, null).statusCode());
        Assertions.assertTrue(runtime.assets().listAssets().isEmpty());
    }

    @Test
    void eventStreamAnnouncesStateChanges() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("/events")).GET().build();
        HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
        Assertions.assertEquals(200, response.statusCode());

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
            Assertions.assertEquals("event: subscribed", reader.readLine());
            Assertions.assertTrue(reader.readLine().startsWith("data: {\"subscriberId\":"));
            Assertions.assertEquals("", reader.readLine());
            Assertions.assertEquals(1, runtime.notifier().subscriberCount());

            send("PUT", "/api/state/name", "\"streamed\"");

            Assertions.assertEquals("event: state", reader.readLine());
            JsonNode data = Jsons.parse(reader.readLine().substring("data: ".length()));
            Assertions.assertEquals("state", data.path("target").asText());
            Assertions.assertEquals("/api/schemas/ws-outgoing.json", data.path("$schema").asText());
        }
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(10))
                .method(method, publisher)
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path.replace("\"", "%22"));
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
