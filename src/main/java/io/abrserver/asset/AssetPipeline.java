package io.abrserver.asset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.config.AbrServerConfig;
import io.abrserver.model.InboundTopic;
import io.abrserver.model.NotificationTarget;
import io.abrserver.notify.Notifier;
import io.abrserver.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public final class AssetPipeline implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AssetPipeline.class);
    private static final String COLORMAP_TYPE = "colormap";
    private static final String COLORMAP_FILE = "colormap.xml";
    private static final String PREVIEW_FILE = "thumbnail.png";

    private final Path assetsRoot;
    private final AssetFetcher fetcher;
    private final ExecutorService workers;
    private final Set<String> libraries;

    public AssetPipeline(Path assetsRoot, String defaultLibrary, AssetFetcher fetcher, int workerCount) {
        this.assetsRoot = assetsRoot;
        this.fetcher = fetcher;
        AtomicInteger threadSeq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), runnable -> {
            Thread t = new Thread(runnable, "asset-download-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.libraries = new LinkedHashSet<>();
        this.libraries.add(withTrailingSlash(defaultLibrary));
    }

    public Path assetsRoot() {
        return assetsRoot;
    }

    public Path assetDir(String assetId) {
        return assetsRoot.resolve(requireSafeId(assetId));
    }

    public boolean isResident(String assetId) {
        return Files.exists(assetDir(assetId).resolve(AbrServerConfig.ASSET_MANIFEST_FILE));
    }

    public synchronized List<String> libraries() {
        return List.copyOf(libraries);
    }

    public String register(Notifier notifier) {
        return notifier.registerHandler(InboundTopic.SAVE_LOCAL_ASSET, (message, senderId) -> {
            SavedAsset saved = saveLocal(message);
            LOG.info("Saved local asset {} from subscriber {} (preview={})",
                    saved.assetId(), senderId, saved.previewWritten());
            notifier.broadcast(NotificationTarget.ASSET_CACHE);
        });
    }

    /**
     * @return local paths still missing after every library was tried; empty means fully resolved
     */
    public List<String> resolve(String assetId, String extraLibrary) {
        Path dir = assetDir(assetId);
        List<String> searched;
        synchronized (this) {
            if (extraLibrary != null && !extraLibrary.isBlank()) {
                libraries.add(withTrailingSlash(extraLibrary.trim()));
            }
            searched = List.copyOf(libraries);
        }

        Set<Path> failed = new LinkedHashSet<>();
        Set<String> rejected = new LinkedHashSet<>();
        for (String library : searched) {
            String base = library + assetId + "/";
            Path manifestPath = dir.resolve(AbrServerConfig.ASSET_MANIFEST_FILE);
            if (!fetchIfMissing(base, AbrServerConfig.ASSET_MANIFEST_FILE, manifestPath)) {
                failed.add(manifestPath);
                continue;
            }
            JsonNode manifest;
            try {
                manifest = Jsons.mapper().readTree(manifestPath.toFile());
            } catch (IOException e) {
                LOG.warn("Manifest {} from {} is unreadable: {}", manifestPath, library, e.getMessage());
                failed.add(manifestPath);
                continue;
            }

            List<String> files = new ArrayList<>();
            String preview = manifest.path("preview").asText("");
            if (!preview.isBlank()) {
                files.add(preview);
            }
            collectStrings(manifest.path("artifactData"), files);
            failed.addAll(downloadAll(base, dir, files, rejected));
        }

        List<String> missing = new ArrayList<>(rejected);
        for (Path path : failed) {
            if (!Files.exists(path)) {
                missing.add(path.toString());
            }
        }
        if (missing.isEmpty()) {
            LOG.debug("Asset {} resolved from {}", assetId, searched);
        } else {
            LOG.warn("Asset {} has {} unresolved file(s)", assetId, missing.size());
        }
        return missing;
    }

    public SavedAsset saveLocal(JsonNode payload) {
        JsonNode manifestNode = payload == null ? null : payload.get("artifactJson");
        if (manifestNode == null || !manifestNode.isObject()) {
            throw new IllegalArgumentException("Local asset payload requires an 'artifactJson' object");
        }
        JsonNode contents = payload.path("artifactDataContents");
        ObjectNode manifest = manifestNode.deepCopy();
        String assetId = UUID.randomUUID().toString();
        manifest.put("uuid", assetId);

        Path dir = assetDir(assetId);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(AbrServerConfig.ASSET_MANIFEST_FILE), Jsons.toJson(manifest), StandardCharsets.UTF_8);
            Iterator<Map.Entry<String, JsonNode>> files = contents.fields();
            while (files.hasNext()) {
                Map.Entry<String, JsonNode> file = files.next();
                Path target = insideDir(dir, file.getKey());
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, file.getValue().asText(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to save local asset " + assetId, e);
        }

        // Only colormaps know how to draw their own preview.
        if (!COLORMAP_TYPE.equals(manifest.path("type").asText())) {
            return new SavedAsset(assetId, false);
        }
        JsonNode xml = contents.get(COLORMAP_FILE);
        if (xml == null || !xml.isTextual()) {
            LOG.warn("Colormap asset {} has no {}; skipping preview", assetId, COLORMAP_FILE);
            return new SavedAsset(assetId, false);
        }
        try {
            ColormapPreview.fromXml(xml.textValue())
                    .writePng(dir.resolve(PREVIEW_FILE), ColormapPreview.PREVIEW_WIDTH, ColormapPreview.PREVIEW_HEIGHT);
            return new SavedAsset(assetId, true);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Could not render preview for colormap asset {}: {}", assetId, e.getMessage());
            return new SavedAsset(assetId, false);
        }
    }

    public boolean removeAsset(String assetId) {
        Path dir = assetDir(assetId);
        if (!Files.exists(dir)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to remove asset " + assetId, e);
        }
        LOG.info("Removed asset {}", assetId);
        return true;
    }

    public LinkedHashMap<String, JsonNode> listAssets() {
        LinkedHashMap<String, JsonNode> out = new LinkedHashMap<>();
        if (!Files.isDirectory(assetsRoot)) {
            return out;
        }
        List<Path> dirs;
        try (Stream<Path> list = Files.list(assetsRoot)) {
            dirs = list.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list assets in " + assetsRoot, e);
        }
        for (Path dir : dirs) {
            Path manifest = dir.resolve(AbrServerConfig.ASSET_MANIFEST_FILE);
            if (!Files.exists(manifest)) {
                continue;
            }
            try {
                out.put(dir.getFileName().toString(), Jsons.mapper().readTree(manifest.toFile()));
            } catch (IOException e) {
                LOG.warn("Skipping unreadable manifest {}: {}", manifest, e.getMessage());
            }
        }
        return out;
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private List<Path> downloadAll(String base, Path dir, List<String> files, Set<String> rejected) {
        Map<Path, Future<Boolean>> tasks = new LinkedHashMap<>();
        List<Path> failed = new ArrayList<>();
        for (String file : files) {
            Path target;
            try {
                target = insideDir(dir, file);
            } catch (IllegalArgumentException e) {
                LOG.warn("Refusing asset file outside {}: {}", dir, file);
                rejected.add(file);
                continue;
            }
            tasks.put(target, workers.submit(() -> fetchIfMissing(base, file, target)));
        }
        for (Map.Entry<Path, Future<Boolean>> task : tasks.entrySet()) {
            try {
                if (!task.getValue().get()) {
                    failed.add(task.getKey());
                }
            } catch (ExecutionException e) {
                LOG.warn("Download of {} failed: {}", task.getKey(), e.getCause() == null ? e : e.getCause());
                failed.add(task.getKey());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed.add(task.getKey());
            }
        }
        return failed;
    }

    private boolean fetchIfMissing(String base, String file, Path target) {
        if (Files.exists(target)) {
            return true;
        }
        URI uri;
        try {
            uri = URI.create(base + file);
        } catch (IllegalArgumentException e) {
            LOG.warn("Invalid asset URL {}{}", base, file);
            return false;
        }
        try {
            byte[] body = fetcher.fetch(uri);
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".part");
            Files.write(tmp, body);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException atomicUnsupported) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            LOG.debug("Fetch {} failed: {}", uri, e.getMessage());
            return false;
        }
    }

    private static void collectStrings(JsonNode node, List<String> out) {
        if (node.isTextual()) {
            out.add(node.textValue());
        } else if (node.isContainerNode()) {
            node.elements().forEachRemaining(child -> collectStrings(child, out));
        }
    }

    private static Path insideDir(Path dir, String relative) {
        Path normalizedDir = dir.toAbsolutePath().normalize();
        Path target = normalizedDir.resolve(relative).normalize();
        if (!target.startsWith(normalizedDir) || target.equals(normalizedDir)) {
            throw new IllegalArgumentException("Path escapes asset directory: " + relative);
        }
        return target;
    }

    private static String requireSafeId(String assetId) {
        if (assetId == null || assetId.isBlank() || assetId.contains("/") || assetId.contains("\\")
                || assetId.equals(".") || assetId.equals("..")) {
            throw new IllegalArgumentException("Invalid asset identifier: " + assetId);
        }
        return assetId;
    }

    private static String withTrailingSlash(String library) {
        return library.endsWith("/") ? library : library + "/";
    }

    public record SavedAsset(String assetId, boolean previewWritten) {
    }
}
