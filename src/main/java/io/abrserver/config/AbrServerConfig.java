package io.abrserver.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class AbrServerConfig {
    public static final String SETTINGS_FILE = "abr-settings.json";
    public static final String ASSET_MANIFEST_FILE = "artifact.json";
    public static final long DEFAULT_BACKUP_RETENTION_SECONDS = 24L * 60L * 60L;
    public static final int DEFAULT_HISTORY_LIMIT = 200;
    public static final int DEFAULT_DOWNLOAD_WORKERS = 8;
    public static final String DEFAULT_ASSET_LIBRARY = "http://127.0.0.1:9000/visassets/";
    public static final String DEFAULT_NOTIFICATION_SCHEMA_REF = "/api/schemas/ws-outgoing.json";

    private final Path rootDir;

    public AbrServerConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static AbrServerConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new AbrServerConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path backupRoot() {
        return rootDir.resolve("backups");
    }

    public Path backupFile() {
        return backupRoot().resolve("state-backup.json");
    }

    public Path mediaRoot() {
        return rootDir.resolve("media");
    }

    public Path assetsRoot() {
        return mediaRoot().resolve("visassets");
    }

    public Path thumbnailsRoot() {
        return mediaRoot().resolve("thumbnails");
    }
}
