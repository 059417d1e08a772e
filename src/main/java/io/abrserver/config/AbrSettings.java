package io.abrserver.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.abrserver.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record AbrSettings(
        long backupRetentionSeconds,
        int historyLimit,
        String assetLibraryUrl,
        boolean downloadAssets,
        int downloadWorkers,
        String notificationSchemaRef,
        String stateSchemaFile
) {
    public static AbrSettings defaults() {
        return new AbrSettings(
                AbrServerConfig.DEFAULT_BACKUP_RETENTION_SECONDS,
                AbrServerConfig.DEFAULT_HISTORY_LIMIT,
                AbrServerConfig.DEFAULT_ASSET_LIBRARY,
                true,
                AbrServerConfig.DEFAULT_DOWNLOAD_WORKERS,
                AbrServerConfig.DEFAULT_NOTIFICATION_SCHEMA_REF,
                null
        );
    }

    public static AbrSettings load(Path settingsFile) {
        AbrSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    static AbrSettings fromFile(SettingsFile file, AbrSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new AbrSettings(
                positiveOr(file.backupRetentionSeconds(), defaults.backupRetentionSeconds()),
                (int) positiveOr(file.historyLimit() == null ? null : file.historyLimit().longValue(), defaults.historyLimit()),
                normalizeLibrary(file.assetLibraryUrl(), defaults.assetLibraryUrl()),
                file.downloadAssets() == null ? defaults.downloadAssets() : file.downloadAssets(),
                (int) positiveOr(file.downloadWorkers() == null ? null : file.downloadWorkers().longValue(), defaults.downloadWorkers()),
                blankOr(file.notificationSchemaRef(), defaults.notificationSchemaRef()),
                blankOr(file.stateSchemaFile(), defaults.stateSchemaFile())
        );
    }

    private static long positiveOr(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    private static String blankOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    // Library URLs are joined with "<id>/<file>", so they must end with a slash.
    private static String normalizeLibrary(String value, String fallback) {
        String resolved = blankOr(value, fallback);
        return resolved.endsWith("/") ? resolved : resolved + "/";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long backupRetentionSeconds,
            Integer historyLimit,
            String assetLibraryUrl,
            Boolean downloadAssets,
            Integer downloadWorkers,
            String notificationSchemaRef,
            String stateSchemaFile
    ) {
    }
}
