package io.abrserver.runtime;

import io.abrserver.asset.AssetFetcher;
import io.abrserver.asset.AssetPipeline;
import io.abrserver.asset.HttpAssetFetcher;
import io.abrserver.asset.ThumbnailStore;
import io.abrserver.config.AbrServerConfig;
import io.abrserver.config.AbrSettings;
import io.abrserver.notify.InboundMessageReader;
import io.abrserver.notify.Notifier;
import io.abrserver.state.BackupStore;
import io.abrserver.state.DiffEngine;
import io.abrserver.state.SchemaValidator;
import io.abrserver.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public final class AbrServerRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AbrServerRuntime.class);
    public static final String STATE_SCHEMA_RESOURCE = "schemas/abr-state.schema.json";
    public static final String INCOMING_SCHEMA_RESOURCE = "schemas/ws-incoming.json";
    public static final String SCHEMA_RESOURCE_DIR = "schemas/";

    private final AbrServerConfig config;
    private final AbrSettings settings;
    private final SchemaValidator stateSchema;
    private final Notifier notifier;
    private final BackupStore backups;
    private final AssetPipeline assets;
    private final ThumbnailStore thumbnails;
    private final StateStore state;
    private final InboundMessageReader inbound;
    private boolean initialized;

    public AbrServerRuntime(AbrServerConfig config) {
        this(config, AbrSettings.load(config.settingsFile()), new HttpAssetFetcher());
    }

    public AbrServerRuntime(AbrServerConfig config, AbrSettings settings, AssetFetcher fetcher) {
        this.config = config;
        this.settings = settings;
        this.stateSchema = SchemaValidator.load(settings.stateSchemaFile(), STATE_SCHEMA_RESOURCE);
        this.notifier = new Notifier(settings.notificationSchemaRef());
        this.backups = new BackupStore(config.backupFile(), Duration.ofSeconds(settings.backupRetentionSeconds()));
        this.assets = new AssetPipeline(config.assetsRoot(), settings.assetLibraryUrl(), fetcher, settings.downloadWorkers());
        this.thumbnails = new ThumbnailStore(config.thumbnailsRoot());
        this.state = new StateStore(
                stateSchema,
                new DiffEngine(),
                backups,
                notifier,
                settings.downloadAssets() ? assets : null,
                settings.historyLimit()
        );
        this.inbound = new InboundMessageReader(notifier, SchemaValidator.fromClasspath(INCOMING_SCHEMA_RESOURCE));
    }

    public synchronized void init() {
        if (initialized) {
            return;
        }
        try {
            Files.createDirectories(config.backupRoot());
            Files.createDirectories(config.assetsRoot());
            Files.createDirectories(config.thumbnailsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create server directories under " + config.rootDir(), e);
        }
        thumbnails.register(notifier);
        assets.register(notifier);
        initialized = true;
        LOG.info("ABR server runtime ready at {} (downloads {}, library {})",
                config.rootDir(), settings.downloadAssets() ? "on" : "off", settings.assetLibraryUrl());
    }

    public AbrServerConfig config() {
        return config;
    }

    public AbrSettings settings() {
        return settings;
    }

    public SchemaValidator stateSchema() {
        return stateSchema;
    }

    public Notifier notifier() {
        return notifier;
    }

    public BackupStore backups() {
        return backups;
    }

    public AssetPipeline assets() {
        return assets;
    }

    public ThumbnailStore thumbnails() {
        return thumbnails;
    }

    public StateStore state() {
        return state;
    }

    public InboundMessageReader inbound() {
        return inbound;
    }

    public Path rootDir() {
        return config.rootDir();
    }

    @Override
    public void close() {
        assets.close();
    }
}
