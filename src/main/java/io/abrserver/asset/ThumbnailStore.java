package io.abrserver.asset;

import com.fasterxml.jackson.databind.JsonNode;
import io.abrserver.model.InboundTopic;
import io.abrserver.notify.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Base64;

public final class ThumbnailStore {
    private static final Logger LOG = LoggerFactory.getLogger(ThumbnailStore.class);
    public static final String LATEST_FILE = "latest-thumbnail.png";

    private final Path thumbnailsRoot;

    public ThumbnailStore(Path thumbnailsRoot) {
        this.thumbnailsRoot = thumbnailsRoot;
    }

    public Path latest() {
        return thumbnailsRoot.resolve(LATEST_FILE);
    }

    public String register(Notifier notifier) {
        return notifier.registerHandler(InboundTopic.THUMBNAIL, (message, senderId) -> {
            Path written = save(message);
            LOG.debug("Stored thumbnail from subscriber {} at {}", senderId, written);
        });
    }

    public Path save(JsonNode message) {
        JsonNode content = message == null ? null : message.get("content");
        if (content == null || !content.isTextual()) {
            throw new IllegalArgumentException("Thumbnail message requires a base64 'content' string");
        }
        byte[] png;
        try {
            png = Base64.getMimeDecoder().decode(content.textValue());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Thumbnail content is not valid base64", e);
        }
        Path target = latest();
        try {
            Files.createDirectories(thumbnailsRoot);
            Path tmp = thumbnailsRoot.resolve(LATEST_FILE + ".tmp");
            Files.write(tmp, png);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException atomicUnsupported) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write thumbnail: " + target, e);
        }
        return target;
    }
}
