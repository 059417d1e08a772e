package io.abrserver.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.abrserver.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class BackupStore {
    private static final Logger LOG = LoggerFactory.getLogger(BackupStore.class);

    private final Path backupFile;
    private final Duration retention;
    private final Clock clock;

    public BackupStore(Path backupFile, Duration retention) {
        this(backupFile, retention, Clock.systemUTC());
    }

    public BackupStore(Path backupFile, Duration retention, Clock clock) {
        this.backupFile = backupFile;
        this.retention = retention;
        this.clock = clock;
    }

    public Path backupFile() {
        return backupFile;
    }

    public synchronized void write(JsonNode snapshot) {
        Instant now = clock.instant();
        LinkedHashMap<String, String> entries = readEntries();
        int before = entries.size();
        entries.entrySet().removeIf(entry -> isExpired(entry.getKey(), now));
        int pruned = before - entries.size();
        entries.put(timeKey(now), Jsons.toCompactJson(snapshot));

        ObjectNode root = Jsons.mapper().createObjectNode();
        entries.forEach(root::put);
        try {
            Path parent = backupFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = backupFile.resolveSibling(backupFile.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toCompactJson(root), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, backupFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException atomicUnsupported) {
                Files.move(tmp, backupFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write state backup: " + backupFile, e);
        }
        if (pruned > 0) {
            LOG.debug("Pruned {} expired backup(s) from {}", pruned, backupFile);
        }
    }

    public synchronized List<BackupEntry> entries() {
        List<BackupEntry> out = new ArrayList<>();
        for (Map.Entry<String, String> entry : readEntries().entrySet()) {
            Optional<Instant> at = parseTimeKey(entry.getKey());
            if (at.isEmpty()) {
                continue;
            }
            try {
                out.add(new BackupEntry(at.get(), Jsons.parse(entry.getValue())));
            } catch (IllegalArgumentException e) {
                LOG.warn("Skipping unreadable backup entry {} in {}", entry.getKey(), backupFile);
            }
        }
        out.sort(Comparator.comparing(BackupEntry::takenAt));
        return out;
    }

    public Optional<BackupEntry> latest() {
        List<BackupEntry> all = entries();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    // A missing or corrupt file counts as no backups at all.
    private LinkedHashMap<String, String> readEntries() {
        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        if (!Files.exists(backupFile)) {
            return out;
        }
        try {
            String raw = Files.readString(backupFile, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return out;
            }
            JsonNode root = Jsons.parse(raw);
            if (!root.isObject()) {
                return out;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                out.put(field.getKey(), value.isTextual() ? value.textValue() : Jsons.toCompactJson(value));
            }
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Backup file {} is unreadable, starting a fresh one: {}", backupFile, e.getMessage());
        }
        return out;
    }

    private boolean isExpired(String key, Instant now) {
        Optional<Instant> at = parseTimeKey(key);
        return at.isEmpty() || Duration.between(at.get(), now).compareTo(retention) > 0;
    }

    static String timeKey(Instant at) {
        return at.getEpochSecond() + "." + String.format("%09d", at.getNano());
    }

    static Optional<Instant> parseTimeKey(String key) {
        try {
            double seconds = Double.parseDouble(key);
            long whole = (long) Math.floor(seconds);
            long nanos = Math.round((seconds - whole) * 1_000_000_000d);
            return Optional.of(Instant.ofEpochSecond(whole, Math.min(nanos, 999_999_999L)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public record BackupEntry(Instant takenAt, JsonNode document) {
    }
}
