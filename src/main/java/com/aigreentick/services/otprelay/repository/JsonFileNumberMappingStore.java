package com.aigreentick.services.otprelay.repository;

import com.aigreentick.services.otprelay.config.OtpRelayProperties;
import com.aigreentick.services.otprelay.exception.MappingLockTimeoutException;
import com.aigreentick.services.otprelay.exception.MappingStorageException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * NumberMappingStore backed by a single pretty-printed JSON object file:
 *
 *   { "8801799999": 123456789, ... }
 *
 * plus a "<file>.lock" sidecar for the advisory lock.
 *
 * Reads go to an immutable in-memory snapshot, loaded once at startup and
 * republished after every write. put() re-reads the file under the lock so
 * entries written by another process are not lost. Writes land in a temp file
 * first and are moved over the mappings file atomically.
 *
 * FAILURE POLICY:
 *   Read failure          → logged, treated as "no data"
 *   Write failure         → logged, in-memory snapshot stays authoritative
 *   Lock timeout on put() → logged, mapping kept in memory only
 *
 * Entries that only reached memory are tracked as unpersisted. The next put()
 * overlays them on the file contents, so a stale file never hands a number
 * back to its previous owner, and clears them once they are written.
 */
@Repository
@Slf4j
public class JsonFileNumberMappingStore implements NumberMappingStore {

    private static final TypeReference<LinkedHashMap<String, Long>> MAPPINGS_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path mappingsFile;
    private final MappingFileLock lock;

    private final Object snapshotMonitor = new Object();
    private volatile Map<String, Long> snapshot = Collections.emptyMap();

    /** Mappings newer than the file, guarded by snapshotMonitor */
    private final Map<String, Long> unpersisted = new LinkedHashMap<>();

    @Autowired
    public JsonFileNumberMappingStore(ObjectMapper objectMapper, OtpRelayProperties properties) {
        this(objectMapper,
                Path.of(properties.getStorage().getMappingsFile()),
                Duration.ofSeconds(properties.getStorage().getLockTimeoutSeconds()));
    }

    public JsonFileNumberMappingStore(ObjectMapper objectMapper, Path mappingsFile, Duration lockTimeout) {
        this.objectMapper = objectMapper;
        this.mappingsFile = mappingsFile.toAbsolutePath();
        this.lock = new MappingFileLock(
                this.mappingsFile.resolveSibling(this.mappingsFile.getFileName() + ".lock"), lockTimeout);
    }

    @PostConstruct
    public void init() {
        Map<String, Long> loaded = load();
        publish(loaded);
        log.info("Loaded {} number mappings from {}", loaded.size(), mappingsFile);
    }

    // ═══════════════════════════════════════════════════════════
    // NumberMappingStore
    // ═══════════════════════════════════════════════════════════

    @Override
    public Map<String, Long> load() {
        try (MappingFileLock.Handle ignored = lock.acquire()) {
            return readFile();
        } catch (MappingLockTimeoutException ex) {
            log.error("Failed to load mappings: {}", ex.getMessage());
        } catch (MappingStorageException ex) {
            log.error("Failed to load mappings from {}", mappingsFile, ex);
        }
        return new LinkedHashMap<>();
    }

    @Override
    public void save(Map<String, Long> mappings) {
        Map<String, Long> copy = new LinkedHashMap<>(mappings);
        synchronized (snapshotMonitor) {
            snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(copy));
            unpersisted.clear();
            unpersisted.putAll(copy);
        }
        try (MappingFileLock.Handle ignored = lock.acquire()) {
            writeFile(copy);
            markPersisted(copy);
            log.debug("Saved {} mappings to {}", copy.size(), mappingsFile);
        } catch (MappingLockTimeoutException ex) {
            log.error("Mappings not persisted, lock timeout: {}", ex.getMessage());
        } catch (MappingStorageException ex) {
            log.error("Failed to save mappings to {}", mappingsFile, ex);
        }
    }

    @Override
    public void put(String normalizedNumber, long subscriberId) {
        if (normalizedNumber == null || normalizedNumber.isEmpty()) {
            throw new IllegalArgumentException("normalizedNumber must not be empty");
        }

        try (MappingFileLock.Handle ignored = lock.acquire()) {
            Map<String, Long> merged = readFileOrSnapshot();
            Long previous = merged.get(normalizedNumber);
            synchronized (snapshotMonitor) {
                unpersisted.put(normalizedNumber, subscriberId);
                merged = mergeWithMemory(merged);
            }

            if (previous != null && previous != subscriberId) {
                log.info("Number {} re-allocated: {} -> {}", normalizedNumber, previous, subscriberId);
            }
            writeFile(merged);
            markPersisted(merged);
        } catch (MappingLockTimeoutException ex) {
            log.error("Lock timeout while mapping {} -> {}, keeping it in memory only: {}",
                    normalizedNumber, subscriberId, ex.getMessage());
            putInMemory(normalizedNumber, subscriberId);
        } catch (MappingStorageException ex) {
            log.error("Failed to persist mapping {} -> {}", normalizedNumber, subscriberId, ex);
            putInMemory(normalizedNumber, subscriberId);
        }
    }

    @Override
    public Map<String, Long> snapshot() {
        return snapshot;
    }

    // ═══════════════════════════════════════════════════════════
    // PRIVATE HELPERS
    // ═══════════════════════════════════════════════════════════

    private Map<String, Long> readFile() {
        if (!Files.exists(mappingsFile)) {
            return new LinkedHashMap<>();
        }
        try {
            if (Files.size(mappingsFile) == 0) {
                return new LinkedHashMap<>();
            }
            LinkedHashMap<String, Long> raw = objectMapper.readValue(mappingsFile.toFile(), MAPPINGS_TYPE);
            LinkedHashMap<String, Long> mappings = new LinkedHashMap<>();
            if (raw != null) {
                raw.forEach((number, subscriberId) -> {
                    if (number != null && subscriberId != null) {
                        mappings.put(number, subscriberId);
                    }
                });
            }
            return mappings;
        } catch (IOException ex) {
            throw new MappingStorageException("Cannot read " + mappingsFile, ex);
        }
    }

    private Map<String, Long> readFileOrSnapshot() {
        try {
            return readFile();
        } catch (MappingStorageException ex) {
            log.warn("Mappings file unreadable, rewriting it from memory: {}", ex.getMessage());
            return new LinkedHashMap<>(snapshot);
        }
    }

    private void writeFile(Map<String, Long> mappings) {
        Path tempFile = null;
        try {
            Path directory = mappingsFile.getParent();
            Files.createDirectories(directory);
            tempFile = Files.createTempFile(directory, mappingsFile.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), mappings);
            try {
                Files.move(tempFile, mappingsFile,
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tempFile, mappingsFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            deleteQuietly(tempFile);
            throw new MappingStorageException("Cannot write " + mappingsFile, ex);
        }
    }

    private void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Failed to delete temp file {}: {}", file, ex.getMessage());
        }
    }

    private void publish(Map<String, Long> mappings) {
        synchronized (snapshotMonitor) {
            snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(mappings));
        }
    }

    /**
     * File contents, plus snapshot entries the file lacks, with unpersisted
     * entries on top. Publishes and returns the result. Caller holds snapshotMonitor.
     */
    private Map<String, Long> mergeWithMemory(Map<String, Long> fromFile) {
        Map<String, Long> next = new LinkedHashMap<>(fromFile);
        snapshot.forEach(next::putIfAbsent);
        next.putAll(unpersisted);
        snapshot = Collections.unmodifiableMap(next);
        return new LinkedHashMap<>(next);
    }

    /** Drop unpersisted entries the written map carries with the same owner. */
    private void markPersisted(Map<String, Long> written) {
        synchronized (snapshotMonitor) {
            unpersisted.entrySet().removeIf(entry -> entry.getValue().equals(written.get(entry.getKey())));
        }
    }

    private void putInMemory(String normalizedNumber, long subscriberId) {
        synchronized (snapshotMonitor) {
            unpersisted.put(normalizedNumber, subscriberId);
            Map<String, Long> next = new LinkedHashMap<>(snapshot);
            next.put(normalizedNumber, subscriberId);
            snapshot = Collections.unmodifiableMap(next);
        }
    }
}
