package com.feedwatch.engine.infrastructure.state;

import com.feedwatch.common.snapshot.Snapshot;
import com.feedwatch.engine.domain.exceptions.StateStoreException;
import com.feedwatch.engine.domain.state.SnapshotStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Keeps one JSON file per subscription key so dedup survives restarts.
 *
 * <p>A commit writes a temporary file in the same directory and atomically moves it over the
 * previous one; the in-memory view changes only once the move succeeded. A crash at any point
 * therefore leaves either the old or the new snapshot, never a mix.
 */
@Slf4j
public class FileSnapshotStore implements SnapshotStore {

    private static final String SUFFIX = ".json";
    private static final String HASHED_PREFIX = "sha256-";
    static final int MAX_ENCODED_NAME = 200;

    private final Path directory;
    private final ObjectMapper mapper;
    private final ConcurrentMap<String, Snapshot> snapshots = new ConcurrentHashMap<>();

    public FileSnapshotStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
        load();
    }

    @Override
    public Optional<Snapshot> get(String key) {
        return Optional.ofNullable(snapshots.get(key));
    }

    @Override
    public void commit(String key, Snapshot snapshot) {
        var target = directory.resolve(fileName(key));
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, ".snapshot-", ".tmp");
            Files.write(temp, mapper.writeValueAsBytes(new StoredSnapshot(key, snapshot)));
            replace(temp, target);
            temp = null;
        } catch (IOException | JacksonException e) {
            throw StateStoreException.commitFailed(key, e);
        } finally {
            deleteQuietly(temp);
        }
        snapshots.put(key, snapshot);
    }

    void replace(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private void load() {
        try {
            Files.createDirectories(directory);
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
                for (Path file : files) {
                    read(file);
                }
            }
        } catch (IOException e) {
            throw StateStoreException.loadFailed(directory.toString(), e);
        }
        log.info("Loaded {} snapshots from {}", snapshots.size(), directory);
    }

    private void read(Path file) throws IOException {
        try {
            var stored = mapper.readValue(Files.readAllBytes(file), StoredSnapshot.class);
            snapshots.put(stored.key(), stored.snapshot());
        } catch (JacksonException e) {
            // the subscription falls back to a fresh baseline
            log.warn("Ignoring unreadable snapshot {}: {}", file.getFileName(), e.getMessage());
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    /**
     * Base64url of the key, or a SHA-256 digest when that would exceed common file name limits.
     * Loading does not depend on the name since every file stores its key.
     */
    static String fileName(String key) {
        var bytes = key.getBytes(StandardCharsets.UTF_8);
        var encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        if (encoded.length() <= MAX_ENCODED_NAME) {
            return encoded + SUFFIX;
        }
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(bytes);
            return HASHED_PREFIX + HexFormat.of().formatHex(digest) + SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    record StoredSnapshot(String key, Snapshot snapshot) {}
}
