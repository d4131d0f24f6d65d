package com.codeviz.core.cache;

import com.codeviz.core.model.FileMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * File-per-entry cache under a directory, by default {@code <root>/.code-viz/cache}.
 *
 * <p>Each entry is stored in {@code <sha256(path)>.json}. Entries are written to a
 * temporary file and moved into place, so readers never observe a partial entry and
 * concurrent writers of different paths never touch the same file.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * MetricsCache cache = new DiskCache(root, config.resolveCacheDirectory(root));
 * Optional<FileMetrics> cached = cache.get("src/app.ts");
 * }</pre>
 *
 * @since 1.0.0
 */
public class DiskCache implements MetricsCache {

    private static final Logger log = LoggerFactory.getLogger(DiskCache.class);

    private static final String ENTRY_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path projectRoot;
    private final Path cacheDirectory;
    private final ObjectMapper objectMapper;

    /**
     * @param projectRoot root that cached paths are relative to
     * @param cacheDirectory directory holding the entries; created on first write
     */
    public DiskCache(Path projectRoot, Path cacheDirectory) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        this.cacheDirectory = Objects.requireNonNull(cacheDirectory, "cacheDirectory must not be null");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<FileMetrics> get(String path) {
        Path entryFile = entryFile(path);
        if (!Files.isRegularFile(entryFile)) {
            return Optional.empty();
        }

        CacheEntry entry;
        try {
            entry = objectMapper.readValue(entryFile.toFile(), CacheEntry.class);
        } catch (IOException e) {
            log.debug("Unreadable cache entry for {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        if (entry.version() != CacheEntry.CURRENT_VERSION || !path.equals(entry.path())) {
            log.debug("Cache entry for {} does not match (version {}, path {})", path, entry.version(), entry.path());
            return Optional.empty();
        }

        Instant current;
        try {
            current = Files.getLastModifiedTime(projectRoot.resolve(path)).toInstant();
        } catch (IOException e) {
            log.debug("Cannot stat {} for cache validation: {}", path, e.getMessage());
            return Optional.empty();
        }
        if (!current.equals(entry.lastModified())) {
            log.debug("Cache entry for {} is stale (cached {}, current {})", path, entry.lastModified(), current);
            return Optional.empty();
        }

        try {
            return Optional.of(entry.toMetrics());
        } catch (IllegalArgumentException | NullPointerException e) {
            log.debug("Invalid cache entry for {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void set(FileMetrics metrics) throws CacheException {
        Path target = entryFile(metrics.path());
        Path temp = null;
        try {
            Files.createDirectories(cacheDirectory);
            temp = Files.createTempFile(cacheDirectory, keyFor(metrics.path()), TEMP_SUFFIX);
            objectMapper.writeValue(temp.toFile(), CacheEntry.from(metrics));
            moveIntoPlace(temp, target);
            temp = null;
        } catch (IOException e) {
            throw new CacheException("Failed to write cache entry for " + metrics.path(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public void invalidate(String path) throws CacheException {
        try {
            Files.deleteIfExists(entryFile(path));
        } catch (IOException e) {
            throw new CacheException("Failed to remove cache entry for " + path, e);
        }
    }

    @Override
    public void clear() throws CacheException {
        if (!Files.isDirectory(cacheDirectory)) {
            return;
        }
        int removed = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(cacheDirectory, "*" + ENTRY_SUFFIX)) {
            for (Path entry : entries) {
                Files.deleteIfExists(entry);
                removed++;
            }
        } catch (IOException e) {
            throw new CacheException("Failed to clear cache directory " + cacheDirectory, e);
        }
        log.info("Cleared {} cache entries from {}", removed, cacheDirectory);
    }

    Path entryFile(String path) {
        return cacheDirectory.resolve(keyFor(path) + ENTRY_SUFFIX);
    }

    /**
     * Hex SHA-256 of the relative path.
     */
    static String keyFor(String path) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(path.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, replacing non-atomically", target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temporary cache file {}: {}", temp, e.getMessage());
        }
    }
}
