package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.exception.ObjectNotFoundException;
import com.example.podcast_backend.exception.StorageException;
import com.example.podcast_backend.service.Interfaces.StorageBackend;
import com.example.podcast_backend.util.LocatorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Environment-scoped file cache. Never a source of playback URLs and never authoritative across
 * machines.
 */
public class LocalCacheBackend implements StorageBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalCacheBackend.class);

    private final Path baseDir;
    private final Path cacheDir;
    private final Path transcriptsDir;

    public LocalCacheBackend(Path baseDir, String cachePrefix, String transcriptsPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.cacheDir = this.baseDir.resolve(cachePrefix).normalize();
        this.transcriptsDir = this.baseDir.resolve(transcriptsPrefix).normalize();
        try {
            Files.createDirectories(cacheDir);
            Files.createDirectories(transcriptsDir);
            LOGGER.info("LocalCacheBackend ready. base={}, cache={}, transcripts={}", this.baseDir, cacheDir, transcriptsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create local cache directories", e);
        }
    }

    @Override
    public LocatorKind kind() {
        return LocatorKind.LOCAL_CACHE;
    }

    @Override
    public void download(ParsedLocator locator, Path target) {
        Path src = resolve(locator.key());
        if (!Files.isRegularFile(src)) {
            throw new ObjectNotFoundException(locator.raw());
        }
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.copy(src, target, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Copy failed from cache: " + src + " -> " + target, e);
        }
    }

    @Override
    public boolean exists(ParsedLocator locator) {
        return Files.isRegularFile(resolve(locator.key()));
    }

    @Override
    public URI playbackUrl(ParsedLocator locator, Duration ttl) {
        throw new StorageException("Local cache files have no playback URL: " + locator.raw());
    }

    @Override
    public String upload(Path source, String key, String contentType) {
        Path target = resolve(cacheDir.resolve(stripLeadingSlashes(key)).toString());
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Copy failed to " + target, e);
        }
        return "file:" + target;
    }

    @Override
    public Optional<String> locatorFor(String key) {
        return Optional.of("file:" + key);
    }

    @Override
    public void delete(ParsedLocator locator) {
        Path p = resolve(locator.key());
        try {
            Files.deleteIfExists(p);
            pruneEmptyParents(p.getParent());
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    /**
     * Resolves a cache path. Absolute paths are accepted as long as they stay below the base dir;
     * relative ones are taken relative to it.
     */
    Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new StorageException("cache key is blank");
        }
        String normalized = key.replace('\\', '/');
        Path candidate = Path.of(normalized);
        Path p = candidate.isAbsolute()
                ? candidate.normalize()
                : baseDir.resolve(stripLeadingSlashes(normalized)).normalize();
        if (!p.startsWith(baseDir)) {
            throw new StorageException("Invalid cache path (path traversal?): " + key);
        }
        return p;
    }

    private void pruneEmptyParents(Path dir) throws IOException {
        Path current = dir;
        while (current != null && current.startsWith(cacheDir) && !current.equals(cacheDir)) {
            try (var entries = Files.list(current)) {
                if (entries.findAny().isPresent()) {
                    return;
                }
            }
            Files.deleteIfExists(current);
            current = current.getParent();
        }
    }

    private static String stripLeadingSlashes(String key) {
        return key.replaceAll("^/+", "");
    }
}
