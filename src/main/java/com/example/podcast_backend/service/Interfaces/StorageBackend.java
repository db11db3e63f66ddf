package com.example.podcast_backend.service.Interfaces;

import com.example.podcast_backend.exception.StorageException;
import com.example.podcast_backend.service.storage.ParsedLocator;
import com.example.podcast_backend.util.LocatorKind;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * One storage backend variant. Only {@link com.example.podcast_backend.service.storage.StorageResolver}
 * calls these directly.
 */
public interface StorageBackend {

    LocatorKind kind();

    /**
     * Copies the object to {@code target}, replacing it.
     * Throws {@link com.example.podcast_backend.exception.ObjectNotFoundException} when absent and
     * {@link com.example.podcast_backend.exception.TransientStorageException} when worth retrying.
     */
    void download(ParsedLocator locator, Path target);

    boolean exists(ParsedLocator locator);

    /** Time-limited URL; throws {@link com.example.podcast_backend.exception.SigningException} when signing fails. */
    URI playbackUrl(ParsedLocator locator, Duration ttl);

    /** Stores the file under {@code key} and returns the scheme-qualified locator. */
    default String upload(Path source, String key, String contentType) {
        throw new StorageException(kind() + " does not accept uploads");
    }

    /** Locator this backend would use for {@code key}, empty when it has no key space of its own. */
    default Optional<String> locatorFor(String key) {
        return Optional.empty();
    }

    default void delete(ParsedLocator locator) {
        throw new StorageException(kind() + " does not support delete");
    }
}
