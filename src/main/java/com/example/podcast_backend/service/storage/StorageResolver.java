package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.exception.MissingInputException;
import com.example.podcast_backend.exception.ObjectNotFoundException;
import com.example.podcast_backend.exception.RetriesExhaustedException;
import com.example.podcast_backend.exception.StorageException;
import com.example.podcast_backend.exception.TransientStorageException;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.service.Interfaces.StorageBackend;
import com.example.podcast_backend.util.BoundedRetry;
import com.example.podcast_backend.util.LocatorKind;
import com.example.podcast_backend.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point to every storage backend. Built once at startup by
 * {@link com.example.podcast_backend.config.StorageConfig} and injected where needed.
 *
 * <ul>
 *     <li>{@link #resolveBytes} fetches assembly inputs, trying backends in {@link LocatorKind} order.</li>
 *     <li>{@link #resolvePlaybackUrl} returns a time-limited URL or nothing; it never falls back to
 *     an unsigned URL on a signing failure.</li>
 * </ul>
 */
public class StorageResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageResolver.class);

    private final Map<LocatorKind, StorageBackend> backends = new EnumMap<>(LocatorKind.class);
    private final LocatorParser parser;
    private final Duration signedUrlTtl;
    private final RetryPolicy fetchRetry;
    private final boolean allowLocalOnly;

    public StorageResolver(List<StorageBackend> backends, LocatorParser parser, Duration signedUrlTtl,
                           RetryPolicy fetchRetry, boolean allowLocalOnly) {
        for (StorageBackend backend : backends) {
            this.backends.put(backend.kind(), backend);
        }
        this.parser = parser;
        this.signedUrlTtl = signedUrlTtl;
        this.fetchRetry = fetchRetry;
        this.allowLocalOnly = allowLocalOnly;
        LOGGER.info("StorageResolver wired backends={} signedUrlTtl={}", this.backends.keySet(), signedUrlTtl);
    }

    /**
     * Copies the bytes behind {@code media} into {@code workDir}.
     *
     * @return the local file
     * @throws MissingInputException      when no backend has the object
     * @throws TransientStorageException  when at least one backend kept failing transiently
     */
    public Path resolveBytes(MediaItem media, Path workDir) {
        if (!media.hasAuthoritativeLocator() && !allowLocalOnly) {
            throw new MissingInputException(media.getId(),
                    "Media has neither a cloud locator nor an external host id: " + media.getFilename());
        }
        Path target = workDir.resolve(media.getId() + "-" + safeName(media.getFilename()));
        RuntimeException transientFailure = null;
        RuntimeException otherFailure = null;

        for (ParsedLocator candidate : candidatesFor(media)) {
            StorageBackend backend = backends.get(candidate.kind());
            if (backend == null) {
                LOGGER.warn("STORAGE skip media={} kind={} reason=backend_not_configured", media.getId(), candidate.kind());
                continue;
            }
            try {
                fetchWithRetry(backend, candidate, target);
                LOGGER.info("STORAGE resolved media={} kind={} locator={}", media.getId(), candidate.kind(), candidate.raw());
                return target;
            } catch (ObjectNotFoundException e) {
                LOGGER.warn("STORAGE miss media={} kind={} locator={}", media.getId(), candidate.kind(), candidate.raw());
            } catch (RetriesExhaustedException | TransientStorageException e) {
                transientFailure = e;
                LOGGER.warn("STORAGE transient failure media={} kind={} cause={}", media.getId(), candidate.kind(), e.toString());
            } catch (StorageException e) {
                otherFailure = e;
                LOGGER.warn("STORAGE failure media={} kind={} cause={}", media.getId(), candidate.kind(), e.toString());
            }
        }
        if (transientFailure != null) {
            throw new TransientStorageException("Input temporarily unavailable: media=" + media.getId(), transientFailure);
        }
        throw new MissingInputException(media.getId(),
                "Input not found on any backend: media=" + media.getId() + " filename=" + media.getFilename(), otherFailure);
    }

    /**
     * Time-limited playback URL for a finished artifact. Empty when the locator is local-only,
     * its backend is not configured or signing failed.
     */
    public Optional<URI> resolvePlaybackUrl(String locator) {
        ParsedLocator parsed;
        try {
            parsed = parser.parse(locator);
        } catch (IllegalArgumentException e) {
            LOGGER.warn("PLAYBACK unparseable locator={} cause={}", locator, e.getMessage());
            return Optional.empty();
        }
        if (parsed.kind() == LocatorKind.LOCAL_CACHE) {
            return Optional.empty();
        }
        StorageBackend backend = backends.get(parsed.kind());
        if (backend == null) {
            LOGGER.warn("PLAYBACK no backend kind={} locator={}", parsed.kind(), locator);
            return Optional.empty();
        }
        try {
            return Optional.of(backend.playbackUrl(parsed, signedUrlTtl));
        } catch (StorageException e) {
            LOGGER.error("PLAYBACK_URL_UNAVAILABLE kind={} locator={} cause={}", parsed.kind(), locator, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Uploads to the highest priority backend that accepts writes.
     *
     * @return locator of the stored object
     */
    public String upload(Path source, String key, String contentType) {
        StorageBackend backend = uploadBackend();
        return BoundedRetry.run("upload " + key, fetchRetry, TransientStorageException.class::isInstance,
                () -> backend.upload(source, key, contentType));
    }

    /**
     * Reads a small object (transcript archive) if it exists.
     */
    public Optional<byte[]> readIfExists(String locator) {
        ParsedLocator parsed = parser.parse(locator);
        StorageBackend backend = backends.get(parsed.kind());
        if (backend == null) {
            return Optional.empty();
        }
        Path tmp = null;
        try {
            tmp = Files.createTempFile("storage-read-", ".tmp");
            fetchWithRetry(backend, parsed, tmp);
            return Optional.of(Files.readAllBytes(tmp));
        } catch (ObjectNotFoundException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Cannot read " + locator, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    /**
     * Locators under which {@code key} would live on each configured backend, in priority order.
     */
    public List<String> locatorsFor(String key) {
        List<String> out = new ArrayList<>();
        for (StorageBackend backend : backends.values()) {
            backend.locatorFor(key).ifPresent(out::add);
        }
        return out;
    }

    public LocatorKind kindOf(String locator) {
        return parser.parse(locator).kind();
    }

    public void deleteLocalCache(String localCachePath) {
        StorageBackend local = backends.get(LocatorKind.LOCAL_CACHE);
        if (local == null) {
            throw new StorageException("Local cache backend not configured");
        }
        local.delete(new ParsedLocator(LocatorKind.LOCAL_CACHE, null, localCachePath, "file:" + localCachePath));
    }

    List<ParsedLocator> candidatesFor(MediaItem media) {
        List<ParsedLocator> out = new ArrayList<>();
        if (media.getCloudLocator() != null && !media.getCloudLocator().isBlank()) {
            try {
                out.add(parser.parse(media.getCloudLocator()));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("STORAGE bad cloud locator media={} locator={} cause={}", media.getId(), media.getCloudLocator(), e.getMessage());
            }
        }
        if (media.getLocalCachePath() != null && !media.getLocalCachePath().isBlank()) {
            out.add(new ParsedLocator(LocatorKind.LOCAL_CACHE, null, media.getLocalCachePath(), "file:" + media.getLocalCachePath()));
        }
        if (media.getExternalHostId() != null && !media.getExternalHostId().isBlank()) {
            String id = media.getExternalHostId().trim();
            out.add(new ParsedLocator(LocatorKind.EXTERNAL_STREAM, null, id, "spreaker://episode/" + id));
        }
        out.sort(Comparator.comparingInt(p -> p.kind().ordinal()));
        return out;
    }

    private void fetchWithRetry(StorageBackend backend, ParsedLocator locator, Path target) {
        BoundedRetry.runVoid("fetch " + locator.raw(), fetchRetry, TransientStorageException.class::isInstance,
                () -> backend.download(locator, target));
    }

    private StorageBackend uploadBackend() {
        for (LocatorKind kind : List.of(LocatorKind.PRIMARY_CLOUD, LocatorKind.LEGACY_CLOUD, LocatorKind.LOCAL_CACHE)) {
            StorageBackend backend = backends.get(kind);
            if (backend != null) {
                return backend;
            }
        }
        throw new StorageException("No writable storage backend configured");
    }

    private static String safeName(String filename) {
        if (filename == null || filename.isBlank()) {
            return "input";
        }
        String base = filename.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        return base.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOGGER.warn("STORAGE temp cleanup failed path={} cause={}", p, e.toString());
        }
    }
}
