package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.exception.ObjectNotFoundException;
import com.example.podcast_backend.exception.SigningException;
import com.example.podcast_backend.exception.StorageException;
import com.example.podcast_backend.exception.TransientStorageException;
import com.example.podcast_backend.service.Interfaces.StorageBackend;
import com.example.podcast_backend.util.LocatorKind;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Legacy Google Cloud Storage bucket. Still read for older episodes; new artifacts only land here
 * when no primary backend is configured.
 */
public class GcsStorageBackend implements StorageBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(GcsStorageBackend.class);

    private final Storage storage;
    private final String bucket;
    private final boolean publicBucket;

    public GcsStorageBackend(Storage storage, String bucket, boolean publicBucket) {
        this.storage = storage;
        this.bucket = bucket;
        this.publicBucket = publicBucket;
        if (publicBucket) {
            LOGGER.warn("GCS bucket {} configured PUBLIC: playback URLs are unsigned", bucket);
        }
    }

    @Override
    public LocatorKind kind() {
        return LocatorKind.LEGACY_CLOUD;
    }

    @Override
    public void download(ParsedLocator locator, Path target) {
        try {
            Blob blob = storage.get(blobId(locator));
            if (blob == null) {
                throw new ObjectNotFoundException(locator.raw());
            }
            Files.createDirectories(target.toAbsolutePath().getParent());
            blob.downloadTo(target);
            LOGGER.debug("GCS download {} -> {}", locator.raw(), target);
        } catch (com.google.cloud.storage.StorageException e) {
            throw translate("download", locator, e);
        } catch (IOException e) {
            throw new StorageException("Cannot prepare target " + target, e);
        }
    }

    @Override
    public boolean exists(ParsedLocator locator) {
        try {
            return storage.get(blobId(locator)) != null;
        } catch (com.google.cloud.storage.StorageException e) {
            throw translate("get", locator, e);
        }
    }

    @Override
    public URI playbackUrl(ParsedLocator locator, Duration ttl) {
        String b = locator.bucket() != null ? locator.bucket() : bucket;
        if (publicBucket && b.equals(bucket)) {
            return URI.create("https://storage.googleapis.com/" + b + "/" + locator.key());
        }
        try {
            BlobInfo info = BlobInfo.newBuilder(b, locator.key()).build();
            return storage.signUrl(info, ttl.toSeconds(), TimeUnit.SECONDS, Storage.SignUrlOption.withV4Signature()).toURI();
        } catch (Exception e) {
            // missing signing credentials end up here too
            throw new SigningException("GCS signing failed for " + locator.raw(), e);
        }
    }

    @Override
    public String upload(Path source, String key, String contentType) {
        BlobInfo info = BlobInfo.newBuilder(bucket, key).setContentType(contentType).build();
        try {
            storage.createFrom(info, source);
            LOGGER.info("GCS upload bucket={} key={}", bucket, key);
            return "gs://" + bucket + "/" + key;
        } catch (com.google.cloud.storage.StorageException e) {
            throw translate("upload", new ParsedLocator(kind(), bucket, key, "gs://" + bucket + "/" + key), e);
        } catch (IOException e) {
            throw new StorageException("Cannot read upload source " + source, e);
        }
    }

    @Override
    public Optional<String> locatorFor(String key) {
        return Optional.of("gs://" + bucket + "/" + key);
    }

    @Override
    public void delete(ParsedLocator locator) {
        try {
            storage.delete(blobId(locator));
        } catch (com.google.cloud.storage.StorageException e) {
            throw translate("delete", locator, e);
        }
    }

    private BlobId blobId(ParsedLocator locator) {
        return BlobId.of(locator.bucket() != null ? locator.bucket() : bucket, locator.key());
    }

    private static StorageException translate(String op, ParsedLocator locator, com.google.cloud.storage.StorageException e) {
        if (e.getCode() == 404) {
            return new ObjectNotFoundException(locator.raw());
        }
        String message = String.format("GCS %s failed: locator=%s code=%s", op, locator.raw(), e.getCode());
        if (e.isRetryable() || e.getCode() == 429 || e.getCode() >= 500) {
            return new TransientStorageException(message, e);
        }
        return new StorageException(message, e);
    }
}
