package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.exception.ObjectNotFoundException;
import com.example.podcast_backend.exception.SigningException;
import com.example.podcast_backend.exception.StorageException;
import com.example.podcast_backend.exception.TransientStorageException;
import com.example.podcast_backend.service.Interfaces.StorageBackend;
import com.example.podcast_backend.util.LocatorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Cloudflare R2 through the S3 compatible API.
 */
public class R2StorageBackend implements StorageBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(R2StorageBackend.class);

    private final S3Client s3;
    private final S3Presigner presigner;
    private final String bucket;
    private final String publicBaseUrl;

    public R2StorageBackend(S3Client s3, S3Presigner presigner, String bucket, String publicBaseUrl) {
        this.s3 = s3;
        this.presigner = presigner;
        this.bucket = bucket;
        this.publicBaseUrl = publicBaseUrl == null || publicBaseUrl.isBlank() ? null : publicBaseUrl.replaceAll("/+$", "");
        if (this.publicBaseUrl != null) {
            LOGGER.warn("R2 bucket {} served via PUBLIC base url {}: playback URLs are unsigned", bucket, this.publicBaseUrl);
        }
    }

    @Override
    public LocatorKind kind() {
        return LocatorKind.PRIMARY_CLOUD;
    }

    @Override
    public void download(ParsedLocator locator, Path target) {
        String b = bucketOf(locator);
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.deleteIfExists(target);
            s3.getObject(GetObjectRequest.builder().bucket(b).key(locator.key()).build(), ResponseTransformer.toFile(target));
            LOGGER.debug("R2 download bucket={} key={} -> {}", b, locator.key(), target);
        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException(locator.raw());
        } catch (S3Exception e) {
            throw translate("download", locator, e);
        } catch (SdkClientException e) {
            throw new TransientStorageException("R2 download failed: " + locator.raw(), e);
        } catch (IOException e) {
            throw new StorageException("Cannot prepare target " + target, e);
        }
    }

    @Override
    public boolean exists(ParsedLocator locator) {
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(bucketOf(locator)).key(locator.key()).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) return false;
            throw translate("head", locator, e);
        } catch (SdkClientException e) {
            throw new TransientStorageException("R2 head failed: " + locator.raw(), e);
        }
    }

    @Override
    public URI playbackUrl(ParsedLocator locator, Duration ttl) {
        if (publicBaseUrl != null) {
            return URI.create(publicBaseUrl + "/" + locator.key());
        }
        try {
            GetObjectRequest get = GetObjectRequest.builder().bucket(bucketOf(locator)).key(locator.key()).build();
            GetObjectPresignRequest presign = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(get)
                    .build();
            return presigner.presignGetObject(presign).url().toURI();
        } catch (Exception e) {
            throw new SigningException("R2 presign failed for " + locator.raw(), e);
        }
    }

    @Override
    public String upload(Path source, String key, String contentType) {
        try {
            PutObjectRequest put = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType)
                    .build();
            s3.putObject(put, RequestBody.fromFile(source));
            LOGGER.info("R2 upload bucket={} key={} bytes={}", bucket, key, Files.size(source));
            return "r2://" + bucket + "/" + key;
        } catch (S3Exception e) {
            throw translate("upload", new ParsedLocator(kind(), bucket, key, "r2://" + bucket + "/" + key), e);
        } catch (SdkClientException e) {
            throw new TransientStorageException("R2 upload failed: " + key, e);
        } catch (IOException e) {
            throw new StorageException("Cannot read upload source " + source, e);
        }
    }

    @Override
    public Optional<String> locatorFor(String key) {
        return Optional.of("r2://" + bucket + "/" + key);
    }

    @Override
    public void delete(ParsedLocator locator) {
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucketOf(locator)).key(locator.key()).build());
        } catch (S3Exception e) {
            throw translate("delete", locator, e);
        }
    }

    private String bucketOf(ParsedLocator locator) {
        return locator.bucket() != null ? locator.bucket() : bucket;
    }

    private static StorageException translate(String op, ParsedLocator locator, S3Exception e) {
        int status = e.statusCode();
        if (status == 404) {
            return new ObjectNotFoundException(locator.raw());
        }
        String message = String.format("R2 %s failed: locator=%s statusCode=%s", op, locator.raw(), status);
        if (status == 429 || status >= 500) {
            return new TransientStorageException(message, e);
        }
        return new StorageException(message, e);
    }
}
