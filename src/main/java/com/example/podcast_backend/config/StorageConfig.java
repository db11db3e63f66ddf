package com.example.podcast_backend.config;

import com.example.podcast_backend.service.Interfaces.StorageBackend;
import com.example.podcast_backend.service.storage.ExternalStreamBackend;
import com.example.podcast_backend.service.storage.GcsStorageBackend;
import com.example.podcast_backend.service.storage.LocalCacheBackend;
import com.example.podcast_backend.service.storage.LocatorParser;
import com.example.podcast_backend.service.storage.R2StorageBackend;
import com.example.podcast_backend.service.storage.StorageResolver;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the storage backends that are configured and hands them to one {@link StorageResolver}.
 * Credentials are read here once; nothing else caches them.
 */
@EnableConfigurationProperties({StorageProperties.class, CacheCleanupProperties.class})
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public LocatorParser locatorParser(StorageProperties properties) {
        return new LocatorParser(properties.getR2().getBucket(), properties.getR2().getPublicBaseUrl(), properties.getGcs().getBucket());
    }

    @Bean
    @ConditionalOnProperty(prefix = "storage.r2", name = "enabled", havingValue = "true")
    public S3Client r2Client(StorageProperties properties) {
        StorageProperties.R2 r2 = properties.getR2();
        return S3Client.builder()
                .region(Region.of("auto"))
                .credentialsProvider(r2Credentials(r2))
                .endpointOverride(URI.create(r2.resolvedEndpoint()))
                .forcePathStyle(true)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "storage.r2", name = "enabled", havingValue = "true")
    public S3Presigner r2Presigner(StorageProperties properties) {
        StorageProperties.R2 r2 = properties.getR2();
        return S3Presigner.builder()
                .region(Region.of("auto"))
                .credentialsProvider(r2Credentials(r2))
                .endpointOverride(URI.create(r2.resolvedEndpoint()))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "storage.gcs", name = "enabled", havingValue = "true")
    public Storage gcsStorage(StorageProperties properties) {
        StorageOptions.Builder builder = StorageOptions.newBuilder();
        if (properties.getGcs().getProjectId() != null && !properties.getGcs().getProjectId().isBlank()) {
            builder.setProjectId(properties.getGcs().getProjectId());
        }
        return builder.build().getService();
    }

    @Bean
    public StorageResolver storageResolver(StorageProperties properties,
                                           LocatorParser parser,
                                           ObjectProvider<S3Client> r2Client,
                                           ObjectProvider<S3Presigner> r2Presigner,
                                           ObjectProvider<Storage> gcsStorage,
                                           @Qualifier("streamWebClient") WebClient streamWebClient) {
        List<StorageBackend> backends = new ArrayList<>();

        S3Client s3 = r2Client.getIfAvailable();
        if (s3 != null) {
            backends.add(new R2StorageBackend(s3, r2Presigner.getObject(), properties.getR2().getBucket(), properties.getR2().getPublicBaseUrl()));
        }
        Storage gcs = gcsStorage.getIfAvailable();
        if (gcs != null) {
            backends.add(new GcsStorageBackend(gcs, properties.getGcs().getBucket(), properties.getGcs().isPublicBucket()));
        }
        StorageProperties.Local local = properties.getLocal();
        backends.add(new LocalCacheBackend(Path.of(local.getBaseDir()), local.getCachePrefix(), local.getTranscriptsPrefix()));
        if (properties.getSpreaker().isEnabled()) {
            backends.add(new ExternalStreamBackend(streamWebClient, properties.getSpreaker().getApiBase(), properties.getSpreaker().getTimeout()));
        }

        LOGGER.info("Storage wired: r2={} gcs={} localBase={} spreaker={} allowLocalOnly={}",
                s3 != null, gcs != null, local.getBaseDir(), properties.getSpreaker().isEnabled(), local.isAllowLocalOnly());
        return new StorageResolver(backends, parser, properties.getSignedUrlTtl(),
                properties.getFetchRetry().toPolicy(), local.isAllowLocalOnly());
    }

    private static StaticCredentialsProvider r2Credentials(StorageProperties.R2 r2) {
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(r2.getAccessKeyId(), r2.getSecretAccessKey()));
    }
}
