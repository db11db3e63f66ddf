package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.exception.MissingInputException;
import com.example.podcast_backend.exception.ObjectNotFoundException;
import com.example.podcast_backend.exception.SigningException;
import com.example.podcast_backend.exception.TransientStorageException;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.service.Interfaces.StorageBackend;
import com.example.podcast_backend.util.LocatorKind;
import com.example.podcast_backend.util.MediaCategory;
import com.example.podcast_backend.util.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StorageResolverTest {

    @Mock
    private StorageBackend r2;

    @Mock
    private StorageBackend local;

    @TempDir
    Path workDir;

    private StorageResolver resolver;

    @BeforeEach
    void setUp() {
        when(r2.kind()).thenReturn(LocatorKind.PRIMARY_CLOUD);
        when(local.kind()).thenReturn(LocatorKind.LOCAL_CACHE);
        resolver = newResolver(false);
    }

    private StorageResolver newResolver(boolean allowLocalOnly) {
        return new StorageResolver(List.of(local, r2), new LocatorParser("bucket", null, null),
                Duration.ofMinutes(30), new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(2)), allowLocalOnly);
    }

    private static MediaItem media(String cloudLocator, String localPath) {
        MediaItem media = new MediaItem(null, MediaCategory.MAIN_CONTENT, "Episode 1.mp3");
        media.setId(UUID.randomUUID());
        media.setCloudLocator(cloudLocator);
        media.setLocalCachePath(localPath);
        return media;
    }

    @Test
    void cloudCopyWinsOverLocalCache() {
        MediaItem media = media("r2://bucket/raw/ep1.mp3", "cache/ep1.mp3");

        Path out = resolver.resolveBytes(media, workDir);

        assertThat(out.getParent()).isEqualTo(workDir);
        assertThat(out.getFileName().toString()).isEqualTo(media.getId() + "-Episode_1.mp3");
        verify(r2).download(argThat(p -> p.key().equals("raw/ep1.mp3")), eq(out));
        verify(local, never()).download(any(), any());
    }

    @Test
    void fallsBackToLocalCacheWhenCloudObjectIsMissing() {
        MediaItem media = media("r2://bucket/raw/ep1.mp3", "cache/ep1.mp3");
        doThrow(new ObjectNotFoundException("r2://bucket/raw/ep1.mp3")).when(r2).download(any(), any());

        resolver.resolveBytes(media, workDir);

        verify(local).download(argThat(p -> p.key().equals("cache/ep1.mp3")), any());
    }

    @Test
    void localOnlyMediaIsRejectedUnlessAllowed() {
        MediaItem media = media(null, "cache/ep1.mp3");

        MissingInputException ex = assertThrows(MissingInputException.class, () -> resolver.resolveBytes(media, workDir));

        assertThat(ex.getMediaId()).isEqualTo(media.getId());
        verify(local, never()).download(any(), any());
    }

    @Test
    void localOnlyMediaResolvesWhenAllowed() {
        MediaItem media = media(null, "cache/ep1.mp3");

        newResolver(true).resolveBytes(media, workDir);

        verify(local).download(any(), any());
    }

    @Test
    void persistentTransientFailureIsReportedAsTransient() {
        MediaItem media = media("r2://bucket/raw/ep1.mp3", null);
        doThrow(new TransientStorageException("503")).when(r2).download(any(), any());

        assertThrows(TransientStorageException.class, () -> resolver.resolveBytes(media, workDir));

        verify(r2, times(2)).download(any(), any());
    }

    @Test
    void objectAbsentEverywhereIsMissingInput() {
        MediaItem media = media("r2://bucket/raw/ep1.mp3", null);
        doThrow(new ObjectNotFoundException("r2://bucket/raw/ep1.mp3")).when(r2).download(any(), any());

        assertThrows(MissingInputException.class, () -> resolver.resolveBytes(media, workDir));
    }

    @Test
    void signingFailureYieldsNoUrlAtAll() {
        when(r2.playbackUrl(any(), eq(Duration.ofMinutes(30)))).thenThrow(new SigningException("no creds", null));

        Optional<URI> url = resolver.resolvePlaybackUrl("r2://bucket/episodes/1/episode.mp3");

        assertThat(url).isEmpty();
    }

    @Test
    void signedUrlIsReturnedWhenSigningWorks() {
        URI signed = URI.create("https://acct.r2.cloudflarestorage.com/bucket/episodes/1/episode.mp3?X-Amz-Signature=abc");
        when(r2.playbackUrl(any(), any())).thenReturn(signed);

        assertThat(resolver.resolvePlaybackUrl("r2://bucket/episodes/1/episode.mp3")).contains(signed);
    }

    @Test
    void localCacheLocatorsNeverProducePlaybackUrls() {
        assertThat(resolver.resolvePlaybackUrl("file:cache/episode.mp3")).isEmpty();
        verify(local, never()).playbackUrl(any(), any());
    }
}
