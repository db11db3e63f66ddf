package com.example.podcast_backend.service.storage;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.podcast_backend.util.LocatorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class R2StorageBackendTest {

    @Mock
    private S3Client s3;

    @Mock
    private S3Presigner presigner;

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Logger backendLogger = (Logger) LoggerFactory.getLogger(R2StorageBackend.class);

    @BeforeEach
    void attach() {
        appender.start();
        backendLogger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        backendLogger.detachAppender(appender);
    }

    private List<String> warnings() {
        return appender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Test
    void publicBaseUrlIsAnnouncedAndServesUnsignedUrls() {
        R2StorageBackend backend = new R2StorageBackend(s3, presigner, "episodes", "https://cdn.example.org//");

        URI url = backend.playbackUrl(
                new ParsedLocator(LocatorKind.PRIMARY_CLOUD, "episodes", "episodes/42/episode.mp3", "r2://episodes/episodes/42/episode.mp3"),
                Duration.ofHours(1));

        assertThat(url).isEqualTo(URI.create("https://cdn.example.org/episodes/42/episode.mp3"));
        assertThat(warnings()).singleElement().asString()
                .contains("episodes")
                .contains("https://cdn.example.org")
                .contains("unsigned");
        verifyNoInteractions(presigner);
    }

    @Test
    void privateBucketLogsNoWarning() {
        new R2StorageBackend(s3, presigner, "episodes", "  ");

        assertThat(warnings()).isEmpty();
    }
}
