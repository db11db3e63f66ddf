package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.exception.ObjectNotFoundException;
import com.example.podcast_backend.exception.StorageException;
import com.example.podcast_backend.exception.TransientStorageException;
import com.example.podcast_backend.service.Interfaces.StorageBackend;
import com.example.podcast_backend.util.LocatorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Episodes that only live on the legacy hosting platform (Spreaker). The stream endpoint is
 * public on their side, so the playback URL is the platform URL itself.
 */
public class ExternalStreamBackend implements StorageBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExternalStreamBackend.class);

    private final WebClient webClient;
    private final String apiBase;
    private final Duration timeout;

    public ExternalStreamBackend(WebClient webClient, String apiBase, Duration timeout) {
        this.webClient = webClient;
        this.apiBase = apiBase.replaceAll("/+$", "");
        this.timeout = timeout;
    }

    @Override
    public LocatorKind kind() {
        return LocatorKind.EXTERNAL_STREAM;
    }

    @Override
    public void download(ParsedLocator locator, Path target) {
        URI uri = URI.create(apiBase + "/v2/episodes/" + locator.key() + "/download");
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Flux<DataBuffer> body = webClient.get().uri(uri).retrieve().bodyToFlux(DataBuffer.class);
            DataBufferUtils.write(body, target).block(timeout);
            LOGGER.debug("External stream download episode={} -> {}", locator.key(), target);
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 404 || status == 410) {
                throw new ObjectNotFoundException(locator.raw());
            }
            if (status == 429 || status >= 500) {
                throw new TransientStorageException("External stream fetch failed status=" + status + " " + locator.raw(), e);
            }
            throw new StorageException("External stream fetch failed status=" + status + " " + locator.raw(), e);
        } catch (WebClientRequestException e) {
            throw new TransientStorageException("External stream unreachable: " + locator.raw(), e);
        } catch (IOException e) {
            throw new StorageException("Cannot prepare target " + target, e);
        } catch (IllegalStateException e) {
            // block() timeout
            throw new TransientStorageException("External stream fetch timed out: " + locator.raw(), e);
        }
    }

    @Override
    public boolean exists(ParsedLocator locator) {
        try {
            webClient.head().uri(URI.create(apiBase + "/v2/episodes/" + locator.key()))
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
            return true;
        } catch (WebClientResponseException.NotFound e) {
            return false;
        } catch (WebClientRequestException e) {
            throw new TransientStorageException("External stream unreachable: " + locator.raw(), e);
        }
    }

    @Override
    public URI playbackUrl(ParsedLocator locator, Duration ttl) {
        return URI.create(apiBase + "/v2/episodes/" + locator.key() + "/play");
    }
}
