package com.example.podcast_backend.service.transcript;

import com.example.podcast_backend.exception.TranscriptConflictException;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.model.TranscriptRecord;
import com.example.podcast_backend.repository.MediaItemRepository;
import com.example.podcast_backend.repository.TranscriptRecordRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.Objects;
import java.util.UUID;

/**
 * Writes the media to transcript link. One record per media; its content only changes when the
 * caller asks for a replacement.
 */
@Service
public class TranscriptLinkService {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptLinkService.class);

    private final MediaItemRepository mediaRepo;
    private final TranscriptRecordRepository transcriptRepo;

    public TranscriptLinkService(MediaItemRepository mediaRepo, TranscriptRecordRepository transcriptRepo) {
        this.mediaRepo = mediaRepo;
        this.transcriptRepo = transcriptRepo;
    }

    @Transactional
    public UUID attach(UUID mediaId, JsonNode words, String archiveLocator, String provider, boolean replace) {
        if ((words == null || words.isNull() || words.isEmpty()) && (archiveLocator == null || archiveLocator.isBlank())) {
            throw new IllegalArgumentException("Transcript needs inline words or an archive locator");
        }
        MediaItem media = mediaRepo.findById(mediaId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "MEDIA_NOT_FOUND"));

        var existing = transcriptRepo.findByMediaId(mediaId);
        if (existing.isPresent()) {
            TranscriptRecord record = existing.get();
            if (sameContent(record, words, archiveLocator)) {
                return record.getId();
            }
            if (!replace) {
                throw new TranscriptConflictException(mediaId, record.getId());
            }
            LOGGER.warn("TRANSCRIPT replace media={} transcript={} provider={} -> {}",
                    mediaId, record.getId(), record.getProvider(), provider);
            fill(record, words, archiveLocator, provider);
            return transcriptRepo.save(record).getId();
        }

        TranscriptRecord record = new TranscriptRecord(media, provider);
        fill(record, words, archiveLocator, provider);
        try {
            UUID id = transcriptRepo.saveAndFlush(record).getId();
            LOGGER.info("TRANSCRIPT linked media={} transcript={} provider={}", mediaId, id, provider);
            return id;
        } catch (DataIntegrityViolationException race) {
            // another writer linked this media first; the session is unusable now
            throw new TranscriptConflictException(mediaId, race);
        }
    }

    private static void fill(TranscriptRecord record, JsonNode words, String archiveLocator, String provider) {
        record.setProvider(provider == null || provider.isBlank() ? "unknown" : provider);
        record.setWords(words);
        record.setArchiveLocator(archiveLocator);
    }

    private static boolean sameContent(TranscriptRecord record, JsonNode words, String archiveLocator) {
        return Objects.equals(record.getWords(), words) && Objects.equals(record.getArchiveLocator(), archiveLocator);
    }
}
