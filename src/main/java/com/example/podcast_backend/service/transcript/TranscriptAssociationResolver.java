package com.example.podcast_backend.service.transcript;

import com.example.podcast_backend.dto.WordTiming;
import com.example.podcast_backend.dto.WordsParser;
import com.example.podcast_backend.exception.RetriesExhaustedException;
import com.example.podcast_backend.exception.StorageException;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.model.TranscriptRecord;
import com.example.podcast_backend.repository.MediaItemRepository;
import com.example.podcast_backend.repository.TranscriptRecordRepository;
import com.example.podcast_backend.service.storage.StorageResolver;
import com.example.podcast_backend.util.LocatorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Finds word timings for a media file whatever machine uploaded or transcribed it.
 *
 * <p>Media is matched by {@link MediaMatchStrategy} in order, then the transcript is read through
 * the media id link. Filename search in the transcript archives is only a fallback for media that
 * predates the link table.
 *
 * <p>No transaction spans a lookup. Each repository call is its own short read, so archive reads
 * never hold a pooled connection.
 */
@Service
public class TranscriptAssociationResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptAssociationResolver.class);

    static final String ARCHIVE_PREFIX = "transcripts/";
    static final List<String> ARCHIVE_SUFFIXES = List.of(".json", ".words.json", ".original.json");

    private final MediaItemRepository mediaRepo;
    private final TranscriptRecordRepository transcriptRepo;
    private final StorageResolver storage;
    private final ObjectMapper objectMapper;

    public TranscriptAssociationResolver(MediaItemRepository mediaRepo, TranscriptRecordRepository transcriptRepo,
                                         StorageResolver storage, ObjectMapper objectMapper) {
        this.mediaRepo = mediaRepo;
        this.transcriptRepo = transcriptRepo;
        this.storage = storage;
        this.objectMapper = objectMapper;
    }

    public Optional<TranscriptLookup> resolve(UUID ownerId, String filenameOrLocator) {
        if (filenameOrLocator == null || filenameOrLocator.isBlank()) {
            return Optional.empty();
        }
        Optional<MediaItem> media = findMedia(ownerId, filenameOrLocator);
        if (media.isPresent()) {
            Optional<TranscriptLookup> linked = forMedia(media.get().getId());
            if (linked.isPresent()) {
                return linked;
            }
            LOGGER.info("TRANSCRIPT no linked record media={} query={} -> legacy search", media.get().getId(), filenameOrLocator);
        }
        return legacySearch(filenameOrLocator, media.map(MediaItem::getId).orElse(null));
    }

    /**
     * Transcript linked to a known media id; no filename matching involved.
     */
    public Optional<TranscriptLookup> forMedia(UUID mediaId) {
        return transcriptRepo.findByMediaId(mediaId).flatMap(record -> load(mediaId, record));
    }

    /**
     * First strategy with a hit wins; within a strategy the oldest media wins.
     */
    public Optional<MediaItem> findMedia(UUID ownerId, String query) {
        for (MediaMatchStrategy strategy : MediaMatchStrategy.values()) {
            List<MediaItem> hits = strategy.candidates(ownerId, query, mediaRepo);
            if (hits.isEmpty()) {
                continue;
            }
            if (hits.size() > 1) {
                LOGGER.warn("TRANSCRIPT ambiguous media strategy={} query={} hits={} picked={}",
                        strategy, query, hits.size(), hits.get(0).getId());
            } else {
                LOGGER.debug("TRANSCRIPT media strategy={} query={} media={}", strategy, query, hits.get(0).getId());
            }
            return Optional.of(hits.get(0));
        }
        return Optional.empty();
    }

    private Optional<TranscriptLookup> load(UUID mediaId, TranscriptRecord record) {
        if (record.hasInlineWords()) {
            return Optional.of(new TranscriptLookup(WordsParser.extract(record.getWords()),
                    TranscriptLookup.Source.INLINE, mediaId, record.getId()));
        }
        String locator = record.getArchiveLocator();
        if (locator == null || locator.isBlank()) {
            LOGGER.warn("TRANSCRIPT record without words or archive media={} transcript={}", mediaId, record.getId());
            return Optional.empty();
        }
        return readWords(locator)
                .map(words -> new TranscriptLookup(words, TranscriptLookup.Source.ARCHIVE, mediaId, record.getId()));
    }

    private Optional<TranscriptLookup> legacySearch(String query, UUID mediaId) {
        for (String stem : FilenameVariants.stemVariants(query)) {
            for (String suffix : ARCHIVE_SUFFIXES) {
                for (String locator : storage.locatorsFor(ARCHIVE_PREFIX + stem + suffix)) {
                    Optional<List<WordTiming>> words = readWords(locator);
                    if (words.isPresent()) {
                        TranscriptLookup.Source source = storage.kindOf(locator) == LocatorKind.LOCAL_CACHE
                                ? TranscriptLookup.Source.LEGACY_LOCAL
                                : TranscriptLookup.Source.LEGACY_ARCHIVE;
                        LOGGER.info("TRANSCRIPT legacy hit query={} locator={} source={}", query, locator, source);
                        return Optional.of(new TranscriptLookup(words.get(), source, mediaId, null));
                    }
                }
            }
        }
        LOGGER.info("TRANSCRIPT none query={}", query);
        return Optional.empty();
    }

    private Optional<List<WordTiming>> readWords(String locator) {
        Optional<byte[]> bytes;
        try {
            bytes = storage.readIfExists(locator);
        } catch (StorageException | RetriesExhaustedException | IllegalArgumentException e) {
            LOGGER.warn("TRANSCRIPT archive unreadable locator={} cause={}", locator, e.toString());
            return Optional.empty();
        }
        if (bytes.isEmpty()) {
            return Optional.empty();
        }
        try {
            List<WordTiming> words = WordsParser.extract(objectMapper.readTree(bytes.get()));
            return words.isEmpty() ? Optional.empty() : Optional.of(words);
        } catch (IOException e) {
            LOGGER.warn("TRANSCRIPT archive is not json locator={} cause={}", locator, e.getMessage());
            return Optional.empty();
        }
    }
}
