package com.example.podcast_backend.service.transcript;

import com.example.podcast_backend.model.Account;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.model.PlanTier;
import com.example.podcast_backend.model.TranscriptRecord;
import com.example.podcast_backend.repository.AccountRepository;
import com.example.podcast_backend.repository.MediaItemRepository;
import com.example.podcast_backend.repository.TranscriptRecordRepository;
import com.example.podcast_backend.service.storage.StorageResolver;
import com.example.podcast_backend.util.MediaCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Archive reads can be slow; they must run after the database reads have returned their connection.
 */
@DataJpaTest
@Import(TranscriptAssociationResolver.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class TranscriptLookupConnectionTest {

    private static final byte[] WORDS = "[{\"word\":\"hi\",\"start\":0.0,\"end\":0.4}]".getBytes(StandardCharsets.UTF_8);

    @TestConfiguration
    static class JsonConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Autowired
    private TranscriptAssociationResolver resolver;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private MediaItemRepository mediaRepository;

    @Autowired
    private TranscriptRecordRepository transcriptRepository;

    @MockitoBean
    private StorageResolver storage;

    private final List<Boolean> transactionDuringRead = new ArrayList<>();
    private Account owner;

    @BeforeEach
    void setUp() {
        owner = accountRepository.save(new Account("ext-" + UUID.randomUUID(), PlanTier.STARTER));
        when(storage.readIfExists(anyString())).thenAnswer(inv -> {
            transactionDuringRead.add(TransactionSynchronizationManager.isActualTransactionActive());
            return Optional.of(WORDS);
        });
    }

    @AfterEach
    void tearDown() {
        transcriptRepository.deleteAll();
        mediaRepository.deleteAll();
        accountRepository.delete(owner);
    }

    @Test
    void linkedArchiveIsReadWithoutAnOpenTransaction() {
        MediaItem media = mediaRepository.save(new MediaItem(owner, MediaCategory.MAIN_CONTENT, "Show 7.mp3"));
        TranscriptRecord record = new TranscriptRecord(media, "whisper");
        record.setArchiveLocator("r2://bucket/transcripts/show-7.json");
        transcriptRepository.save(record);

        Optional<TranscriptLookup> lookup = resolver.resolve(owner.getId(), "Show 7.mp3");

        assertThat(lookup).isPresent();
        assertThat(lookup.get().source()).isEqualTo(TranscriptLookup.Source.ARCHIVE);
        assertThat(transactionDuringRead).containsExactly(false);
    }

    @Test
    void legacySearchRunsWithoutAnOpenTransaction() {
        mediaRepository.save(new MediaItem(owner, MediaCategory.MAIN_CONTENT, "Show 8.mp3"));
        when(storage.locatorsFor(anyString())).thenAnswer(inv -> List.of("r2://bucket/" + inv.getArgument(0)));

        Optional<TranscriptLookup> lookup = resolver.resolve(owner.getId(), "Show 8.mp3");

        assertThat(lookup).isPresent();
        assertThat(transactionDuringRead).isNotEmpty().containsOnly(false);
    }
}
