package com.example.podcast_backend.repository;

import com.example.podcast_backend.model.Account;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.model.PlanTier;
import com.example.podcast_backend.model.TranscriptRecord;
import com.example.podcast_backend.util.MediaCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
class TranscriptRecordRepositoryTest {

    @Autowired
    private TranscriptRecordRepository transcriptRepository;

    @Autowired
    private MediaItemRepository mediaRepository;

    @Autowired
    private AccountRepository accountRepository;

    @Test
    void oneTranscriptPerMedia() throws Exception {
        Account owner = accountRepository.save(new Account("ext-" + UUID.randomUUID(), PlanTier.STARTER));
        MediaItem media = mediaRepository.saveAndFlush(new MediaItem(owner, MediaCategory.MAIN_CONTENT, "Show 12.MP3"));

        TranscriptRecord first = new TranscriptRecord(media, "whisper");
        first.setWords(new ObjectMapper().readTree("[{\"word\":\"hi\",\"start\":0.0,\"end\":0.4}]"));
        transcriptRepository.saveAndFlush(first);

        assertThat(transcriptRepository.findByMediaId(media.getId())).isPresent();
        assertThrows(DataIntegrityViolationException.class,
                () -> transcriptRepository.saveAndFlush(new TranscriptRecord(media, "whisper")));
    }
}
