package com.example.podcast_backend.repository;

import com.example.podcast_backend.model.Account;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.model.PlanTier;
import com.example.podcast_backend.util.MediaCategory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class MediaItemRepositoryTest {

    @Autowired
    private MediaItemRepository mediaRepository;

    @Autowired
    private AccountRepository accountRepository;

    @Test
    void filenameSuffixMatchIsCaseInsensitive() {
        Account owner = accountRepository.save(new Account("ext-" + UUID.randomUUID(), PlanTier.STARTER));
        mediaRepository.saveAndFlush(new MediaItem(owner, MediaCategory.MAIN_CONTENT, "uploads/abc123_Show_12.MP3"));
        mediaRepository.saveAndFlush(new MediaItem(owner, MediaCategory.MAIN_CONTENT, "uploads/abc123Xshow_12.mp3"));

        var hits = mediaRepository.findByOwnerIdAndFilenameEndingWithIgnoreCaseOrderByCreatedAtAsc(owner.getId(), "_show_12.mp3");

        assertThat(hits).extracting(MediaItem::getFilename).containsExactly("uploads/abc123_Show_12.MP3");
    }
}
