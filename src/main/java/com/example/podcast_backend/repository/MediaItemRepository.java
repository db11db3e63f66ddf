package com.example.podcast_backend.repository;

import com.example.podcast_backend.model.MediaItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface MediaItemRepository extends JpaRepository<MediaItem, UUID> {

    List<MediaItem> findByOwnerIdAndFilenameOrderByCreatedAtAsc(UUID ownerId, String filename);

    // derived LIKE queries escape '_' and '%', so filename suffixes are matched literally
    List<MediaItem> findByOwnerIdAndFilenameEndingWithIgnoreCaseOrderByCreatedAtAsc(UUID ownerId, String suffix);

    List<MediaItem> findByLocalCachePathIsNotNull();
}
