package com.example.podcast_backend.repository;

import com.example.podcast_backend.model.TranscriptRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface TranscriptRecordRepository extends JpaRepository<TranscriptRecord, UUID> {
    Optional<TranscriptRecord> findByMediaId(UUID mediaId);
}
