package com.example.podcast_backend.repository;

import com.example.podcast_backend.model.PodcastTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface PodcastTemplateRepository extends JpaRepository<PodcastTemplate, UUID> {
}
