package com.example.podcast_backend.repository;

import com.example.podcast_backend.model.BillingEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface BillingEventRepository extends JpaRepository<BillingEvent, UUID> {
    Optional<BillingEvent> findByCorrelationId(String correlationId);
}
