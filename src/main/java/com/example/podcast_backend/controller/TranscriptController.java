package com.example.podcast_backend.controller;

import com.example.podcast_backend.exception.TranscriptConflictException;
import com.example.podcast_backend.service.transcript.TranscriptAssociationResolver;
import com.example.podcast_backend.service.transcript.TranscriptLinkService;
import com.example.podcast_backend.service.transcript.TranscriptLookup;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
public class TranscriptController {
    private final TranscriptLinkService linkService;
    private final TranscriptAssociationResolver resolver;

    public TranscriptController(TranscriptLinkService linkService, TranscriptAssociationResolver resolver) {
        this.linkService = linkService;
        this.resolver = resolver;
    }

    public record AttachReq(JsonNode words, String archiveLocator, String provider, Boolean replace) {}
    public record AttachRes(UUID mediaId, UUID transcriptId) {}

    @PostMapping("/v1/media/{mediaId}/transcript")
    public AttachRes attach(@PathVariable UUID mediaId, @RequestBody AttachReq req) {
        try {
            UUID id = linkService.attach(mediaId, req.words(), req.archiveLocator(), req.provider(),
                    Boolean.TRUE.equals(req.replace()));
            return new AttachRes(mediaId, id);
        } catch (TranscriptConflictException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "TRANSCRIPT_CONFLICT", e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TRANSCRIPT_EMPTY", e);
        }
    }

    @GetMapping("/v1/transcripts/lookup")
    public TranscriptLookup lookup(@RequestParam UUID ownerId, @RequestParam String filename) {
        return resolver.resolve(ownerId, filename)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "TRANSCRIPT_NOT_FOUND"));
    }
}
