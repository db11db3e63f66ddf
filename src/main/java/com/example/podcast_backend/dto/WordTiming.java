package com.example.podcast_backend.dto;

public record WordTiming(String text, long startMs, long endMs) {
    public WordTiming {
        text = text == null ? "" : text;
        startMs = Math.max(0, startMs);
        endMs = Math.max(startMs, endMs);
    }
}
