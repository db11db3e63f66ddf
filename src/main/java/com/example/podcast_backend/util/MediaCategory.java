package com.example.podcast_backend.util;

public enum MediaCategory {
    MAIN_CONTENT,
    INTRO,
    OUTRO,
    MUSIC,
    SFX,
    COVER
}
