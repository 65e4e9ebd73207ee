package com.footage.platform.scheduler.model;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;

@Getter
public enum Platform {
    TIKTOK("TikTok", "tiktok"),
    INSTAGRAM("Instagram Reels", "instagram"),
    YOUTUBE("YouTube", "youtube");

    private final String displayName;
    private final String pathSegment;

    Platform(String displayName, String pathSegment) {
        this.displayName = displayName;
        this.pathSegment = pathSegment;
    }

    /**
     * Resolve a platform from user input such as "youtube" or "TIKTOK".
     */
    public static Optional<Platform> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Platform.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
