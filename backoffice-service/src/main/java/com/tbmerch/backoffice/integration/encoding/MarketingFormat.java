package com.tbmerch.backoffice.integration.encoding;

import java.util.Arrays;
import java.util.Optional;

public enum MarketingFormat {
    INSTAGRAM_STORY("instagram_story", 1080, 1920, 15),
    FACEBOOK_AD("facebook_ad", 1200, 628, 30),
    YOUTUBE_SHORT("youtube_short", 1080, 1920, 60);

    private final String value;
    private final int width;
    private final int height;
    private final int durationSeconds;

    MarketingFormat(String value, int width, int height, int durationSeconds) {
        this.value = value;
        this.width = width;
        this.height = height;
        this.durationSeconds = durationSeconds;
    }

    public String value() {
        return value;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int durationSeconds() {
        return durationSeconds;
    }

    public static Optional<MarketingFormat> fromValue(String value) {
        return Arrays.stream(values()).filter(f -> f.value.equalsIgnoreCase(value)).findFirst();
    }
}
