package com.tbmerch.backoffice.integration.encoding;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output settings for the supported media jobs. Each preset is laid over {@link #defaults()};
 * a {@code null} value removes the default.
 */
public final class EncodingPresets {

    private EncodingPresets() {
    }

    /** Web-optimised mp4: h264/aac, 1920×1080 at 30 fps, quality 4, public. */
    public static Map<String, Object> defaults() {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("label", "web_optimized");
        output.put("format", "mp4");
        output.put("video_codec", "h264");
        output.put("audio_codec", "aac");
        output.put("quality", 4);
        output.put("width", 1920);
        output.put("height", 1080);
        output.put("frame_rate", 30);
        output.put("audio_bitrate", 128);
        output.put("public", true);
        return output;
    }

    /** 15 s cinematic cut at 24 fps, quality 5. Silent unless an audio track is given. */
    public static Map<String, Object> heroVideo(String audioUrl, String watermarkUrl) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("label", "hero_video");
        output.put("audio_codec", audioUrl == null ? null : "aac");
        output.put("quality", 5);
        output.put("frame_rate", 24);
        output.put("duration", 15);
        if (watermarkUrl != null && !watermarkUrl.isBlank()) {
            output.put("watermark", Map.of("url", watermarkUrl, "x", "-10", "y", "-10", "width", "100", "height", "40"));
        }
        if (audioUrl != null) {
            output.put("audio_mix", audioUrl);
        }
        return output;
    }

    /** 800×800 jpg, cropped to fill. */
    public static Map<String, Object> productImage() {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("label", "product_image_optimized");
        output.put("format", "jpg");
        output.put("width", 800);
        output.put("height", 800);
        output.put("aspect_mode", "crop");
        return output;
    }

    /** Square 1080 video with the product name as a bottom caption. */
    public static Map<String, Object> productVideo(ProductVideoTemplate template, String sku, String productName) {
        Map<String, Object> overlay = new LinkedHashMap<>();
        overlay.put("text", productName == null ? "" : productName);
        overlay.put("font_size", 48);
        overlay.put("font_color", "ffffff");
        overlay.put("x", "center");
        overlay.put("y", "bottom");
        overlay.put("background", "00000080");

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("label", "product_video_" + (sku == null ? "unknown" : sku));
        output.put("width", 1080);
        output.put("height", 1080);
        output.put("duration", template.durationSeconds());
        output.put("text_overlay", overlay);
        return output;
    }

    public static Map<String, Object> marketing(MarketingFormat format) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("label", "marketing_" + format.value());
        output.put("width", format.width());
        output.put("height", format.height());
        output.put("duration", format.durationSeconds());
        return output;
    }

    /** {@link #defaults()} overlaid with {@code preset}. */
    public static Map<String, Object> merge(Map<String, Object> preset) {
        Map<String, Object> output = defaults();
        preset.forEach((key, value) -> {
            if (value == null) {
                output.remove(key);
            } else {
                output.put(key, value);
            }
        });
        return output;
    }
}
