package com.example.subburn_backend.dto.render;

/**
 * Look of burned-in subtitles, translated to an ASS {@code force_style} by
 * {@link com.example.subburn_backend.ffmpeg.AssStyleUtil}.
 *
 * @param borderStyle ASS border style: 1 = outline with shadow, 3 = opaque box
 * @param alignment   left, center or right, always on the bottom row
 */
public record SubtitleStyle(
        String fontFamily,
        int fontSize,
        String primaryColor,
        String outlineColor,
        int borderStyle,
        int outline,
        int shadow,
        boolean bold,
        int marginV,
        String alignment
) {
    public static SubtitleStyle defaults() {
        return new SubtitleStyle("Arial", 10, "#FFFFFF", "#000000", 1, 1, 0, false, 10, "center");
    }
}
