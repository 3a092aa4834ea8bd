package com.marquee.backend.model;

/**
 * Per-generator hints for the frame decorator.
 */
public record FormatOptions(TextAlign textAlign, boolean verticalCenter) {

    public static final FormatOptions DEFAULT = new FormatOptions(TextAlign.CENTER, true);

    public enum TextAlign {
        LEFT,
        CENTER
    }
}
