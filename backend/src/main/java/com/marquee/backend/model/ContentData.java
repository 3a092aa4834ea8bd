package com.marquee.backend.model;

import java.util.List;

/**
 * Pre-fetched enrichment for the frame: current weather and the colour bar.
 */
public record ContentData(Weather weather, List<Integer> colorBar) {

    public ContentData {
        colorBar = colorBar == null ? List.of() : List.copyOf(colorBar);
    }

    public record Weather(int temperature, String unit, Integer colorCode) {}
}
