package com.marquee.backend.service.frame;

import java.util.List;

/**
 * A decorated 6x22 board plus anything that degraded along the way.
 */
public record FrameResult(int[][] layout, List<String> warnings) {

    public FrameResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
