package com.marquee.backend.service.frame;

import com.marquee.backend.model.ContentData;
import com.marquee.backend.model.FormatOptions;

import java.time.Instant;

public interface FrameDecorator {

    /**
     * Lays text out in the content area and adds the info bar and colour bar. Never throws.
     *
     * @param contentData   weather and colours, may be null
     * @param formatOptions alignment hints, may be null
     */
    FrameResult decorate(String text, Instant timestamp, ContentData contentData, FormatOptions formatOptions);
}
