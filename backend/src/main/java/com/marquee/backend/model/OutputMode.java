package com.marquee.backend.model;

public enum OutputMode {
    TEXT,
    LAYOUT
}
