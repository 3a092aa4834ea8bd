package com.marquee.backend.model;

public enum ContentPriority {
    NOTIFICATION(0),
    NORMAL(2),
    FALLBACK(3);

    private final int level;

    ContentPriority(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }
}
