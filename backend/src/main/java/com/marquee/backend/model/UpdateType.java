package com.marquee.backend.model;

public enum UpdateType {
    MAJOR,
    MINOR
}
