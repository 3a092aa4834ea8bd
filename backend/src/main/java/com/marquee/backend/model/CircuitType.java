package com.marquee.backend.model;

public enum CircuitType {
    MANUAL,
    PROVIDER
}
