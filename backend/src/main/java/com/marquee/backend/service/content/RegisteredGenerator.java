package com.marquee.backend.service.content;

import com.marquee.backend.model.ContentRegistration;

/**
 * @param requiresAi whether the factory needs a provider binding to produce a working generator
 */
public record RegisteredGenerator(ContentRegistration registration, GeneratorFactory factory, boolean requiresAi) {

    public String id() {
        return registration.id();
    }

    public String name() {
        return registration.name();
    }
}
