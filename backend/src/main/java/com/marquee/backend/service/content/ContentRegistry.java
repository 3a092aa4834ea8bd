package com.marquee.backend.service.content;

import com.marquee.backend.model.ContentPriority;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Generators by id, in registration order.
 */
@Slf4j
public class ContentRegistry {

    private final Map<String, RegisteredGenerator> generators = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(RegisteredGenerator generator) {
        lock.writeLock().lock();
        try {
            if (generators.containsKey(generator.id())) {
                throw new IllegalArgumentException("Generator already registered: " + generator.id());
            }
            generators.put(generator.id(), generator);
            log.info("Generator registered id={} priority={}", generator.id(), generator.registration().priority());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<RegisteredGenerator> getById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(generators.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RegisteredGenerator> getByPriority(ContentPriority priority) {
        lock.readLock().lock();
        try {
            return generators.values().stream()
                    .filter(generator -> generator.registration().priority() == priority)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RegisteredGenerator> getAll() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(generators.values());
        } finally {
            lock.readLock().unlock();
        }
    }
}
