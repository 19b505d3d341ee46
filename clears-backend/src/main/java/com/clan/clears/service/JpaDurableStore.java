package com.clan.clears.service;

import com.clan.clears.entity.DurableEntry;
import com.clan.clears.exception.DurableStoreException;
import com.clan.clears.repository.DurableEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 {@code durable_entry} 表的 {@link DurableStore}，值使用 Jackson 序列化。
 */
@Service
public class JpaDurableStore implements DurableStore {

    private static final Logger log = LoggerFactory.getLogger(JpaDurableStore.class);

    private final DurableEntryRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JpaDurableStore(DurableEntryRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            return repository.findById(key)
                    .filter(this::isLive)
                    .map(entry -> read(entry, type));
        } catch (DataAccessException e) {
            throw new DurableStoreException("Read failed for " + key, e);
        }
    }

    @Override
    @Transactional
    public void put(String key, Object value) {
        save(key, value, null);
    }

    @Override
    @Transactional
    public void put(String key, Object value, Duration ttl) {
        save(key, value, clock.instant().plus(ttl));
    }

    @Override
    @Transactional
    public void putAll(Map<String, ?> values) {
        Instant now = clock.instant();
        List<DurableEntry> entries = new ArrayList<>(values.size());
        values.forEach((key, value) -> entries.add(new DurableEntry(key, write(key, value), null, now)));
        try {
            repository.saveAll(entries);
        } catch (DataAccessException e) {
            throw new DurableStoreException("Atomic write failed for " + values.keySet(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public <T> List<T> list(String prefix, Class<T> type) {
        try {
            return repository.findByKeyStartingWithOrderByKeyAsc(prefix).stream()
                    .filter(this::isLive)
                    .map(entry -> read(entry, type))
                    .toList();
        } catch (DataAccessException e) {
            throw new DurableStoreException("List failed for prefix " + prefix, e);
        }
    }

    @Scheduled(fixedDelayString = "${clears.store.purge-interval:PT10M}")
    @Transactional
    public void purgeExpired() {
        int removed = repository.deleteExpired(clock.instant());
        if (removed > 0) {
            log.info("已清理 {} 条过期存储记录", removed);
        }
    }

    private void save(String key, Object value, Instant expiresAt) {
        try {
            repository.save(new DurableEntry(key, write(key, value), expiresAt, clock.instant()));
        } catch (DataAccessException e) {
            throw new DurableStoreException("Write failed for " + key, e);
        }
    }

    private boolean isLive(DurableEntry entry) {
        return entry.getExpiresAt() == null || entry.getExpiresAt().isAfter(clock.instant());
    }

    private String write(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DurableStoreException("Cannot serialize value for " + key, e);
        }
    }

    private <T> T read(DurableEntry entry, Class<T> type) {
        try {
            return objectMapper.readValue(entry.getValue(), type);
        } catch (JsonProcessingException e) {
            throw new DurableStoreException("Corrupt value under " + entry.getKey(), e);
        }
    }
}
