package com.clan.clears.service;

import com.clan.clears.exception.DurableStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 测试用的基于 Map 的 {@link DurableStore}。值以 JSON 保存，与真实存储一样调用方不会共享实例。
 */
public class InMemoryDurableStore implements DurableStore {

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private final ObjectMapper objectMapper = objectMapper();
    private final Map<String, String> values = new TreeMap<>();
    private final Map<String, Instant> expiries = new TreeMap<>();
    private final Clock clock;
    private String failingPrefix;

    public InMemoryDurableStore(Clock clock) {
        this.clock = clock;
    }

    /** 之后对该前缀下键的写入都会抛出异常。 */
    public synchronized void failWritesTo(String prefix) {
        this.failingPrefix = prefix;
    }

    public synchronized boolean contains(String key) {
        return values.containsKey(key) && isLive(key);
    }

    @Override
    public synchronized <T> Optional<T> get(String key, Class<T> type) {
        if (!contains(key)) {
            return Optional.empty();
        }
        return Optional.of(read(values.get(key), type));
    }

    @Override
    public synchronized void put(String key, Object value) {
        checkWritable(key);
        values.put(key, write(value));
        expiries.remove(key);
    }

    @Override
    public synchronized void put(String key, Object value, Duration ttl) {
        checkWritable(key);
        values.put(key, write(value));
        expiries.put(key, clock.instant().plus(ttl));
    }

    @Override
    public synchronized void putAll(Map<String, ?> entries) {
        entries.keySet().forEach(this::checkWritable);
        entries.forEach(this::put);
    }

    @Override
    public synchronized <T> List<T> list(String prefix, Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey().startsWith(prefix) && isLive(entry.getKey())) {
                out.add(read(entry.getValue(), type));
            }
        }
        return out;
    }

    private boolean isLive(String key) {
        Instant expiry = expiries.get(key);
        return expiry == null || expiry.isAfter(clock.instant());
    }

    private void checkWritable(String key) {
        if (failingPrefix != null && key.startsWith(failingPrefix)) {
            throw new DurableStoreException("Simulated write failure for " + key, null);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DurableStoreException("Cannot serialize", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DurableStoreException("Cannot deserialize", e);
        }
    }
}
