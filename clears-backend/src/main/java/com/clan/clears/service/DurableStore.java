package com.clan.clears.service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * actor 与网关共用的键值 JSON 文档存储。过期条目读取时视为不存在。
 */
public interface DurableStore {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value);

    void put(String key, Object value, Duration ttl);

    /**
     * 全部写入或全部不写入。
     */
    void putAll(Map<String, ?> values);

    /**
     * 键以 {@code prefix} 开头的全部未过期条目，按键排序。
     */
    <T> List<T> list(String prefix, Class<T> type);
}
