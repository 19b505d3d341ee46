package com.clan.clears.dto;

/**
 * 网关接口的读取模式。
 */
public enum ReadMode {
    /** 只返回已存储数据，不触发刷新。 */
    CACHED,
    /** 返回已存储数据并在后台刷新。 */
    FRESH,
    /** 刷新并等待，有等待上限。 */
    SYNC;

    public static ReadMode parse(String value) {
        if (value == null || value.isBlank()) {
            return CACHED;
        }
        try {
            return ReadMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown mode: " + value, e);
        }
    }
}
