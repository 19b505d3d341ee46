package com.clan.clears.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * 按顺序尝试别名读取结构不固定的上游 JSON。路径以点分隔，
 * 第一个解析到非 null 节点的别名生效。
 */
public final class JsonPaths {

    private JsonPaths() {
    }

    public static Optional<JsonNode> first(JsonNode root, String... aliases) {
        if (root == null) {
            return Optional.empty();
        }
        for (String alias : aliases) {
            JsonNode node = at(root, alias);
            if (node != null && !node.isNull() && !node.isMissingNode()) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public static Optional<Long> firstLong(JsonNode root, String... aliases) {
        return first(root, aliases).flatMap(JsonPaths::asLong);
    }

    public static Optional<String> firstText(JsonNode root, String... aliases) {
        return first(root, aliases).map(JsonNode::asText).filter(text -> !text.isEmpty());
    }

    /**
     * 统计 API 的布尔语义：{@code 1}、{@code 1.0}、{@code true} 和 {@code "true"} 均为真。
     */
    public static Optional<Boolean> firstFlag(JsonNode root, String... aliases) {
        return first(root, aliases).map(JsonPaths::isTruthy);
    }

    public static Optional<Instant> firstInstant(JsonNode root, String... aliases) {
        return firstText(root, aliases).flatMap(JsonPaths::parseInstant);
    }

    static boolean isTruthy(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.doubleValue() == 1.0;
        }
        String text = node.asText().trim();
        return "true".equalsIgnoreCase(text) || "1".equals(text);
    }

    private static Optional<Long> asLong(JsonNode node) {
        if (node.isNumber()) {
            return Optional.of(node.longValue());
        }
        try {
            return Optional.of(Long.parseLong(node.asText().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseInstant(String text) {
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static JsonNode at(JsonNode root, String path) {
        JsonNode current = root;
        for (String part : path.split("\\.")) {
            if (current == null) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }
}
