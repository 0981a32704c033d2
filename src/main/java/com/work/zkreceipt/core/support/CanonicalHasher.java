package com.work.zkreceipt.core.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * 规范化 JSON 哈希：紧凑输出 + 所有对象 key 按字典序排列，再取 sha256。
 * <p>
 * 结果格式：{@code 0x} + 64 位小写 hex。任何参与 receipt 完整性链的哈希都必须走这里，
 * 不允许依赖字段声明顺序或 Map 的插入顺序。
 */
public final class CanonicalHasher {

    /** 全零哈希，用于“尚无证明”的占位。 */
    public static final String ZERO_HASH = "0x" + "0".repeat(64);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false);

    private static final HexFormat HEX = HexFormat.of();

    private CanonicalHasher() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 对字符串做 sha256。
     */
    public static String hashString(String input) {
        ValidationUtils.requireNonNull(input, "input");
        return "0x" + HEX.formatHex(sha256(input.getBytes(UTF_8)));
    }

    /**
     * 对结构化值（Map / List / 标量 / JsonNode）做规范化 JSON 哈希。
     */
    public static String hash(Object value) {
        return hashString(canonicalJson(value));
    }

    /**
     * 便捷方法：按 key/value 交替传参构造一个对象再哈希，例如
     * {@code hashOf("status", "PROVED", "claim_hash", h)}。
     */
    public static String hashOf(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues 必须成对出现");
        }
        Map<String, Object> obj = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            obj.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return hash(obj);
    }

    /**
     * 规范化 JSON 文本（仅用于哈希与排障，不作为对外序列化格式）。
     */
    public static String canonicalJson(Object value) {
        // JsonNode 不受 ORDER_MAP_ENTRIES_BY_KEYS 影响，先转成普通 Map/List 树
        Object plain = value instanceof JsonNode ? MAPPER.convertValue(value, Object.class) : value;
        try {
            return MAPPER.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("canonical json serialization failed", e);
        }
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
