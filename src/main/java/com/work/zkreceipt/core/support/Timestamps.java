package com.work.zkreceipt.core.support;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * 时间戳口径：UTC、毫秒精度、固定带三位小数（例如 2026-01-02T03:04:05.060Z）。
 * 参与哈希/陈述文本的时间一律经过此处格式化，保证同一时刻得到同一字符串。
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    public static String format(Instant instant) {
        return instant == null ? null : FORMAT.format(instant);
    }
}
