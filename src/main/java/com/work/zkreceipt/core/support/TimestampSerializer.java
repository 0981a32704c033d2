package com.work.zkreceipt.core.support;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.time.Instant;

/**
 * 对外 JSON 中的时间字段统一按 {@link Timestamps#format(Instant)} 输出，不依赖 ObjectMapper 的 java.time 配置。
 */
public class TimestampSerializer extends StdSerializer<Instant> {

    public TimestampSerializer() {
        super(Instant.class);
    }

    @Override
    public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(Timestamps.format(value));
    }
}
