package com.dlxretry.core.serializer;

import com.dlxretry.core.spi.PayloadSerializer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;

/**
 * JSON 消息体
 * byte[] 与 String 类型的负载原样透传, 不经过 Jackson
 */
public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    /** 使用推荐的默认配置构造 */
    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T deserialize(byte[] body, TypeReference<T> typeRef) {
        if (body == null) {
            return null;
        }
        Type type = typeRef.getType();
        if (type == byte[].class) {
            return (T) body.clone();
        }
        if (type == String.class) {
            return (T) new String(body, StandardCharsets.UTF_8);
        }
        if (body.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(body, typeRef);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize payload from JSON", e);
        }
    }

    @Override
    public byte[] serialize(Object payload) {
        if (payload == null) {
            return new byte[0];
        }
        if (payload instanceof byte[]) {
            return ((byte[]) payload).clone();
        }
        if (payload instanceof String) {
            return ((String) payload).getBytes(StandardCharsets.UTF_8);
        }
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize payload to JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        m.enable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 反序列化忽略未知字段，增强前后兼容
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT);
        // 自动发现（JSR310 等）
        m.findAndRegisterModules();
        return m;
    }
}
