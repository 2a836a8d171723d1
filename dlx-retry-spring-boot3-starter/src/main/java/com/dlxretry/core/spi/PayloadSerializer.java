package com.dlxretry.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * 序列化
 */
public interface PayloadSerializer {

    /** 反序列化消息体为指定泛型类型 */
    <T> T deserialize(byte[] body, TypeReference<T> typeRef);

    /** 将对象序列化为消息体 */
    byte[] serialize(Object obj);
}
