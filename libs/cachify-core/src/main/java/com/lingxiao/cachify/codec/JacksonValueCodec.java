package com.lingxiao.cachify.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.lang.reflect.Type;

public class JacksonValueCodec implements ValueCodec {

    private final ObjectMapper om;

    public JacksonValueCodec() {
        this(new ObjectMapper());
    }

    public JacksonValueCodec(ObjectMapper base) {
        this.om = base.copy()
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String encode(Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (Exception e) {
            throw new ValueCodecException("Failed to encode cached value of " + value.getClass().getName(), e);
        }
    }

    @Override
    public Object decode(String stored, Type type) {
        JavaType javaType = om.getTypeFactory().constructType(type);
        try {
            return om.readValue(stored, javaType);
        } catch (Exception e) {
            throw new ValueCodecException("Failed to decode cached value as " + javaType, e);
        }
    }
}
