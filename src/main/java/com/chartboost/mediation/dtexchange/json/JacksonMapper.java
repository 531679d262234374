package com.chartboost.mediation.dtexchange.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

public class JacksonMapper {

    private static final String FAILED_TO_DECODE = "Failed to decode: %s";

    private final ObjectMapper mapper;

    public JacksonMapper(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <T> T decodeValue(InputStream inputStream, Class<T> clazz) throws DecodeException {
        try {
            return mapper.readValue(inputStream, clazz);
        } catch (IOException e) {
            throw new DecodeException(String.format(FAILED_TO_DECODE, e.getMessage()), e);
        }
    }

    /**
     * Binds an already parsed JSON tree (e.g. credentials handed over by the mediation layer) to the given type.
     */
    public <T> T convertValue(JsonNode node, Class<T> clazz) throws DecodeException {
        try {
            return mapper.convertValue(node, clazz);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(String.format(FAILED_TO_DECODE, e.getMessage()), e);
        }
    }
}
