package com.registrygateway.gateway.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Arrays;

/**
 * Builds deterministic cache keys of the form {@code operation:[arg1,arg2,...]}.
 *
 * <p>The argument list is serialized as one JSON array with properties sorted
 * alphabetically and map entries sorted by key. Strings stay quoted and escaped, so a
 * separator inside an argument or a literal {@code "null"} cannot shift the key onto
 * another request's. Two equal queries always produce the same key and two different
 * queries never do.
 */
public class CacheKeyGenerator {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .addModule(new JavaTimeModule())
        .build();

    public String generate(String operation, Object... args) {
        try {
            return operation + ":" + canonicalMapper.writeValueAsString(Arrays.asList(args));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot build cache key for operation " + operation, e);
        }
    }
}
