package com.ledgerlift.migrator.core.engine.misc;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

/**
 * Shared Jackson mapper for configuration documents and audit records.
 */
public final class LedgerLiftObjectMapper {

    private LedgerLiftObjectMapper() {}

    private static final class SingletonHolder {
        private static final ObjectMapper INSTANCE = JsonMapper.builder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public static ObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }
}
