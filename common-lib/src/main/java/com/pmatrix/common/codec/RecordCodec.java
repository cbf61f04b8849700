package com.pmatrix.common.codec;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.pmatrix.common.exception.PmatrixException;
import com.pmatrix.common.exception.RecordDecodeException;
import com.pmatrix.common.schema.Functions;
import com.pmatrix.common.schema.OperatingMode;
import com.pmatrix.common.schema.RiskLevel;
import com.pmatrix.common.schema.RuntimeStateRecord;

import java.util.List;

/**
 * JSON boundary for {@link RuntimeStateRecord}.
 *
 * <p>Decoding is strict and not configurable:
 * <ul>
 *   <li>any key outside the canonical eight (or the four {@code functions} keys) fails</li>
 *   <li>missing fields ({@code required} on every record component) and {@code null} fields fail</li>
 *   <li>strings are not accepted for numbers, numbers are not accepted for strings,
 *       fractional values are not accepted for {@code timestamp}</li>
 *   <li>{@code mode} / {@code risk_level} outside their closed sets fail</li>
 *   <li>negative timestamps and trailing content fail</li>
 * </ul>
 * Every failure is reported as {@link RecordDecodeException}; no partially
 * decoded record ever escapes.
 *
 * <p>Instances are immutable after construction and thread-safe.
 */
public final class RecordCodec {

    private static final TypeReference<List<RuntimeStateRecord>> RECORD_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public RecordCodec() {
        this.mapper = strictMapper();
    }

    /** The configured mapper; callers must not reconfigure it. */
    public static ObjectMapper strictMapper() {
        ObjectMapper mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .build();
        // Reference-typed record fields may not be null; optional request fields stay nullable.
        for (Class<?> type : List.of(String.class, Functions.class, OperatingMode.class, RiskLevel.class)) {
            mapper.configOverride(type).setSetterInfo(JsonSetter.Value.forValueNulls(Nulls.FAIL));
        }
        mapper.coercionConfigFor(LogicalType.Textual)
            .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
            .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }

    public String encode(RuntimeStateRecord record) {
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new PmatrixException(PmatrixException.Component.CODEC, "Failed to encode runtime state record", e);
        }
    }

    public String encodePretty(RuntimeStateRecord record) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new PmatrixException(PmatrixException.Component.CODEC, "Failed to encode runtime state record", e);
        }
    }

    public RuntimeStateRecord decode(String json) {
        if (json == null || json.isBlank()) {
            throw new RecordDecodeException("empty input");
        }
        try {
            RuntimeStateRecord record = mapper.readValue(json, RuntimeStateRecord.class);
            if (record == null) {
                throw new RecordDecodeException("expected a JSON object, got null");
            }
            return requireComplete(record);
        } catch (JsonProcessingException e) {
            throw new RecordDecodeException(e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes a JSON array of records, preserving order. The whole batch fails
     * if any element fails.
     */
    public List<RuntimeStateRecord> decodeStream(String jsonArray) {
        if (jsonArray == null || jsonArray.isBlank()) {
            throw new RecordDecodeException("empty input");
        }
        try {
            List<RuntimeStateRecord> records = mapper.readValue(jsonArray, RECORD_LIST);
            if (records == null || records.contains(null)) {
                throw new RecordDecodeException("expected a JSON array of record objects");
            }
            records.forEach(RecordCodec::requireComplete);
            return List.copyOf(records);
        } catch (JsonProcessingException e) {
            throw new RecordDecodeException(e.getOriginalMessage(), e);
        }
    }

    private static RuntimeStateRecord requireComplete(RuntimeStateRecord record) {
        if (record.specVersion() == null || record.schemaVersion() == null
                || record.mode() == null || record.riskLevel() == null) {
            throw new RecordDecodeException("null value for a required field");
        }
        return record;
    }
}
