package com.pmatrix.common.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pmatrix.common.emit.RecordEmitter;
import com.pmatrix.common.exception.PmatrixException;
import com.pmatrix.common.exception.RecordDecodeException;
import com.pmatrix.common.invariant.InvariantValidator;
import com.pmatrix.common.schema.OperatingMode;
import com.pmatrix.common.schema.RiskLevel;
import com.pmatrix.common.schema.RuntimeStateRecord;
import com.pmatrix.common.schema.SchemaConstants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordCodecTest {

    private static final String VALID = """
        {
          "spec_version": "pmatrix-3.5",
          "schema_version": "1.0.0",
          "timestamp": 1707500000,
          "functions": {"baseline": 0.25, "norm": 0.70, "stability": 0.30, "meta_control": 0.20},
          "stability_score": 0.3625,
          "risk_score": 0.6375,
          "mode": "Alert",
          "risk_level": "L4"
        }
        """;

    private final RecordCodec codec = new RecordCodec();
    private final RecordEmitter emitter = new RecordEmitter();

    private static String replace(String json, String from, String to) {
        assertTrue(json.contains(from), "fixture does not contain " + from);
        return json.replace(from, to);
    }

    // ── Decode ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("decode() — accepted input")
    class AcceptTests {

        @Test
        @DisplayName("canonical record decodes into closed enum values")
        void canonical() {
            RuntimeStateRecord r = codec.decode(VALID);
            assertEquals(SchemaConstants.SPEC_VERSION, r.specVersion());
            assertEquals(1_707_500_000L, r.timestamp());
            assertEquals(0.70, r.functions().norm());
            assertEquals(0.20, r.functions().metaControl());
            assertEquals(OperatingMode.ALERT, r.mode());
            assertEquals(RiskLevel.L4, r.riskLevel());
            assertTrue(InvariantValidator.isValid(r));
        }

        @Test
        @DisplayName("integral JSON numbers are accepted for real-valued fields")
        void integralScores() {
            RuntimeStateRecord r = codec.decode(replace(VALID, "\"risk_score\": 0.6375", "\"risk_score\": 1"));
            assertEquals(1.0, r.riskScore());
        }

        @Test
        @DisplayName("timestamp 0 decodes; rejecting it is INV-R4's job")
        void zeroTimestamp() {
            RuntimeStateRecord r = codec.decode(replace(VALID, "1707500000", "0"));
            assertEquals(0L, r.timestamp());
            assertFalse(InvariantValidator.isValid(r));
        }

        @Test
        @DisplayName("field order on input does not matter")
        void fieldOrder() {
            String reordered = "{\"risk_level\":\"L4\",\"mode\":\"Alert\",\"risk_score\":0.6375,"
                + "\"stability_score\":0.3625,\"functions\":{\"meta_control\":0.2,\"stability\":0.3,"
                + "\"norm\":0.7,\"baseline\":0.25},\"timestamp\":1707500000,"
                + "\"schema_version\":\"1.0.0\",\"spec_version\":\"pmatrix-3.5\"}";
            assertEquals(codec.decode(VALID), codec.decode(reordered));
        }
    }

    @Nested
    @DisplayName("decode() — rejected input")
    class RejectTests {

        private void assertRejected(String json) {
            assertThrows(RecordDecodeException.class, () -> codec.decode(json), json);
        }

        @Test
        @DisplayName("ninth top-level field")
        void extraTopLevel() {
            RecordDecodeException e = assertThrows(RecordDecodeException.class,
                () -> codec.decode(replace(VALID, "\"mode\": \"Alert\",", "\"mode\": \"Alert\", \"extra\": 1,")));
            assertTrue(e.getMessage().contains("extra"), e.getMessage());
            assertEquals(PmatrixException.Component.CODEC, e.getComponent());
            assertTrue(e.getMessage().startsWith("[codec] "), e.getMessage());
        }

        @Test
        @DisplayName("timestamp beyond the signed 64-bit range")
        void timestampBeyondLong() {
            assertRejected(replace(VALID, "1707500000", "9223372036854775808"));
            assertRejected(replace(VALID, "1707500000", "18446744073709551615"));
        }

        @Test
        @DisplayName("fifth functions field")
        void extraFunctionField() {
            assertRejected(replace(VALID, "\"meta_control\": 0.20", "\"meta_control\": 0.20, \"bonus\": 0.1"));
        }

        @Test
        @DisplayName("missing field")
        void missingField() {
            assertRejected(replace(VALID, "\"risk_level\": \"L4\"", "").replace("\"mode\": \"Alert\",", "\"mode\": \"Alert\""));
            assertRejected(replace(VALID, "\"norm\": 0.70, ", ""));
        }

        @Test
        @DisplayName("null field")
        void nullField() {
            assertRejected(replace(VALID, "\"pmatrix-3.5\"", "null"));
            assertRejected(replace(VALID, "0.3625", "null"));
            assertRejected(replace(VALID, "\"Alert\"", "null"));
        }

        @Test
        @DisplayName("wrong field types")
        void wrongTypes() {
            assertRejected(replace(VALID, "1707500000", "\"1707500000\""));
            assertRejected(replace(VALID, "1707500000", "1707500000.5"));
            assertRejected(replace(VALID, "0.6375", "\"0.6375\""));
            assertRejected(replace(VALID, "\"pmatrix-3.5\"", "35"));
            assertRejected(replace(VALID, "\"1.0.0\"", "true"));
            assertRejected(replace(VALID, "{\"baseline\"", "[{\"baseline\"").replace("0.20}", "0.20}]"));
        }

        @Test
        @DisplayName("mode or risk_level outside the closed sets")
        void unknownEnums() {
            assertRejected(replace(VALID, "\"Alert\"", "\"Panic\""));
            assertRejected(replace(VALID, "\"Alert\"", "\"alert\""));
            assertRejected(replace(VALID, "\"Alert\"", "\"\""));
            assertRejected(replace(VALID, "\"L4\"", "\"L9\""));
        }

        @Test
        @DisplayName("negative timestamp")
        void negativeTimestamp() {
            assertRejected(replace(VALID, "1707500000", "-5"));
        }

        @Test
        @DisplayName("malformed JSON, trailing content, empty input, null literal")
        void malformed() {
            assertRejected("{\"spec_version\": ");
            assertRejected(VALID + " {}");
            assertRejected("");
            assertRejected("   ");
            assertRejected("null");
            assertRejected("[]");
            assertThrows(RecordDecodeException.class, () -> codec.decode((String) null));
        }
    }

    // ── Encode ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("encode()")
    class EncodeTests {

        @Test
        @DisplayName("emits exactly the eight canonical keys in wire order")
        void canonicalKeys() throws Exception {
            RuntimeStateRecord r = emitter.emit(0.25, 0.70, 0.30, 0.20, 1_707_500_000L);
            JsonNode node = new ObjectMapper().readTree(codec.encodePretty(r));

            List<String> keys = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(keys::add);
            assertEquals(SchemaConstants.RECORD_FIELDS, keys);

            List<String> fnKeys = new ArrayList<>();
            node.get("functions").fieldNames().forEachRemaining(fnKeys::add);
            assertEquals(SchemaConstants.FUNCTION_FIELDS, fnKeys);

            assertEquals("Alert", node.get("mode").asText());
            assertEquals("L4", node.get("risk_level").asText());
            assertTrue(node.get("timestamp").isIntegralNumber());
        }

        @Test
        @DisplayName("encode → decode reproduces emitted records field-for-field")
        void roundTrip() {
            double[][] inputs = {
                {0.25, 0.70, 0.30, 0.20}, {0, 0, 0, 0}, {1, 1, 1, 1}, {0.1, 0.2, 0.3, 0.4}, {0.333, 0.667, 0.5, 0.05}
            };
            for (double[] in : inputs) {
                RuntimeStateRecord r = emitter.emit(in[0], in[1], in[2], in[3], 1_707_500_000L);
                assertEquals(r, codec.decode(codec.encode(r)));
                assertEquals(r, codec.decode(codec.encodePretty(r)));
            }
        }
    }

    // ── Streams ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("decodeStream()")
    class StreamTests {

        @Test
        @DisplayName("JSON array decodes in order")
        void ordered() {
            RuntimeStateRecord a = emitter.emit(0.5, 0.5, 0.5, 0.5, 1000L);
            RuntimeStateRecord b = emitter.emit(0.9, 0.9, 0.9, 0.9, 1001L);
            List<RuntimeStateRecord> records =
                codec.decodeStream("[" + codec.encode(a) + "," + codec.encode(b) + "]");
            assertEquals(List.of(a, b), records);
        }

        @Test
        @DisplayName("one bad element fails the whole batch")
        void badElement() {
            RuntimeStateRecord a = emitter.emit(0.5, 0.5, 0.5, 0.5, 1000L);
            String extra = replace(VALID, "\"mode\": \"Alert\",", "\"mode\": \"Alert\", \"x\": 1,");
            assertThrows(RecordDecodeException.class,
                () -> codec.decodeStream("[" + codec.encode(a) + "," + extra + "]"));
            assertThrows(RecordDecodeException.class,
                () -> codec.decodeStream("[" + codec.encode(a) + ", null]"));
        }

        @Test
        @DisplayName("non-array input rejected")
        void notArray() {
            assertThrows(RecordDecodeException.class, () -> codec.decodeStream(VALID));
            assertThrows(RecordDecodeException.class, () -> codec.decodeStream(""));
        }

        @Test
        @DisplayName("empty array is an empty stream")
        void emptyArray() {
            assertTrue(codec.decodeStream("[]").isEmpty());
        }
    }
}
