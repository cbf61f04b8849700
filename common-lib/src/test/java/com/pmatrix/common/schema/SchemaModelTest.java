package com.pmatrix.common.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SchemaModelTest {

    @Test
    @DisplayName("modes are declared in ascending risk order with canonical wire names")
    void canonicalOrder() {
        List<String> names = Stream.of(OperatingMode.values())
            .map(OperatingMode::wireName)
            .collect(Collectors.toList());
        assertEquals(List.of("Optimal", "Normal", "Caution", "Alert", "Halt"), names);
    }

    @Test
    @DisplayName("risk levels are L1..L5 in order")
    void levelOrder() {
        List<String> names = Stream.of(RiskLevel.values())
            .map(RiskLevel::wireName)
            .collect(Collectors.toList());
        assertEquals(List.of("L1", "L2", "L3", "L4", "L5"), names);
    }

    @Test
    @DisplayName("wire-name lookup is exact and case-sensitive")
    void lookup() {
        assertEquals(Optional.of(OperatingMode.CAUTION), OperatingMode.fromWireName("Caution"));
        assertTrue(OperatingMode.fromWireName("caution").isEmpty());
        assertTrue(OperatingMode.fromWireName(" Caution").isEmpty());
        assertEquals(Optional.of(RiskLevel.L3), RiskLevel.fromWireName("L3"));
        assertTrue(RiskLevel.fromWireName("L6").isEmpty());
        assertTrue(RiskLevel.fromWireName("l3").isEmpty());
    }

    @Test
    @DisplayName("decoding an unknown name throws")
    void decodeUnknown() {
        assertThrows(IllegalArgumentException.class, () -> OperatingMode.decode("Panic"));
        assertThrows(IllegalArgumentException.class, () -> RiskLevel.decode(""));
    }

    @Test
    @DisplayName("canonical field tables are fixed and unmodifiable")
    void fieldTables() {
        assertEquals(8, SchemaConstants.RECORD_FIELDS.size());
        assertEquals(4, SchemaConstants.FUNCTION_FIELDS.size());
        assertThrows(UnsupportedOperationException.class,
            () -> SchemaConstants.RECORD_FIELDS.add("extra"));
    }

    @Test
    @DisplayName("negative timestamp cannot be represented")
    void negativeTimestamp() {
        Functions f = new Functions(0.5, 0.5, 0.5, 0.5);
        assertThrows(IllegalArgumentException.class, () -> new RuntimeStateRecord(
            SchemaConstants.SPEC_VERSION, SchemaConstants.SCHEMA_VERSION, -1L, f,
            0.5, 0.5, OperatingMode.CAUTION, RiskLevel.L3));
    }
}
