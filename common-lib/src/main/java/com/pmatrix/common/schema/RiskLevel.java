package com.pmatrix.common.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Risk classification labels L1 (lowest) to L5 (highest).
 * In fixed one-to-one correspondence with {@link OperatingMode}.
 */
public enum RiskLevel {

    L1("L1"),
    L2("L2"),
    L3("L3"),
    L4("L4"),
    L5("L5");

    private final String wireName;

    RiskLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<RiskLevel> fromWireName(String name) {
        return Arrays.stream(values())
            .filter(l -> l.wireName.equals(name))
            .findFirst();
    }

    @JsonCreator
    public static RiskLevel decode(String name) {
        return fromWireName(name)
            .orElseThrow(() -> new IllegalArgumentException("unknown risk_level '" + name + "'"));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
