package com.pmatrix.common.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * The five discrete operating modes, ordered from lowest to highest risk.
 *
 * <p>On the wire a mode is a plain string ({@code "Optimal"}, {@code "Normal"}, ...).
 * Inside the process only these five constants exist; an unknown string is
 * rejected when it is decoded.
 *
 * <ul>
 *   <li>{@link #OPTIMAL}: risk_score in [0.0, 0.2)</li>
 *   <li>{@link #NORMAL} : risk_score in [0.2, 0.4)</li>
 *   <li>{@link #CAUTION}: risk_score in [0.4, 0.6)</li>
 *   <li>{@link #ALERT}  : risk_score in [0.6, 0.8)</li>
 *   <li>{@link #HALT}   : risk_score in [0.8, 1.0]</li>
 * </ul>
 */
public enum OperatingMode {

    OPTIMAL("Optimal"),
    NORMAL("Normal"),
    CAUTION("Caution"),
    ALERT("Alert"),
    HALT("Halt");

    private final String wireName;

    OperatingMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Case-sensitive lookup by wire name. */
    public static Optional<OperatingMode> fromWireName(String name) {
        return Arrays.stream(values())
            .filter(m -> m.wireName.equals(name))
            .findFirst();
    }

    @JsonCreator
    public static OperatingMode decode(String name) {
        return fromWireName(name)
            .orElseThrow(() -> new IllegalArgumentException("unknown mode '" + name + "'"));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
