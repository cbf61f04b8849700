package com.pmatrix.common.invariant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.OptionalInt;

/**
 * Outcome of the stream-level timestamp ordering check over an ordered batch.
 *
 * @param recordCount     number of records scanned
 * @param violationIndex  index of the first record whose timestamp is below its predecessor's, or null
 * @param detail          human-readable description
 */
public record StreamValidationResult(
    @JsonProperty("record_count")     int     recordCount,
    @JsonProperty("violation_index")  Integer violationIndex,
    @JsonProperty("detail")           String  detail
) {
    @JsonProperty("passed")
    public boolean passed() {
        return violationIndex == null;
    }

    @JsonIgnore
    public OptionalInt firstViolation() {
        return violationIndex == null ? OptionalInt.empty() : OptionalInt.of(violationIndex);
    }

    public String toLine() {
        return String.format("[%s] %s - %s", passed() ? "PASS" : "FAIL",
                             InvariantId.T1.code(), detail);
    }
}
