package com.pmatrix.common.invariant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of evaluating one invariant against one record.
 * {@code detail} describes the actual value(s) and, where relevant, the expected ones.
 */
public record InvariantResult(
    @JsonProperty("id")      InvariantId id,
    @JsonProperty("passed")  boolean     passed,
    @JsonProperty("detail")  String      detail
) {
    static InvariantResult pass(InvariantId id, String detail) {
        return new InvariantResult(id, true, detail);
    }

    static InvariantResult of(InvariantId id, boolean passed, String detail) {
        return new InvariantResult(id, passed, detail);
    }

    /** {@code [PASS] INV-R1 - detail} */
    public String toLine() {
        return String.format("[%s] %s - %s", passed ? "PASS" : "FAIL", id.code(), detail);
    }
}
