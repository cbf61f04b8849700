package com.pmatrix.common.invariant;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The twelve conformance invariants, declared in reporting order.
 *
 * <p>{@link #code()} is the stable external identifier ({@code INV-R1} ...)
 * used in reports and by callers that look results up by name.
 */
public enum InvariantId {

    /** All four function values in [0, 1], none NaN. */
    R1("INV-R1", InvariantCategory.RANGE),
    /** stability_score in [0, 1], not NaN. */
    R2("INV-R2", InvariantCategory.RANGE),
    /** risk_score in [0, 1], not NaN. */
    R3("INV-R3", InvariantCategory.RANGE),
    /** timestamp strictly positive. */
    R4("INV-R4", InvariantCategory.RANGE),

    /** mode is the partition image of risk_score. */
    C1("INV-C1", InvariantCategory.CONSISTENCY),
    /** risk_level is the table image of mode. */
    C2("INV-C2", InvariantCategory.CONSISTENCY),
    /** Exactly C1 and C2: risk_level transitively determined by risk_score. */
    C3("INV-C3", InvariantCategory.CONSISTENCY),

    /** No empty string fields, no absent enum fields. */
    S1("INV-S1", InvariantCategory.STRUCTURAL),
    /** No fields beyond the canonical eight (enforced by the decoder). */
    S2("INV-S2", InvariantCategory.STRUCTURAL),
    /** spec_version equals the current constant exactly. */
    S3("INV-S3", InvariantCategory.STRUCTURAL),
    /** schema_version is MAJOR.MINOR.PATCH. */
    S4("INV-S4", InvariantCategory.STRUCTURAL),

    /** Non-decreasing timestamps across a stream; not checkable on one record. */
    T1("INV-T1", InvariantCategory.TEMPORAL);

    private final String code;
    private final InvariantCategory category;

    InvariantId(String code, InvariantCategory category) {
        this.code = code;
        this.category = category;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public InvariantCategory category() {
        return category;
    }
}
