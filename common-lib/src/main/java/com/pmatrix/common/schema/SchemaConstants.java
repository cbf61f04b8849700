package com.pmatrix.common.schema;

import java.util.List;

/**
 * Version constants and the canonical field layout of a runtime state record.
 * Shared by the decode boundary and the structural invariants.
 */
public final class SchemaConstants {

    /** The only spec version a conforming record may carry. Exact match, no compatibility range. */
    public static final String SPEC_VERSION = "pmatrix-3.5";

    /** Schema version stamped on emitted records. */
    public static final String SCHEMA_VERSION = "1.0.0";

    public static final String FIELD_SPEC_VERSION    = "spec_version";
    public static final String FIELD_SCHEMA_VERSION  = "schema_version";
    public static final String FIELD_TIMESTAMP       = "timestamp";
    public static final String FIELD_FUNCTIONS       = "functions";
    public static final String FIELD_STABILITY_SCORE = "stability_score";
    public static final String FIELD_RISK_SCORE      = "risk_score";
    public static final String FIELD_MODE            = "mode";
    public static final String FIELD_RISK_LEVEL      = "risk_level";

    public static final String FIELD_BASELINE     = "baseline";
    public static final String FIELD_NORM         = "norm";
    public static final String FIELD_STABILITY    = "stability";
    public static final String FIELD_META_CONTROL = "meta_control";

    /** The eight top-level fields, in wire order. */
    public static final List<String> RECORD_FIELDS = List.of(
        FIELD_SPEC_VERSION, FIELD_SCHEMA_VERSION, FIELD_TIMESTAMP, FIELD_FUNCTIONS,
        FIELD_STABILITY_SCORE, FIELD_RISK_SCORE, FIELD_MODE, FIELD_RISK_LEVEL
    );

    /** The four fields of the nested {@code functions} object, in wire order. */
    public static final List<String> FUNCTION_FIELDS = List.of(
        FIELD_BASELINE, FIELD_NORM, FIELD_STABILITY, FIELD_META_CONTROL
    );

    private SchemaConstants() {}
}
