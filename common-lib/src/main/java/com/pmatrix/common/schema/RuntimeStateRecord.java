package com.pmatrix.common.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One immutable snapshot of an autonomous agent's runtime posture.
 *
 * <p>Exactly eight wire fields. A record obtained from the decoder is only
 * trusted after {@code InvariantValidator} reports it as conforming; the
 * type itself only guarantees shape (closed enums, non-negative timestamp).
 */
@JsonIgnoreProperties(ignoreUnknown = false)
@JsonPropertyOrder({
    "spec_version", "schema_version", "timestamp", "functions",
    "stability_score", "risk_score", "mode", "risk_level"
})
public record RuntimeStateRecord(
    @JsonProperty(value = "spec_version", required = true)     String        specVersion,
    @JsonProperty(value = "schema_version", required = true)   String        schemaVersion,
    @JsonProperty(value = "timestamp", required = true)        long          timestamp,
    @JsonProperty(value = "functions", required = true)        Functions     functions,
    @JsonProperty(value = "stability_score", required = true)  double        stabilityScore,
    @JsonProperty(value = "risk_score", required = true)       double        riskScore,
    @JsonProperty(value = "mode", required = true)             OperatingMode mode,
    @JsonProperty(value = "risk_level", required = true)       RiskLevel     riskLevel
) {
    public RuntimeStateRecord {
        Objects.requireNonNull(functions, "functions");
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be unsigned, got " + timestamp);
        }
    }

    /** Copy of this record carrying {@code newTimestamp}. */
    public RuntimeStateRecord withTimestamp(long newTimestamp) {
        return new RuntimeStateRecord(specVersion, schemaVersion, newTimestamp, functions,
                                      stabilityScore, riskScore, mode, riskLevel);
    }
}
