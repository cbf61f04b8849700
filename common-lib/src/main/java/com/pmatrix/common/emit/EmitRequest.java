package com.pmatrix.common.emit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw inputs for one demonstration record.
 *
 * @param timestamp optional Unix seconds; null means "now"
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public record EmitRequest(
    @JsonProperty(value = "baseline", required = true)      double baseline,
    @JsonProperty(value = "norm", required = true)          double norm,
    @JsonProperty(value = "stability", required = true)     double stability,
    @JsonProperty(value = "meta_control", required = true)  double metaControl,
    @JsonProperty("timestamp")                              Long   timestamp
) {
    public static EmitRequest of(double baseline, double norm, double stability, double metaControl) {
        return new EmitRequest(baseline, norm, stability, metaControl, null);
    }
}
