package com.pmatrix.common.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The four evaluation function values characterising an agent's posture.
 * Each is expected in [0.0, 1.0]; no relationship among them is required.
 */
@JsonIgnoreProperties(ignoreUnknown = false)
@JsonPropertyOrder({"baseline", "norm", "stability", "meta_control"})
public record Functions(
    @JsonProperty(value = "baseline", required = true)      double baseline,
    @JsonProperty(value = "norm", required = true)          double norm,
    @JsonProperty(value = "stability", required = true)     double stability,
    @JsonProperty(value = "meta_control", required = true)  double metaControl
) {}
