package com.pmatrix.encoder.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pmatrix.common.exception.PmatrixException;

public record ErrorResponseDTO(
    @JsonProperty("code")       String                      code,
    @JsonProperty("component")  PmatrixException.Component  component,
    @JsonProperty("message")    String                      message,
    @JsonProperty("trace_id")   String                      traceId
) {
    public static ErrorResponseDTO of(String code, PmatrixException ex, String traceId) {
        return new ErrorResponseDTO(code, ex.getComponent(), ex.getMessage(), traceId);
    }
}
