package com.pmatrix.encoder.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pmatrix.common.invariant.StreamValidationResult;
import com.pmatrix.common.invariant.ValidationReport;

import java.util.List;

/**
 * Per-record reports for an ordered batch plus the stream-level timestamp check.
 * The batch conforms only if every record conforms and the stream check passes.
 */
public record StreamReportDTO(
    @JsonProperty("records")     List<ValidationReport>  records,
    @JsonProperty("stream")      StreamValidationResult  stream,
    @JsonProperty("conforming")  boolean                 conforming
) {
    public static StreamReportDTO of(List<ValidationReport> records, StreamValidationResult stream) {
        boolean allConform = records.stream().allMatch(ValidationReport::conforming);
        return new StreamReportDTO(List.copyOf(records), stream, allConform && stream.passed());
    }
}
