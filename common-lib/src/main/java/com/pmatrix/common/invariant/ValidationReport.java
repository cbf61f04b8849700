package com.pmatrix.common.invariant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The full, ordered set of invariant results for one record.
 * A record is conforming iff every result passed.
 */
public record ValidationReport(
    @JsonProperty("results")     List<InvariantResult> results,
    @JsonProperty("conforming")  boolean conforming
) {
    public static final String VERDICT_CONFORMING =
        "Result: ALL INVARIANTS SATISFIED - record is conforming.";
    public static final String VERDICT_MALFORMED =
        "Result: INVARIANT VIOLATION(S) DETECTED - record is malformed.";

    public ValidationReport {
        results = List.copyOf(results);
    }

    public static ValidationReport of(List<InvariantResult> results) {
        return new ValidationReport(results, results.stream().allMatch(InvariantResult::passed));
    }

    @JsonIgnore
    public List<InvariantResult> failures() {
        return results.stream().filter(r -> !r.passed()).collect(Collectors.toList());
    }

    /** One line per invariant, a blank line, then the verdict. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (InvariantResult r : results) {
            sb.append(r.toLine()).append('\n');
        }
        sb.append('\n').append(conforming ? VERDICT_CONFORMING : VERDICT_MALFORMED);
        return sb.toString();
    }
}
