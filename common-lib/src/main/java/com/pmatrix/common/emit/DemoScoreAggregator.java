package com.pmatrix.common.emit;

import com.pmatrix.common.schema.Functions;

/**
 * Placeholder arithmetic used to populate the two score fields of
 * demonstration records.
 *
 * <p><strong>Not evaluation logic.</strong> Real producers derive
 * stability_score and risk_score by their own means; the validator never
 * checks the scores against this formula.
 */
public final class DemoScoreAggregator {

    private DemoScoreAggregator() {}

    /** Arithmetic mean of the four function values. */
    public static double stabilityScore(Functions f) {
        return (f.baseline() + f.norm() + f.stability() + f.metaControl()) / 4.0;
    }

    /** Complement of the stability score. */
    public static double riskScore(double stabilityScore) {
        return 1.0 - stabilityScore;
    }
}
