package com.pmatrix.common.partition;

import com.pmatrix.common.schema.OperatingMode;
import com.pmatrix.common.schema.RiskLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Five-band partition of risk_score into an {@link OperatingMode}, and the
 * fixed mode → {@link RiskLevel} table.
 *
 * <h3>Band convention</h3>
 * <pre>
 * [0.0, 0.2) → Optimal   (L1)
 * [0.2, 0.4) → Normal    (L2)
 * [0.4, 0.6) → Caution   (L3)
 * [0.6, 0.8) → Alert     (L4)
 * [0.8, 1.0] → Halt      (L5)
 * </pre>
 * Bands are lower-inclusive and upper-exclusive, except Halt which is closed
 * at 1.0. Values below 0.0, above 1.0, or NaN have no mode.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class PartitionMapper {

    public static final double NORMAL_LOWER_BOUND  = 0.2;
    public static final double CAUTION_LOWER_BOUND = 0.4;
    public static final double ALERT_LOWER_BOUND   = 0.6;
    public static final double HALT_LOWER_BOUND    = 0.8;

    private static final Map<OperatingMode, RiskLevel> MODE_TO_LEVEL;
    private static final Map<RiskLevel, OperatingMode> LEVEL_TO_MODE;

    static {
        Map<OperatingMode, RiskLevel> forward = new EnumMap<>(OperatingMode.class);
        forward.put(OperatingMode.OPTIMAL, RiskLevel.L1);
        forward.put(OperatingMode.NORMAL,  RiskLevel.L2);
        forward.put(OperatingMode.CAUTION, RiskLevel.L3);
        forward.put(OperatingMode.ALERT,   RiskLevel.L4);
        forward.put(OperatingMode.HALT,    RiskLevel.L5);

        Map<RiskLevel, OperatingMode> inverse = new EnumMap<>(RiskLevel.class);
        forward.forEach((mode, level) -> inverse.put(level, mode));

        MODE_TO_LEVEL = Collections.unmodifiableMap(forward);
        LEVEL_TO_MODE = Collections.unmodifiableMap(inverse);
    }

    private PartitionMapper() {}

    /**
     * Maps a risk_score to its operating mode.
     *
     * @param riskScore score to classify
     * @return the mode, or empty if {@code riskScore} is NaN or outside [0.0, 1.0]
     */
    public static Optional<OperatingMode> mapRiskToMode(double riskScore) {
        if (Double.isNaN(riskScore) || riskScore < 0.0 || riskScore > 1.0) {
            return Optional.empty();
        }
        if (riskScore < NORMAL_LOWER_BOUND)  return Optional.of(OperatingMode.OPTIMAL);
        if (riskScore < CAUTION_LOWER_BOUND) return Optional.of(OperatingMode.NORMAL);
        if (riskScore < ALERT_LOWER_BOUND)   return Optional.of(OperatingMode.CAUTION);
        if (riskScore < HALT_LOWER_BOUND)    return Optional.of(OperatingMode.ALERT);
        // upper bound already screened above
        return Optional.of(OperatingMode.HALT);
    }

    /** Total over the five modes. */
    public static RiskLevel mapModeToLevel(OperatingMode mode) {
        return MODE_TO_LEVEL.get(mode);
    }

    /**
     * String form of {@link #mapModeToLevel(OperatingMode)}: empty for anything
     * other than the five canonical mode names (matching is case-sensitive).
     */
    public static Optional<RiskLevel> mapModeToLevel(String modeName) {
        return OperatingMode.fromWireName(modeName).map(MODE_TO_LEVEL::get);
    }

    public static OperatingMode mapLevelToMode(RiskLevel level) {
        return LEVEL_TO_MODE.get(level);
    }
}
