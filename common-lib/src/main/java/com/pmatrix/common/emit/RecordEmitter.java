package com.pmatrix.common.emit;

import com.pmatrix.common.exception.InvalidInputException;
import com.pmatrix.common.partition.PartitionMapper;
import com.pmatrix.common.schema.Functions;
import com.pmatrix.common.schema.OperatingMode;
import com.pmatrix.common.schema.RiskLevel;
import com.pmatrix.common.schema.RuntimeStateRecord;
import com.pmatrix.common.schema.SchemaConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Builds a demonstration {@link RuntimeStateRecord} from four raw function values.
 *
 * <p>Inputs are screened before anything is built: each must be finite and in
 * [0.0, 1.0], otherwise {@link InvalidInputException} names the field and value.
 * Scores come from {@link DemoScoreAggregator}; mode and risk_level come from
 * {@link PartitionMapper}, so an emitted record satisfies every single-record
 * invariant by construction.
 *
 * <p>The clock is read only when no explicit timestamp is given.
 */
public class RecordEmitter {

    private static final Logger log = LoggerFactory.getLogger(RecordEmitter.class);

    private final Clock clock;

    public RecordEmitter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RecordEmitter() {
        this(Clock.systemUTC());
    }

    public RuntimeStateRecord emit(EmitRequest request) {
        return emit(request.baseline(), request.norm(), request.stability(),
                    request.metaControl(), request.timestamp());
    }

    /**
     * @param timestamp Unix seconds, or null to use the current time
     * @throws InvalidInputException if any function value is NaN, infinite or out of
     *         range, or an explicit timestamp is not positive
     * @throws IllegalStateException if the aggregated risk_score cannot be partitioned
     */
    public RuntimeStateRecord emit(double baseline, double norm, double stability,
                                   double metaControl, Long timestamp) {
        requireUnitInterval(SchemaConstants.FIELD_BASELINE, baseline);
        requireUnitInterval(SchemaConstants.FIELD_NORM, norm);
        requireUnitInterval(SchemaConstants.FIELD_STABILITY, stability);
        requireUnitInterval(SchemaConstants.FIELD_META_CONTROL, metaControl);
        if (timestamp != null && timestamp <= 0) {
            throw new InvalidInputException(SchemaConstants.FIELD_TIMESTAMP, timestamp, "must be > 0");
        }

        Functions functions = new Functions(baseline, norm, stability, metaControl);
        double stabilityScore = DemoScoreAggregator.stabilityScore(functions);
        double riskScore = DemoScoreAggregator.riskScore(stabilityScore);

        OperatingMode mode = PartitionMapper.mapRiskToMode(riskScore)
            .orElseThrow(() -> new IllegalStateException(
                "risk_score " + riskScore + " out of range after aggregation"));
        RiskLevel riskLevel = PartitionMapper.mapModeToLevel(mode);
        if (riskLevel == null) {
            throw new IllegalStateException("unknown mode " + mode);
        }

        long ts = timestamp != null ? timestamp : clock.instant().getEpochSecond();

        RuntimeStateRecord record = new RuntimeStateRecord(
            SchemaConstants.SPEC_VERSION,
            SchemaConstants.SCHEMA_VERSION,
            ts,
            functions,
            stabilityScore,
            riskScore,
            mode,
            riskLevel
        );
        log.debug("Record emitted. timestamp={} risk_score={} mode={} risk_level={}",
                  ts, riskScore, mode, riskLevel);
        return record;
    }

    private static void requireUnitInterval(String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidInputException(field, value, "is NaN or infinite");
        }
        if (value < 0.0 || value > 1.0) {
            throw new InvalidInputException(field, value, "is outside [0.0, 1.0]");
        }
    }
}
