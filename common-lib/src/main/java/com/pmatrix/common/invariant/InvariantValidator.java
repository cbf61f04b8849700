package com.pmatrix.common.invariant;

import com.pmatrix.common.partition.PartitionMapper;
import com.pmatrix.common.schema.Functions;
import com.pmatrix.common.schema.OperatingMode;
import com.pmatrix.common.schema.RiskLevel;
import com.pmatrix.common.schema.RuntimeStateRecord;
import com.pmatrix.common.schema.SchemaConstants;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates the twelve conformance invariants against a decoded record.
 *
 * <p>Every check runs on every call and contributes exactly one
 * {@link InvariantResult}; there is no short-circuiting, so a caller always
 * sees every simultaneous violation. The validator never mutates the record.
 *
 * <h3>Checks</h3>
 * <ul>
 *   <li><strong>Range</strong>: R1 function values, R2 stability_score,
 *       R3 risk_score, R4 timestamp.</li>
 *   <li><strong>Consistency</strong>: C1 mode vs. partition of risk_score,
 *       C2 risk_level vs. mode table, C3 = C1 ∧ C2.</li>
 *   <li><strong>Structural</strong>: S1 non-empty fields, S2 no extra fields,
 *       S3 exact spec_version, S4 semver schema_version.</li>
 *   <li><strong>Temporal</strong>: T1 is a stream property; the single-record
 *       path reports an informational pass and {@link #validateStreamT1(List)}
 *       performs the real check.</li>
 * </ul>
 *
 * <p>Stability and risk scores are only range-checked. No relation between
 * the function values and the two scores is enforced.
 *
 * <p>Single-record validation is a pure function of its argument and may be
 * run concurrently over many records. No Spring dependencies. No I/O.
 */
public final class InvariantValidator {

    private static final Pattern SEMVER = Pattern.compile("(\\d+)\\.(\\d+)\\.(\\d+)");

    private InvariantValidator() { /* utility class */ }

    /** All twelve results, in {@link InvariantId} declaration order. */
    public static List<InvariantResult> validateAll(RuntimeStateRecord record) {
        return List.of(
            checkR1(record),
            checkR2(record),
            checkR3(record),
            checkR4(record),
            checkC1(record),
            checkC2(record),
            checkC3(record),
            checkS1(record),
            checkS2(record),
            checkS3(record),
            checkS4(record),
            checkT1Note()
        );
    }

    public static ValidationReport validate(RuntimeStateRecord record) {
        return ValidationReport.of(validateAll(record));
    }

    public static boolean isValid(RuntimeStateRecord record) {
        return validateAll(record).stream().allMatch(InvariantResult::passed);
    }

    // ── Range ──────────────────────────────────────────────────────

    static InvariantResult checkR1(RuntimeStateRecord r) {
        Functions f = r.functions();
        boolean ok = inUnitInterval(f.baseline())
            && inUnitInterval(f.norm())
            && inUnitInterval(f.stability())
            && inUnitInterval(f.metaControl());
        String detail = ok
            ? "All function values in [0.0, 1.0]."
            : "Function value(s) out of range: baseline=" + f.baseline()
                + ", norm=" + f.norm()
                + ", stability=" + f.stability()
                + ", meta_control=" + f.metaControl();
        return InvariantResult.of(InvariantId.R1, ok, detail);
    }

    static InvariantResult checkR2(RuntimeStateRecord r) {
        return InvariantResult.of(InvariantId.R2, inUnitInterval(r.stabilityScore()),
            "stability_score=" + r.stabilityScore() + ", expected within [0.0, 1.0]");
    }

    static InvariantResult checkR3(RuntimeStateRecord r) {
        return InvariantResult.of(InvariantId.R3, inUnitInterval(r.riskScore()),
            "risk_score=" + r.riskScore() + ", expected within [0.0, 1.0]");
    }

    static InvariantResult checkR4(RuntimeStateRecord r) {
        return InvariantResult.of(InvariantId.R4, r.timestamp() > 0,
            "timestamp=" + r.timestamp() + ", expected > 0");
    }

    // ── Consistency ────────────────────────────────────────────────

    static InvariantResult checkC1(RuntimeStateRecord r) {
        Optional<OperatingMode> expected = PartitionMapper.mapRiskToMode(r.riskScore());
        boolean ok = expected.isPresent() && expected.get() == r.mode();
        return InvariantResult.of(InvariantId.C1, ok,
            "risk_score=" + r.riskScore()
                + " -> expected mode=" + expected.map(OperatingMode::wireName).orElse("<unmappable>")
                + ", actual mode=" + r.mode());
    }

    static InvariantResult checkC2(RuntimeStateRecord r) {
        RiskLevel expected = r.mode() == null ? null : PartitionMapper.mapModeToLevel(r.mode());
        boolean ok = expected != null && expected == r.riskLevel();
        return InvariantResult.of(InvariantId.C2, ok,
            "mode=" + r.mode()
                + " -> expected risk_level=" + (expected == null ? "<unmappable>" : expected.wireName())
                + ", actual risk_level=" + r.riskLevel());
    }

    static InvariantResult checkC3(RuntimeStateRecord r) {
        boolean ok = checkC1(r).passed() && checkC2(r).passed();
        return InvariantResult.of(InvariantId.C3, ok, ok
            ? "mode and risk_level are mutually consistent with risk_score."
            : "Mutual consistency violation: risk_level is not determined by risk_score.");
    }

    // ── Structural ─────────────────────────────────────────────────

    static InvariantResult checkS1(RuntimeStateRecord r) {
        boolean ok = !isEmpty(r.specVersion())
            && !isEmpty(r.schemaVersion())
            && r.mode() != null
            && r.riskLevel() != null;
        String detail = ok
            ? "All eight required fields present and non-empty."
            : "Empty or absent field(s): spec_version='" + r.specVersion()
                + "', schema_version='" + r.schemaVersion()
                + "', mode=" + r.mode()
                + ", risk_level=" + r.riskLevel();
        return InvariantResult.of(InvariantId.S1, ok, detail);
    }

    static InvariantResult checkS2(RuntimeStateRecord r) {
        // A record value has exactly the canonical fields; extras are refused by RecordCodec.
        return InvariantResult.pass(InvariantId.S2,
            "No fields beyond the canonical " + SchemaConstants.RECORD_FIELDS.size()
                + " (enforced by strict decoding).");
    }

    static InvariantResult checkS3(RuntimeStateRecord r) {
        boolean ok = SchemaConstants.SPEC_VERSION.equals(r.specVersion());
        return InvariantResult.of(InvariantId.S3, ok,
            "spec_version=" + r.specVersion() + ", expected=" + SchemaConstants.SPEC_VERSION);
    }

    static InvariantResult checkS4(RuntimeStateRecord r) {
        return InvariantResult.of(InvariantId.S4, isSemver(r.schemaVersion()),
            "schema_version=" + r.schemaVersion() + ", expected MAJOR.MINOR.PATCH");
    }

    // ── Temporal ───────────────────────────────────────────────────

    static InvariantResult checkT1Note() {
        return InvariantResult.pass(InvariantId.T1,
            "Stream-level invariant. Not checkable on a single record. "
                + "Use validateStreamT1() for sequential validation.");
    }

    /**
     * Scans an ordered batch of records from one emitter for a timestamp
     * decrease. Equal consecutive timestamps are allowed.
     *
     * @param records records in emission order
     * @return index of the first record whose timestamp is strictly less than
     *         its predecessor's, or empty if the batch is non-decreasing
     */
    public static OptionalInt validateStreamT1(List<RuntimeStateRecord> records) {
        for (int i = 1; i < records.size(); i++) {
            if (records.get(i).timestamp() < records.get(i - 1).timestamp()) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /** {@link #validateStreamT1(List)} with a descriptive detail. */
    public static StreamValidationResult validateStream(List<RuntimeStateRecord> records) {
        OptionalInt violation = validateStreamT1(records);
        if (violation.isEmpty()) {
            return new StreamValidationResult(records.size(), null,
                records.size() + " record(s) with non-decreasing timestamps.");
        }
        int i = violation.getAsInt();
        return new StreamValidationResult(records.size(), i,
            "timestamp decreased at index " + i + ": "
                + records.get(i - 1).timestamp() + " -> " + records.get(i).timestamp());
    }

    // ── Helpers ────────────────────────────────────────────────────

    static boolean inUnitInterval(double v) {
        return !Double.isNaN(v) && v >= 0.0 && v <= 1.0;
    }

    private static final long SEMVER_COMPONENT_MAX = 0xFFFFFFFFL;

    /** Exactly three dot-separated runs of ASCII digits, each an unsigned 32-bit value. */
    static boolean isSemver(String version) {
        if (version == null) return false;
        Matcher m = SEMVER.matcher(version);
        if (!m.matches()) return false;
        for (int g = 1; g <= 3; g++) {
            try {
                if (Long.parseLong(m.group(g)) > SEMVER_COMPONENT_MAX) {
                    return false;
                }
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return true;
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
