package com.pmatrix.encoder.service;

import com.pmatrix.common.codec.RecordCodec;
import com.pmatrix.common.emit.EmitRequest;
import com.pmatrix.common.emit.RecordEmitter;
import com.pmatrix.common.invariant.InvariantResult;
import com.pmatrix.common.invariant.InvariantValidator;
import com.pmatrix.common.invariant.StreamValidationResult;
import com.pmatrix.common.invariant.ValidationReport;
import com.pmatrix.common.schema.RuntimeStateRecord;
import com.pmatrix.common.trace.TraceContextUtil;
import com.pmatrix.encoder.dto.StreamReportDTO;
import com.pmatrix.encoder.exception.BatchLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Emit and validate operations behind the HTTP API. Decoding goes through
 * {@link RecordCodec} so decode failures surface before any invariant runs.
 */
@Service
public class RecordService {

    private static final Logger log = LoggerFactory.getLogger(RecordService.class);

    private final RecordEmitter emitter;
    private final RecordCodec codec;

    @Value("${encoder.stream.max-records:10000}")
    private int maxStreamRecords;

    public RecordService(RecordEmitter emitter, RecordCodec codec) {
        this.emitter = emitter;
        this.codec = codec;
    }

    public RuntimeStateRecord emit(EmitRequest request, String traceId) {
        RuntimeStateRecord record = emitter.emit(request);
        TraceContextUtil.withMdc(traceId, () ->
            log.info("Record emitted. timestamp={} mode={} risk_level={} traceId={}",
                     record.timestamp(), record.mode(), record.riskLevel(), traceId));
        return record;
    }

    public ValidationReport validate(String body, String traceId) {
        RuntimeStateRecord record = codec.decode(body);
        ValidationReport report = InvariantValidator.validate(record);
        logReport(report, traceId);
        return report;
    }

    public StreamReportDTO validateStream(String body, String traceId) {
        List<RuntimeStateRecord> records = codec.decodeStream(body);
        if (records.size() > maxStreamRecords) {
            throw new BatchLimitExceededException(records.size(), maxStreamRecords);
        }

        // Per-record checks are independent; T1 needs the batch in emission order.
        List<ValidationReport> reports = records.parallelStream()
            .map(InvariantValidator::validate)
            .collect(Collectors.toList());
        StreamValidationResult stream = InvariantValidator.validateStream(records);

        StreamReportDTO result = StreamReportDTO.of(reports, stream);
        TraceContextUtil.withMdc(traceId, () -> {
            log.info("Stream validated. records={} conforming={} t1={} traceId={}",
                     records.size(), result.conforming(), stream.passed(), traceId);
            stream.firstViolation().ifPresent(i ->
                log.warn("Stream out of order. index={} timestamp={} previous={} traceId={}",
                         i, records.get(i).timestamp(), records.get(i - 1).timestamp(), traceId));
        });
        return result;
    }

    private void logReport(ValidationReport report, String traceId) {
        TraceContextUtil.withMdc(traceId, () -> {
            if (report.conforming()) {
                log.info("Record conforming. traceId={}", traceId);
            } else {
                String failed = report.failures().stream()
                    .map(r -> r.id().code())
                    .collect(Collectors.joining(","));
                log.warn("Record malformed. failed={} traceId={}", failed, traceId);
                report.failures().stream()
                    .map(InvariantResult::toLine)
                    .forEach(line -> log.debug("  {}", line));
            }
        });
    }
}
