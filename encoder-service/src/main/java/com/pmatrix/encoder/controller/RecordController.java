package com.pmatrix.encoder.controller;

import com.pmatrix.common.emit.EmitRequest;
import com.pmatrix.common.invariant.ValidationReport;
import com.pmatrix.common.schema.RuntimeStateRecord;
import com.pmatrix.common.trace.TraceContextUtil;
import com.pmatrix.encoder.dto.StreamReportDTO;
import com.pmatrix.encoder.service.RecordService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/records")
public class RecordController {

    private static final Logger log = LoggerFactory.getLogger(RecordController.class);

    private final RecordService recordService;

    public RecordController(RecordService recordService) {
        this.recordService = recordService;
    }

    @PostMapping("/emit")
    public Mono<ResponseEntity<RuntimeStateRecord>> emit(
            @RequestBody EmitRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return traced(Mono.fromCallable(() -> recordService.emit(request, traceId)), traceId, "emit");
    }

    @PostMapping("/validate")
    public Mono<ResponseEntity<ValidationReport>> validate(
            @RequestBody String body,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return traced(Mono.fromCallable(() -> recordService.validate(body, traceId)), traceId, "validate");
    }

    @PostMapping("/validate-stream")
    public Mono<ResponseEntity<StreamReportDTO>> validateStream(
            @RequestBody String body,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        return traced(Mono.fromCallable(() -> recordService.validateStream(body, traceId)),
                      traceId, "validate-stream");
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private <T> Mono<ResponseEntity<T>> traced(Mono<T> work, String traceId, String operation) {
        Mono<ResponseEntity<T>> pipeline = work
            .map(body -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(body))
            .doOnEach(signal -> {
                if (signal.isOnError()) {
                    String id = TraceContextUtil.getTraceId(signal.getContextView());
                    TraceContextUtil.withMdc(id, () ->
                        log.warn("{} rejected. traceId={} reason={}",
                                 operation, id, signal.getThrowable().getMessage()));
                }
            });
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }
}
