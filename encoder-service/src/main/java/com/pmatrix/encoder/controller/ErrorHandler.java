package com.pmatrix.encoder.controller;

import com.pmatrix.common.exception.InvalidInputException;
import com.pmatrix.common.exception.RecordDecodeException;
import com.pmatrix.common.trace.TraceContextUtil;
import com.pmatrix.encoder.dto.ErrorResponseDTO;
import com.pmatrix.encoder.exception.BatchLimitExceededException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

/**
 * Maps input rejection, decode rejection and oversized batches onto distinct
 * HTTP statuses. Invariant
 * violations are not errors here: they come back as a 200 report with
 * {@code conforming=false}.
 */
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(InvalidInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponseDTO handleInvalidInput(InvalidInputException ex, ServerWebExchange exchange) {
        return ErrorResponseDTO.of("INVALID_INPUT", ex, traceId(exchange));
    }

    @ExceptionHandler(RecordDecodeException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponseDTO handleDecode(RecordDecodeException ex, ServerWebExchange exchange) {
        return ErrorResponseDTO.of("DECODE_FAILURE", ex, traceId(exchange));
    }

    @ExceptionHandler(BatchLimitExceededException.class)
    @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
    public ErrorResponseDTO handleBatchLimit(BatchLimitExceededException ex, ServerWebExchange exchange) {
        return ErrorResponseDTO.of("BATCH_TOO_LARGE", ex, traceId(exchange));
    }

    private static String traceId(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(TraceContextUtil.TRACE_ID_HEADER);
        return header != null ? header : "unknown";
    }
}
