package com.pmatrix.common.exception;

/**
 * Input bytes could not be decoded into a record: malformed JSON, wrong
 * field types, missing fields or fields outside the canonical eight.
 * Validation is never attempted on such input.
 */
public class RecordDecodeException extends PmatrixException {

    public RecordDecodeException(String message, Throwable cause) {
        super(Component.CODEC, message, cause);
    }

    public RecordDecodeException(String message) {
        super(Component.CODEC, message);
    }
}
