package com.pmatrix.common.exception;

/**
 * Raised by the emitter when a raw function value is NaN, infinite or
 * outside [0.0, 1.0], or an explicit timestamp is not positive. No record is
 * built when this is thrown.
 */
public class InvalidInputException extends PmatrixException {

    private final String field;
    private final String value;

    public InvalidInputException(String field, Object value, String reason) {
        super(Component.EMITTER, field + " = " + value + " " + reason);
        this.field = field;
        this.value = String.valueOf(value);
    }

    public String getField() {
        return field;
    }

    public String getValue() {
        return value;
    }
}
