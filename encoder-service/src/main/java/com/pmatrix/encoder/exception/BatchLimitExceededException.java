package com.pmatrix.encoder.exception;

import com.pmatrix.common.exception.PmatrixException;

public class BatchLimitExceededException extends PmatrixException {

    public BatchLimitExceededException(int size, int limit) {
        super(Component.SERVICE, "stream of " + size + " records exceeds limit of " + limit);
    }
}
