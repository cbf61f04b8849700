package com.pmatrix.common.invariant;

public enum InvariantCategory {
    RANGE,
    CONSISTENCY,
    STRUCTURAL,
    TEMPORAL
}
