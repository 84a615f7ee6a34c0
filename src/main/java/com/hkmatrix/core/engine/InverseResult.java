package com.hkmatrix.core.engine;

import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.steps.StepLog;

public final class InverseResult {
    private final StepLog steps;
    private final RationalMatrix inverse;
    private final boolean square;

    InverseResult(StepLog steps, RationalMatrix inverse, boolean square) {
        this.steps = steps.freeze();
        this.inverse = inverse;
        this.square = square;
    }

    public StepLog steps() { return steps; }

    /** A^-1, or null when A is singular or not square. */
    public RationalMatrix inverse() { return inverse; }

    public boolean isInvertible() { return inverse != null; }
    public boolean isSquare() { return square; }
}
