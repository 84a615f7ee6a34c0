package com.hkmatrix.core.engine;

import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepLog;

public final class DeterminantResult {
    private final StepLog steps;
    private final Rational value;
    private final int swaps;

    DeterminantResult(StepLog steps, Rational value, int swaps) {
        this.steps = steps.freeze();
        this.value = value;
        this.swaps = swaps;
    }

    public StepLog steps() { return steps; }

    /** Exact determinant, or null when the matrix was not square. */
    public Rational value() { return value; }

    public boolean isDefined() { return value != null; }
    public int swaps() { return swaps; }
}
