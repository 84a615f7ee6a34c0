package com.hkmatrix.core.engine;

import java.util.Collections;
import java.util.List;

import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.steps.StepLog;

public final class ReductionResult {
    private final StepLog steps;
    private final List<Integer> pivotColumns;
    private final int swaps;

    ReductionResult(StepLog steps, List<Integer> pivotColumns, int swaps) {
        this.steps = steps.freeze();
        this.pivotColumns = Collections.unmodifiableList(pivotColumns);
        this.swaps = swaps;
    }

    public StepLog steps() { return steps; }
    public RationalMatrix result() { return steps.finalMatrix(); }

    /** 0-based columns that received a pivot, left to right. */
    public List<Integer> pivotColumns() { return pivotColumns; }
    public int rank() { return pivotColumns.size(); }
    public int swaps() { return swaps; }
}
