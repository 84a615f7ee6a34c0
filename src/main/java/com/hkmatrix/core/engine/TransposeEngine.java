package com.hkmatrix.core.engine;

import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;

public final class TransposeEngine {

    private TransposeEngine() {}

    /** Always two steps: the original and its transpose. */
    public static StepLog transpose(RationalMatrix a) {
        return new StepLog()
                .record("Original matrix A", a, StepOp.initial())
                .record("Transpose: A^T (rows <-> columns)", a.transpose(), StepOp.done())
                .freeze();
    }
}
