package com.hkmatrix.core.engine;

import com.hkmatrix.core.matrix.MatrixWorkspace;
import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;
import com.hkmatrix.debug.Debug;

/**
 * Inverse through the augmented matrix [A | I].
 *
 * The RREF sweep runs over the left n columns only. A left block equal to I means the
 * right block is A^-1; anything else means A is singular. Both outcomes are logged,
 * neither throws.
 */
public final class InverseEngine {

    private static final String TAG = "hkmatrix.inverse";

    private InverseEngine() {}

    public static InverseResult inverse(RationalMatrix a) {
        StepLog log = new StepLog();
        if (!a.isSquare()) {
            log.record("Matrix is not square: no inverse exists", a, StepOp.note());
            Debug.get().d(TAG, "inverse " + a.shape() + " not square");
            return new InverseResult(log, null, false);
        }

        int n = a.rows();
        RationalMatrix augmented = a.joinColumns(RationalMatrix.identity(n));
        log.record("Augmented matrix [A|I]", augmented, StepOp.initial());

        MatrixWorkspace ws = new MatrixWorkspace(augmented);
        RowReducer.sweep(ws, log, RowReducer.Mode.RREF, n);

        RationalMatrix reduced = ws.snapshot();
        RationalMatrix left = reduced.columns(0, n);
        if (left.isIdentity()) {
            log.record("Left block is I: right block is A^-1", reduced, StepOp.done());
            Debug.get().d(TAG, "inverse " + a.shape() + " ok steps=" + log.size());
            return new InverseResult(log, reduced.columns(n, 2 * n), true);
        }
        log.record("Left block is not I: A is not invertible", reduced, StepOp.done());
        Debug.get().d(TAG, "inverse " + a.shape() + " singular steps=" + log.size());
        return new InverseResult(log, null, true);
    }
}
