package com.hkmatrix.core.engine;

import com.hkmatrix.core.matrix.MatrixWorkspace;
import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;
import com.hkmatrix.debug.Debug;

/**
 * Determinant by triangularization without row scaling.
 *
 * det = (product of the final diagonal) * (-1)^swaps, computed exactly.
 * A non-square matrix is reported in the trace, not thrown.
 */
public final class DeterminantEngine {

    private static final String TAG = "hkmatrix.det";

    private DeterminantEngine() {}

    public static DeterminantResult determinant(RationalMatrix a) {
        StepLog log = new StepLog().record("Initial matrix", a, StepOp.initial());
        if (!a.isSquare()) {
            log.record("Not square: determinant undefined", a, StepOp.note());
            Debug.get().d(TAG, "det " + a.shape() + " not square");
            return new DeterminantResult(log, null, 0);
        }

        MatrixWorkspace ws = new MatrixWorkspace(a);
        RowReducer.Sweep sweep = RowReducer.sweep(ws, log, RowReducer.Mode.DETERMINANT, ws.cols());

        Rational det = Rational.ONE;
        for (int i = 0; i < ws.rows(); i++) det = det.multiply(ws.get(i, i));
        if (sweep.swaps % 2 == 1) det = det.negate();

        log.record("Determinant = product of diagonal * (-1)^swaps = " + det, ws, StepOp.done());
        Debug.get().d(TAG, "det " + a.shape() + " = " + det + " swaps=" + sweep.swaps + " steps=" + log.size());
        return new DeterminantResult(log, det, sweep.swaps);
    }

    /** Exact determinant without keeping the trace. */
    public static Rational value(RationalMatrix a) {
        if (!a.isSquare()) {
            throw new ValidationError("Determinant needs a square matrix, got " + a.shape());
        }
        return determinant(a).value();
    }
}
