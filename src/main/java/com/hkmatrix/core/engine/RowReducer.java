package com.hkmatrix.core.engine;

import java.util.ArrayList;
import java.util.List;

import com.hkmatrix.core.matrix.MatrixWorkspace;
import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;
import com.hkmatrix.debug.Debug;

/**
 * RowReducer
 *
 * Shared Gaussian elimination used by RREF, upper triangularization, the determinant
 * and the inverse.
 *
 * Sweep:
 * - Columns left to right with a row pointer r starting at 0.
 * - Pivot = first row at or below r with a non-zero entry in the column. No magnitude-based
 *   pivoting: which row is chosen decides which operations appear in the trace.
 * - A column without a pivot is skipped and r stays put.
 * - RREF scales the pivot row to 1 and clears the column everywhere else; the triangular
 *   modes never scale and only clear below the pivot.
 *
 * Each swap, scale and row combination is logged as its own step.
 */
public final class RowReducer {

    private static final String TAG = "hkmatrix.rref";

    public enum Mode {
        RREF(true, true),
        TRIANGULAR(false, false),
        DETERMINANT(false, false);

        final boolean scalePivot;
        final boolean clearAbove;

        Mode(boolean scalePivot, boolean clearAbove) {
            this.scalePivot = scalePivot;
            this.clearAbove = clearAbove;
        }
    }

    private RowReducer() {}

    public static ReductionResult rref(RationalMatrix a) {
        StepLog log = new StepLog().record("Initial matrix", a, StepOp.initial());
        MatrixWorkspace ws = new MatrixWorkspace(a);
        Sweep sweep = sweep(ws, log, Mode.RREF, ws.cols());
        log.record("Result: RREF", ws, StepOp.done());
        Debug.get().d(TAG, "rref " + a.shape() + " rank=" + sweep.pivotColumns.size() + " steps=" + log.size());
        return new ReductionResult(log, sweep.pivotColumns, sweep.swaps);
    }

    public static ReductionResult upperTriangular(RationalMatrix a) {
        StepLog log = new StepLog().record("Initial matrix", a, StepOp.initial());
        MatrixWorkspace ws = new MatrixWorkspace(a);
        Sweep sweep = sweep(ws, log, Mode.TRIANGULAR, ws.cols());
        log.record("Result: U (upper triangular)", ws, StepOp.done());
        Debug.get().d(TAG, "triangular " + a.shape() + " swaps=" + sweep.swaps + " steps=" + log.size());
        return new ReductionResult(log, sweep.pivotColumns, sweep.swaps);
    }

    /** Pivot columns found and swaps performed by one sweep. */
    static final class Sweep {
        final List<Integer> pivotColumns = new ArrayList<>();
        int swaps;
    }

    /**
     * Runs the elimination in place over columns {@code [0, columnLimit)}, appending one step
     * per elementary operation. Does not record the initial or final step.
     */
    static Sweep sweep(MatrixWorkspace ws, StepLog log, Mode mode, int columnLimit) {
        Sweep out = new Sweep();
        int rows = ws.rows();
        int r = 0;
        for (int c = 0; c < columnLimit && r < rows; c++) {
            int piv = -1;
            for (int i = r; i < rows; i++) {
                if (!ws.get(i, c).isZero()) { piv = i; break; }
            }
            if (piv < 0) continue;

            if (piv != r) {
                ws.swapRows(piv, r);
                out.swaps++;
                log.record(swapText(mode, piv, r), ws, StepOp.swap(piv, r));
            }

            if (mode.scalePivot && !ws.get(r, c).isOne()) {
                Rational divisor = ws.get(r, c);
                ws.divideRow(r, divisor);
                log.record("Divide row " + (r + 1) + " by " + divisor, ws, StepOp.scale(r, divisor));
            }

            int from = mode.clearAbove ? 0 : r + 1;
            for (int i = from; i < rows; i++) {
                if (i == r || ws.get(i, c).isZero()) continue;
                Rational factor = ws.get(i, c).divide(ws.get(r, c));
                ws.subtractMultiple(i, r, factor);
                log.record(combineText(mode, i, r, factor), ws, StepOp.combine(i, r, factor));
            }

            out.pivotColumns.add(c);
            r++;
        }
        return out;
    }

    private static String swapText(Mode mode, int piv, int r) {
        if (mode == Mode.DETERMINANT) {
            return "Swap rows " + (piv + 1) + "<->" + (r + 1) + " (flips the sign of the determinant)";
        }
        return "Swap row " + (piv + 1) + " with row " + (r + 1);
    }

    private static String combineText(Mode mode, int i, int r, Rational factor) {
        String op = "R" + (i + 1) + " <- R" + (i + 1) + " - (" + factor + ")*R" + (r + 1);
        return mode == Mode.DETERMINANT ? "Eliminate below pivot: " + op : op;
    }
}
