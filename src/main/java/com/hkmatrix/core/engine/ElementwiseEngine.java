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
 * ElementwiseEngine
 *
 * A + B, A - B and A·B with one step per result cell.
 *
 * Trace shape:
 * - "Initial result matrix (zeros)"
 * - one step per cell in row-major order, naming the exact operands and the value
 * - a final step holding the complete result
 */
public final class ElementwiseEngine {

    private static final String TAG = "hkmatrix.elementwise";

    private ElementwiseEngine() {}

    public static StepLog add(RationalMatrix a, RationalMatrix b) {
        requireSameShape(a, b, "add");
        return cellwise(a, b, '+', "Sum complete A + B");
    }

    public static StepLog subtract(RationalMatrix a, RationalMatrix b) {
        requireSameShape(a, b, "subtract");
        return cellwise(a, b, '-', "Difference complete A - B");
    }

    public static StepLog multiply(RationalMatrix a, RationalMatrix b) {
        if (a.cols() != b.rows()) {
            throw new ValidationError("multiply: incompatible dimensions " + a.shape() + " * " + b.shape()
                    + " (columns of A must equal rows of B)");
        }
        int rows = a.rows();
        int cols = b.cols();
        MatrixWorkspace c = new MatrixWorkspace(RationalMatrix.zeros(rows, cols));
        StepLog log = new StepLog().record("Initial result matrix (zeros)", c, StepOp.initial());

        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                Rational acc = Rational.ZERO;
                List<String> terms = new ArrayList<>(a.cols());
                for (int k = 0; k < a.cols(); k++) {
                    acc = acc.add(a.get(i, k).multiply(b.get(k, j)));
                    terms.add(operand(a.get(i, k)) + "*" + operand(b.get(k, j)));
                }
                c.set(i, j, acc);
                log.record(cellLabel(i, j) + String.join(" + ", terms) + " = " + acc, c, StepOp.cell(i, j, acc));
            }
        }

        log.record("Product complete A·B", c, StepOp.done());
        Debug.get().d(TAG, "multiply " + a.shape() + " * " + b.shape() + " steps=" + log.size());
        return log.freeze();
    }

    private static StepLog cellwise(RationalMatrix a, RationalMatrix b, char op, String doneText) {
        MatrixWorkspace c = new MatrixWorkspace(RationalMatrix.zeros(a.rows(), a.cols()));
        StepLog log = new StepLog().record("Initial result matrix (zeros)", c, StepOp.initial());

        for (int i = 0; i < a.rows(); i++) {
            for (int j = 0; j < a.cols(); j++) {
                Rational x = a.get(i, j);
                Rational y = b.get(i, j);
                Rational v = (op == '+') ? x.add(y) : x.subtract(y);
                c.set(i, j, v);
                log.record(cellLabel(i, j) + operand(x) + " " + op + " " + operand(y) + " = " + v,
                        c, StepOp.cell(i, j, v));
            }
        }

        log.record(doneText, c, StepOp.done());
        Debug.get().d(TAG, (op == '+' ? "add " : "subtract ") + a.shape() + " steps=" + log.size());
        return log.freeze();
    }

    private static String cellLabel(int i, int j) {
        return "Compute C[" + (i + 1) + "," + (j + 1) + "] = ";
    }

    // negative operands in parentheses: 1 - (-2)
    static String operand(Rational x) {
        return x.signum() < 0 ? "(" + x + ")" : x.toString();
    }

    static void requireSameShape(RationalMatrix a, RationalMatrix b, String fn) {
        if (a.rows() != b.rows() || a.cols() != b.cols()) {
            throw new ValidationError(fn + ": A and B must have the same shape, got " + a.shape() + " and " + b.shape());
        }
    }
}
