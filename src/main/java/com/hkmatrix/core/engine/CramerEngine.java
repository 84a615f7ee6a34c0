package com.hkmatrix.core.engine;

import java.util.ArrayList;
import java.util.List;

import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;
import com.hkmatrix.debug.Debug;

/**
 * Solves Ax = b by Cramer's rule: x_i = det(A_i) / det(A), where A_i is A with column i
 * replaced by b. det(A) = 0 is the "no unique solution" outcome, not an error.
 */
public final class CramerEngine {

    private static final String TAG = "hkmatrix.cramer";

    private CramerEngine() {}

    public static CramerResult solve(RationalMatrix a, RationalMatrix b) {
        if (b.cols() != 1) {
            throw new ValidationError("The vector b must have a single column, got " + b.shape());
        }
        if (!a.isSquare()) {
            throw new ValidationError("The coefficient matrix must be square, got " + a.shape());
        }
        int n = a.rows();
        if (b.rows() != n) {
            throw new ValidationError("The vector b must have as many rows as A (" + n + "), got " + b.rows());
        }

        StepLog log = new StepLog().record("Augmented system [A|b]", a.joinColumns(b), StepOp.initial());

        DeterminantResult coefficient = DeterminantEngine.determinant(a);
        Rational detA = coefficient.value();
        log.record("det(A) = " + detA, a, StepOp.note());

        if (detA.isZero()) {
            log.record("det(A) = 0: Cramer's rule does not apply (no unique solution)", a, StepOp.done());
            Debug.get().d(TAG, "cramer " + a.shape() + " singular");
            return new CramerResult(null, log, detA, List.of(), List.of(), coefficient.steps());
        }

        List<Rational> columnDets = new ArrayList<>(n);
        List<Rational> exact = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String idx = String.valueOf(i + 1);
            RationalMatrix ai = a.withColumn(i, b);
            log.record("A_" + idx + ": replace column " + idx + " with b", ai, StepOp.substitute(i));

            Rational detAi = DeterminantEngine.value(ai);
            columnDets.add(detAi);
            log.record("det(A_" + idx + ") = " + detAi, ai, StepOp.note());

            Rational xi = detAi.divide(detA);
            exact.add(xi);
            log.record("x_" + idx + " = det(A_" + idx + ") / det(A) = " + detAi + "/" + detA + " = " + xi,
                    RationalMatrix.column(List.of(xi)), StepOp.note());
        }

        log.record("Solution vector x", RationalMatrix.column(exact), StepOp.done());

        double[] approx = new double[n];
        for (int i = 0; i < n; i++) approx[i] = exact.get(i).doubleValue();

        Debug.get().d(TAG, "cramer " + a.shape() + " det=" + detA + " steps=" + log.size());
        return new CramerResult(approx, log, detA, columnDets, exact, coefficient.steps());
    }
}
