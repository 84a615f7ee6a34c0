package com.hkmatrix;

import com.hkmatrix.core.engine.CombinationEngine;
import com.hkmatrix.core.engine.CramerEngine;
import com.hkmatrix.core.engine.CramerResult;
import com.hkmatrix.core.engine.DeterminantEngine;
import com.hkmatrix.core.engine.DeterminantResult;
import com.hkmatrix.core.engine.ElementwiseEngine;
import com.hkmatrix.core.engine.IndependenceResult;
import com.hkmatrix.core.engine.InverseEngine;
import com.hkmatrix.core.engine.InverseResult;
import com.hkmatrix.core.engine.ReductionResult;
import com.hkmatrix.core.engine.RowReducer;
import com.hkmatrix.core.engine.TransposeEngine;
import com.hkmatrix.core.format.NumberFormatter;
import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.parse.MatrixParser;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepLog;

/**
 * HkMatrix
 *
 * Entry points for callers such as a step viewer or the command line.
 *
 * Design:
 * - Every function is pure and stateless; concurrent calls on independent inputs are safe.
 * - Inputs from the parser are {@code double[][]}; they are promoted to exact rationals
 *   through their shortest decimal form before any arithmetic.
 * - Parse failures throw ParseError, shape mismatches throw ValidationError. A singular matrix,
 *   a zero Cramer determinant or a rank-deficient RREF are results, not errors.
 *
 * Functions:
 * - parseMatrix(text), parseVectors(text)
 * - fmtNum(x, decimals), fmtMatrix(m, precision)
 * - rrefSteps(A), upperTriangularSteps(A), determinantSteps(A), inverseSteps(A)
 * - cramerSteps(A, b)
 * - addSteps(A, B), subSteps(A, B), multiplySteps(A, B), transposeSteps(A)
 * - combinationSteps(A, B, alpha, beta [, C])
 * - independence(vectorsAsColumns)
 */
public final class HkMatrix {

    private HkMatrix() {}

    // ===================== TEXT =====================

    public static double[][] parseMatrix(String text) {
        return MatrixParser.parseMatrix(text);
    }

    public static double[][] parseVectors(String text) {
        return MatrixParser.parseVectors(text);
    }

    public static String fmtNum(double x, int decimals) {
        return NumberFormatter.fmtNum(x, decimals);
    }

    public static String fmtNum(Rational x, int decimals) {
        return NumberFormatter.fmtNum(x, decimals);
    }

    public static String fmtMatrix(RationalMatrix m, int precision) {
        return NumberFormatter.fmtMatrix(m, precision);
    }

    public static String fmtMatrix(double[][] m, int precision) {
        return NumberFormatter.fmtMatrix(m, precision);
    }

    // ===================== ROW REDUCTION =====================

    public static ReductionResult rref(RationalMatrix a) {
        return RowReducer.rref(a);
    }

    public static StepLog rrefSteps(RationalMatrix a) {
        return RowReducer.rref(a).steps();
    }

    public static StepLog rrefSteps(double[][] a) {
        return rrefSteps(RationalMatrix.fromDoubles(a));
    }

    public static ReductionResult upperTriangular(RationalMatrix a) {
        return RowReducer.upperTriangular(a);
    }

    public static StepLog upperTriangularSteps(RationalMatrix a) {
        return RowReducer.upperTriangular(a).steps();
    }

    public static StepLog upperTriangularSteps(double[][] a) {
        return upperTriangularSteps(RationalMatrix.fromDoubles(a));
    }

    public static DeterminantResult determinant(RationalMatrix a) {
        return DeterminantEngine.determinant(a);
    }

    public static StepLog determinantSteps(RationalMatrix a) {
        return DeterminantEngine.determinant(a).steps();
    }

    public static StepLog determinantSteps(double[][] a) {
        return determinantSteps(RationalMatrix.fromDoubles(a));
    }

    public static InverseResult inverse(RationalMatrix a) {
        return InverseEngine.inverse(a);
    }

    public static StepLog inverseSteps(RationalMatrix a) {
        return InverseEngine.inverse(a).steps();
    }

    public static StepLog inverseSteps(double[][] a) {
        return inverseSteps(RationalMatrix.fromDoubles(a));
    }

    // ===================== SYSTEMS =====================

    public static CramerResult cramerSteps(RationalMatrix a, RationalMatrix b) {
        return CramerEngine.solve(a, b);
    }

    public static CramerResult cramerSteps(double[][] a, double[][] b) {
        return cramerSteps(RationalMatrix.fromDoubles(a), RationalMatrix.fromDoubles(b));
    }

    /** Vector form: b given as a plain array, treated as a single column. */
    public static CramerResult cramerSteps(double[][] a, double[] b) {
        double[][] column = new double[b.length][1];
        for (int i = 0; i < b.length; i++) column[i][0] = b[i];
        return cramerSteps(a, column);
    }

    public static IndependenceResult independence(RationalMatrix vectorsAsColumns) {
        return IndependenceResult.of(vectorsAsColumns);
    }

    // ===================== ARITHMETIC =====================

    public static StepLog addSteps(RationalMatrix a, RationalMatrix b) {
        return ElementwiseEngine.add(a, b);
    }

    public static StepLog addSteps(double[][] a, double[][] b) {
        return addSteps(RationalMatrix.fromDoubles(a), RationalMatrix.fromDoubles(b));
    }

    public static StepLog subSteps(RationalMatrix a, RationalMatrix b) {
        return ElementwiseEngine.subtract(a, b);
    }

    public static StepLog subSteps(double[][] a, double[][] b) {
        return subSteps(RationalMatrix.fromDoubles(a), RationalMatrix.fromDoubles(b));
    }

    public static StepLog multiplySteps(RationalMatrix a, RationalMatrix b) {
        return ElementwiseEngine.multiply(a, b);
    }

    public static StepLog multiplySteps(double[][] a, double[][] b) {
        return multiplySteps(RationalMatrix.fromDoubles(a), RationalMatrix.fromDoubles(b));
    }

    public static StepLog transposeSteps(RationalMatrix a) {
        return TransposeEngine.transpose(a);
    }

    public static StepLog transposeSteps(double[][] a) {
        return transposeSteps(RationalMatrix.fromDoubles(a));
    }

    public static StepLog combinationSteps(RationalMatrix a, RationalMatrix b, Rational alpha, Rational beta) {
        return CombinationEngine.combine(a, b, alpha, beta);
    }

    public static StepLog combinationSteps(RationalMatrix a, RationalMatrix b, RationalMatrix c,
                                           Rational alpha, Rational beta,
                                           boolean alphaFromDet, boolean betaFromDet) {
        return CombinationEngine.combineWithDeterminant(a, b, c, alpha, beta, alphaFromDet, betaFromDet);
    }
}
