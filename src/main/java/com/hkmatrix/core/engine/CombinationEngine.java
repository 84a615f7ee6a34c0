package com.hkmatrix.core.engine;

import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;
import com.hkmatrix.debug.Debug;

/** Linear combination α·A + β·B, optionally with a coefficient taken from det(C). */
public final class CombinationEngine {

    private static final String TAG = "hkmatrix.combination";

    private CombinationEngine() {}

    public static StepLog combine(RationalMatrix a, RationalMatrix b, Rational alpha, Rational beta) {
        ElementwiseEngine.requireSameShape(a, b, "combination");
        return appendCombination(new StepLog(), a, b, alpha, beta);
    }

    /**
     * Same as {@link #combine} but α and/or β are replaced by det(C). The determinant trace of C
     * comes first in the returned log.
     */
    public static StepLog combineWithDeterminant(RationalMatrix a, RationalMatrix b, RationalMatrix c,
                                                 Rational alpha, Rational beta,
                                                 boolean alphaFromDet, boolean betaFromDet) {
        ElementwiseEngine.requireSameShape(a, b, "combination");
        if (!c.isSquare()) {
            throw new ValidationError("To use det(C), C must be square, got " + c.shape());
        }
        StepLog log = new StepLog();
        if (alphaFromDet || betaFromDet) {
            DeterminantResult det = DeterminantEngine.determinant(c);
            log.append(det.steps());
            if (alphaFromDet) alpha = det.value();
            if (betaFromDet) beta = det.value();
        }
        return appendCombination(log, a, b, alpha, beta);
    }

    private static StepLog appendCombination(StepLog log, RationalMatrix a, RationalMatrix b,
                                             Rational alpha, Rational beta) {
        RationalMatrix scaledA = a.scale(alpha);
        RationalMatrix scaledB = b.scale(beta);
        log.record("Scale α·A (α = " + alpha + ")", scaledA, log.isEmpty() ? StepOp.initial() : StepOp.note());
        log.record("Scale β·B (β = " + beta + ")", scaledB, StepOp.note());
        log.record("Sum α·A + β·B", scaledA.add(scaledB), StepOp.done());
        Debug.get().d(TAG, "combination " + a.shape() + " alpha=" + alpha + " beta=" + beta + " steps=" + log.size());
        return log.freeze();
    }
}
