package com.hkmatrix.core.engine;

import java.util.Collections;
import java.util.List;

import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepLog;

/**
 * Outcome of a Cramer solve.
 *
 * {@link #solution()} is null when det(A) = 0; the column determinants and exact solution
 * are then empty, while the trace and the determinant trace of A are still complete.
 */
public final class CramerResult {
    private final double[] solution;
    private final StepLog steps;
    private final Rational determinant;
    private final List<Rational> columnDeterminants;
    private final List<Rational> exactSolution;
    private final StepLog determinantSteps;

    CramerResult(double[] solution, StepLog steps, Rational determinant,
                 List<Rational> columnDeterminants, List<Rational> exactSolution, StepLog determinantSteps) {
        this.solution = solution;
        this.steps = steps.freeze();
        this.determinant = determinant;
        this.columnDeterminants = Collections.unmodifiableList(columnDeterminants);
        this.exactSolution = Collections.unmodifiableList(exactSolution);
        this.determinantSteps = determinantSteps.freeze();
    }

    /** Floating-point copy of the exact solution, or null without a unique solution. */
    public double[] solution() { return solution == null ? null : solution.clone(); }

    public boolean hasUniqueSolution() { return solution != null; }
    public StepLog steps() { return steps; }
    public Rational determinant() { return determinant; }
    public List<Rational> columnDeterminants() { return columnDeterminants; }
    public List<Rational> exactSolution() { return exactSolution; }

    /** Triangularization trace of the coefficient matrix. */
    public StepLog determinantSteps() { return determinantSteps; }
}
