package com.hkmatrix.core.engine;

import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.steps.StepLog;

/**
 * Linear independence of a set of vectors, read off the RREF of the matrix whose columns
 * are the vectors: independent iff every column gets a pivot.
 */
public final class IndependenceResult {
    private final int dimension;
    private final int vectorCount;
    private final int rank;
    private final StepLog steps;

    IndependenceResult(int dimension, int vectorCount, int rank, StepLog steps) {
        this.dimension = dimension;
        this.vectorCount = vectorCount;
        this.rank = rank;
        this.steps = steps.freeze();
    }

    /** Each column of {@code vectors} is one vector. */
    public static IndependenceResult of(RationalMatrix vectors) {
        ReductionResult rref = RowReducer.rref(vectors);
        return new IndependenceResult(vectors.rows(), vectors.cols(), rref.rank(), rref.steps());
    }

    public int dimension() { return dimension; }
    public int vectorCount() { return vectorCount; }
    public int rank() { return rank; }
    public boolean isIndependent() { return rank == vectorCount; }
    public StepLog steps() { return steps; }

    public String summary() {
        return "Space dimension: " + dimension
                + "\nNumber of vectors: " + vectorCount
                + "\nRank: " + rank
                + "\nConclusion: " + (isIndependent() ? "INDEPENDENT" : "DEPENDENT");
    }
}
