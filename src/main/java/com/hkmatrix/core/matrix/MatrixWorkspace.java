package com.hkmatrix.core.matrix;

import com.hkmatrix.core.rational.Rational;

/**
 * Mutable working copy edited in place by the row-reduction algorithms.
 *
 * Every elementary operation touches exactly one row (or a pair, for swaps).
 * {@link #snapshot()} hands out an independent {@link RationalMatrix}; later edits
 * to the workspace never reach a snapshot taken earlier.
 */
public final class MatrixWorkspace {

    private final int rows;
    private final int cols;
    private final Rational[][] data;

    public MatrixWorkspace(RationalMatrix source) {
        this.rows = source.rows();
        this.cols = source.cols();
        this.data = source.copyData();
    }

    public int rows() { return rows; }
    public int cols() { return cols; }

    public Rational get(int r, int c) {
        return data[r][c];
    }

    public void set(int r, int c, Rational value) {
        data[r][c] = value;
    }

    public void swapRows(int a, int b) {
        Rational[] tmp = data[a];
        data[a] = data[b];
        data[b] = tmp;
    }

    /** row[r] <- row[r] / divisor */
    public void divideRow(int r, Rational divisor) {
        Rational[] row = data[r];
        for (int c = 0; c < cols; c++) row[c] = row[c].divide(divisor);
    }

    /** row[target] <- row[target] - factor * row[source] */
    public void subtractMultiple(int target, int source, Rational factor) {
        Rational[] dst = data[target];
        Rational[] src = data[source];
        for (int c = 0; c < cols; c++) dst[c] = dst[c].subtract(factor.multiply(src[c]));
    }

    public RationalMatrix snapshot() {
        Rational[][] out = new Rational[rows][];
        for (int r = 0; r < rows; r++) out[r] = data[r].clone();
        return new RationalMatrix(out);
    }
}
