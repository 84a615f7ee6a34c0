package com.hkmatrix.core.matrix;

import java.util.Arrays;
import java.util.List;

import com.hkmatrix.core.rational.Rational;

/**
 * RationalMatrix
 *
 * Immutable dense matrix of exact rationals.
 *
 * Design:
 * - rows, cols >= 1; ragged input is rejected.
 * - No mutators. Algorithms edit a {@link MatrixWorkspace} and take snapshots from it,
 *   so a matrix handed out once never changes afterwards.
 * - Value equality over shape and entries.
 */
public final class RationalMatrix {

    private final int rows;
    private final int cols;
    private final Rational[][] data;

    // takes ownership of data; callers pass a fresh array
    RationalMatrix(Rational[][] data) {
        this.rows = data.length;
        this.cols = data[0].length;
        this.data = data;
    }

    public static RationalMatrix of(Rational[][] data) {
        requireRectangular(data.length, data.length == 0 ? 0 : data[0].length, "of");
        int cCount = data[0].length;
        Rational[][] out = new Rational[data.length][];
        for (int r = 0; r < data.length; r++) {
            if (data[r].length != cCount) {
                throw new IllegalArgumentException("of: ragged matrix (row " + r + " has " + data[r].length + ", expected " + cCount + ")");
            }
            out[r] = new Rational[cCount];
            for (int c = 0; c < cCount; c++) {
                if (data[r][c] == null) throw new IllegalArgumentException("of: cell[" + r + "][" + c + "] is null");
                out[r][c] = data[r][c];
            }
        }
        return new RationalMatrix(out);
    }

    /** Promotes each double through its shortest decimal representation (0.1 -> 1/10). */
    public static RationalMatrix fromDoubles(double[][] data) {
        requireRectangular(data.length, data.length == 0 ? 0 : data[0].length, "fromDoubles");
        int cCount = data[0].length;
        Rational[][] out = new Rational[data.length][cCount];
        for (int r = 0; r < data.length; r++) {
            if (data[r].length != cCount) {
                throw new IllegalArgumentException("fromDoubles: ragged matrix (row " + r + " has " + data[r].length + ", expected " + cCount + ")");
            }
            for (int c = 0; c < cCount; c++) {
                out[r][c] = Rational.fromDouble(data[r][c]);
            }
        }
        return new RationalMatrix(out);
    }

    public static RationalMatrix ofLongs(long[][] data) {
        requireRectangular(data.length, data.length == 0 ? 0 : data[0].length, "ofLongs");
        Rational[][] out = new Rational[data.length][data[0].length];
        for (int r = 0; r < data.length; r++) {
            if (data[r].length != out[0].length) {
                throw new IllegalArgumentException("ofLongs: ragged matrix at row " + r);
            }
            for (int c = 0; c < data[r].length; c++) {
                out[r][c] = Rational.of(data[r][c]);
            }
        }
        return new RationalMatrix(out);
    }

    public static RationalMatrix zeros(int rows, int cols) {
        requireRectangular(rows, cols, "zeros");
        Rational[][] out = new Rational[rows][cols];
        for (Rational[] row : out) Arrays.fill(row, Rational.ZERO);
        return new RationalMatrix(out);
    }

    public static RationalMatrix identity(int n) {
        requireRectangular(n, n, "identity");
        Rational[][] out = new Rational[n][n];
        for (int r = 0; r < n; r++) {
            Arrays.fill(out[r], Rational.ZERO);
            out[r][r] = Rational.ONE;
        }
        return new RationalMatrix(out);
    }

    /** Single-column matrix holding the given values top to bottom. */
    public static RationalMatrix column(List<Rational> values) {
        requireRectangular(values.size(), 1, "column");
        Rational[][] out = new Rational[values.size()][1];
        for (int r = 0; r < out.length; r++) out[r][0] = values.get(r);
        return new RationalMatrix(out);
    }

    public int rows() { return rows; }
    public int cols() { return cols; }
    public boolean isSquare() { return rows == cols; }

    public Rational get(int r, int c) {
        return data[r][c];
    }

    public Rational[] row(int r) {
        return data[r].clone();
    }

    public double[][] toDoubleArray() {
        double[][] out = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) out[r][c] = data[r][c].doubleValue();
        }
        return out;
    }

    public RationalMatrix transpose() {
        Rational[][] out = new Rational[cols][rows];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) out[c][r] = data[r][c];
        }
        return new RationalMatrix(out);
    }

    /** Horizontal join [this | right]. */
    public RationalMatrix joinColumns(RationalMatrix right) {
        if (right.rows != rows) {
            throw new IllegalArgumentException("joinColumns: row mismatch " + rows + " vs " + right.rows);
        }
        Rational[][] out = new Rational[rows][cols + right.cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(data[r], 0, out[r], 0, cols);
            System.arraycopy(right.data[r], 0, out[r], cols, right.cols);
        }
        return new RationalMatrix(out);
    }

    /** Sub-block of columns [fromCol, toCol). All rows are kept. */
    public RationalMatrix columns(int fromCol, int toCol) {
        if (fromCol < 0 || toCol > cols || fromCol >= toCol) {
            throw new IllegalArgumentException("columns: bad range [" + fromCol + ", " + toCol + ") for " + cols + " columns");
        }
        Rational[][] out = new Rational[rows][toCol - fromCol];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(data[r], fromCol, out[r], 0, toCol - fromCol);
        }
        return new RationalMatrix(out);
    }

    /** Copy of this matrix with column {@code index} replaced by the single column of {@code replacement}. */
    public RationalMatrix withColumn(int index, RationalMatrix replacement) {
        if (replacement.cols != 1 || replacement.rows != rows) {
            throw new IllegalArgumentException("withColumn: expected a " + rows + "x1 column, got " + replacement.shape());
        }
        Rational[][] out = copyData();
        for (int r = 0; r < rows; r++) out[r][index] = replacement.data[r][0];
        return new RationalMatrix(out);
    }

    public RationalMatrix scale(Rational k) {
        Rational[][] out = new Rational[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) out[r][c] = data[r][c].multiply(k);
        }
        return new RationalMatrix(out);
    }

    public RationalMatrix add(RationalMatrix b) {
        requireSameShape(b, "add");
        Rational[][] out = new Rational[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) out[r][c] = data[r][c].add(b.data[r][c]);
        }
        return new RationalMatrix(out);
    }

    public RationalMatrix multiply(RationalMatrix b) {
        if (cols != b.rows) {
            throw new IllegalArgumentException("multiply: shape mismatch " + shape() + " * " + b.shape());
        }
        Rational[][] out = new Rational[rows][b.cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < b.cols; c++) {
                Rational acc = Rational.ZERO;
                for (int k = 0; k < cols; k++) acc = acc.add(data[r][k].multiply(b.data[k][c]));
                out[r][c] = acc;
            }
        }
        return new RationalMatrix(out);
    }

    public boolean isIdentity() {
        if (!isSquare()) return false;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                Rational x = data[r][c];
                if (r == c ? !x.isOne() : !x.isZero()) return false;
            }
        }
        return true;
    }

    public String shape() {
        return "(" + rows + "x" + cols + ")";
    }

    Rational[][] copyData() {
        Rational[][] out = new Rational[rows][];
        for (int r = 0; r < rows; r++) out[r] = data[r].clone();
        return out;
    }

    private void requireSameShape(RationalMatrix b, String fn) {
        if (rows != b.rows || cols != b.cols) {
            throw new IllegalArgumentException(fn + ": shape mismatch " + shape() + " vs " + b.shape());
        }
    }

    private static void requireRectangular(int rows, int cols, String fn) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException(fn + ": matrix must have at least one row and one column");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RationalMatrix)) return false;
        RationalMatrix m = (RationalMatrix) o;
        return rows == m.rows && cols == m.cols && Arrays.deepEquals(data, m.data);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < rows; r++) {
            if (r > 0) sb.append(", ");
            sb.append(Arrays.toString(data[r]));
        }
        return sb.append(']').toString();
    }
}
