package com.hkmatrix.core.engine;

import java.util.Random;

import com.hkmatrix.core.matrix.RationalMatrix;

/** Random integer matrices for exercises. */
public final class MatrixGenerator {

    public static final int DEFAULT_LOW = -9;
    public static final int DEFAULT_HIGH = 9;

    private MatrixGenerator() {}

    public static RationalMatrix randomIntegers(int rows, int cols, Random random) {
        return randomIntegers(rows, cols, DEFAULT_LOW, DEFAULT_HIGH, random);
    }

    /** Entries uniform in [low, high], both ends inclusive. */
    public static RationalMatrix randomIntegers(int rows, int cols, int low, int high, Random random) {
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("rows and cols must be >= 1, got " + rows + "x" + cols);
        }
        if (low > high) {
            throw new IllegalArgumentException("low must be <= high, got [" + low + ", " + high + "]");
        }
        long span = (long) high - low + 1;
        long[][] out = new long[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                out[r][c] = low + (long) (random.nextDouble() * span);
            }
        }
        return RationalMatrix.ofLongs(out);
    }
}
