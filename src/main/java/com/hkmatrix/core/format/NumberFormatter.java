package com.hkmatrix.core.format;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.rational.Rational;

/**
 * Compact display formatting for numbers and matrices.
 *
 * - Values are rounded half-to-even to {@code decimals} places.
 * - A rounded value within 10^-decimals of an integer prints as that integer ("2", not "2.00").
 * - Otherwise trailing zeros and a dangling '.' are stripped ("0.5", not "0.50").
 */
public final class NumberFormatter {

    public static final int DEFAULT_PRECISION = 2;

    private static final String EMPTY = "[]";

    private NumberFormatter() {}

    public static String fmtNum(double x) {
        return fmtNum(x, DEFAULT_PRECISION);
    }

    public static String fmtNum(double x, int decimals) {
        if (Double.isNaN(x) || Double.isInfinite(x)) return String.valueOf(x);
        // exact binary value, so 2.005 (stored as 2.00499...) rounds down
        return fmtDecimal(new BigDecimal(x), decimals);
    }

    public static String fmtNum(Rational x, int decimals) {
        if (decimals < 0) throw new IllegalArgumentException("decimals must be >= 0, got " + decimals);
        BigDecimal v = new BigDecimal(x.numerator())
                .divide(new BigDecimal(x.denominator()), decimals, RoundingMode.HALF_EVEN);
        return fmtDecimal(v, decimals);
    }

    private static String fmtDecimal(BigDecimal value, int decimals) {
        if (decimals < 0) throw new IllegalArgumentException("decimals must be >= 0, got " + decimals);
        BigDecimal v = value.setScale(decimals, RoundingMode.HALF_EVEN);
        BigDecimal nearest = v.setScale(0, RoundingMode.HALF_EVEN);
        BigDecimal tolerance = BigDecimal.ONE.movePointLeft(decimals);
        if (v.subtract(nearest).abs().compareTo(tolerance) < 0) {
            return nearest.toBigInteger().toString();
        }
        String s = v.toPlainString();
        if (s.indexOf('.') >= 0) {
            int end = s.length();
            while (s.charAt(end - 1) == '0') end--;
            if (s.charAt(end - 1) == '.') end--;
            s = s.substring(0, end);
        }
        return s;
    }

    public static String fmtMatrix(RationalMatrix m) {
        return fmtMatrix(m, DEFAULT_PRECISION);
    }

    public static String fmtMatrix(RationalMatrix m, int precision) {
        if (m == null) return EMPTY;
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < m.rows(); r++) {
            if (r > 0) sb.append("\n ");
            sb.append('[');
            for (int c = 0; c < m.cols(); c++) {
                if (c > 0) sb.append(", ");
                sb.append(fmtNum(m.get(r, c), precision));
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }

    public static String fmtMatrix(double[][] m, int precision) {
        if (m == null || m.length == 0 || m[0].length == 0) return EMPTY;
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < m.length; r++) {
            if (r > 0) sb.append("\n ");
            sb.append('[');
            for (int c = 0; c < m[r].length; c++) {
                if (c > 0) sb.append(", ");
                sb.append(fmtNum(m[r][c], precision));
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }
}
