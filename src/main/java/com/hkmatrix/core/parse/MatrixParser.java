package com.hkmatrix.core.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.hkmatrix.debug.Debug;

/**
 * MatrixParser
 *
 * Turns user text into a rectangular {@code double[][]}.
 *
 * Accepted syntaxes, tried in this order:
 * - Literal: nested brackets or parentheses, e.g. {@code [[1, 2], [3, 4]]} or {@code (1, 2), (3, 4)}.
 *   ';' counts as ','. Must be exactly two levels deep and rectangular.
 * - Free-form: rows separated by newlines or ';', values by whitespace or ','.
 *   e.g. {@code "1 2; 3 4"} or {@code "1,2\n3,4"}.
 *
 * When the literal reading does not yield a valid matrix the free-form reading decides,
 * and its error (if any) is the one reported.
 */
public final class MatrixParser {

    private static final String TAG = "hkmatrix.parse";

    private static final Pattern ROW_SPLIT = Pattern.compile("[;\\n]+");
    private static final Pattern VALUE_SPLIT = Pattern.compile("[\\s,]+");
    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private MatrixParser() {}

    public static double[][] parseMatrix(String text) {
        String s = requireText(text);
        try {
            return new LiteralParser(new MatrixLexer(s).tokenize()).parseMatrix(false);
        } catch (ParseError literalFailure) {
            Debug.get().t(TAG, "literal syntax rejected, reading free-form: " + literalFailure.getMessage());
        }
        List<double[]> rows = readRows(s, "row");
        if (rows.isEmpty()) throw new ParseError("Could not interpret the matrix");
        requireSameLength(rows, "All rows must have the same number of columns");
        return rows.toArray(new double[0][]);
    }

    /** Each input vector becomes one column of the result. */
    public static double[][] parseVectors(String text) {
        String s = requireText(text);
        double[][] vectors = null;
        try {
            vectors = new LiteralParser(new MatrixLexer(s).tokenize()).parseMatrix(true);
        } catch (ParseError literalFailure) {
            Debug.get().t(TAG, "literal syntax rejected, reading free-form: " + literalFailure.getMessage());
        }
        if (vectors == null) {
            List<double[]> rows = readRows(s, "vector");
            if (rows.isEmpty()) throw new ParseError("Could not interpret the vectors");
            requireSameLength(rows, "All vectors must have the same dimension");
            vectors = rows.toArray(new double[0][]);
        }
        return transpose(vectors);
    }

    // ===================== FREE-FORM =====================

    private static List<double[]> readRows(String s, String what) {
        List<double[]> rows = new ArrayList<>();
        for (String part : ROW_SPLIT.split(s)) {
            String line = part.strip();
            if (line.isEmpty()) continue;
            List<String> tokens = new ArrayList<>();
            for (String t : VALUE_SPLIT.split(line)) {
                if (!t.isEmpty()) tokens.add(t);
            }
            double[] row = new double[tokens.size()];
            for (int i = 0; i < row.length; i++) {
                row[i] = parseNumber(tokens.get(i), what, rows.size() + 1);
            }
            rows.add(row);
        }
        return rows;
    }

    private static double parseNumber(String token, String what, int index) {
        if (!NUMBER.matcher(token).matches()) {
            throw new ParseError("Invalid number '" + token + "' in " + what + " " + index);
        }
        double v = Double.parseDouble(token);
        if (Double.isInfinite(v)) {
            throw new ParseError("Number out of range '" + token + "' in " + what + " " + index);
        }
        return v;
    }

    private static void requireSameLength(List<double[]> rows, String message) {
        int expected = rows.get(0).length;
        for (int r = 0; r < rows.size(); r++) {
            int len = rows.get(r).length;
            if (len != expected) {
                throw new ParseError(message + " (line " + (r + 1) + " has " + len + ", expected " + expected + ")");
            }
        }
        if (expected == 0) throw new ParseError("No values found");
    }

    private static String requireText(String text) {
        if (text == null || text.isBlank()) throw new ParseError("Empty input");
        return text.strip();
    }

    private static double[][] transpose(double[][] m) {
        double[][] out = new double[m[0].length][m.length];
        for (int r = 0; r < m.length; r++) {
            for (int c = 0; c < m[0].length; c++) out[c][r] = m[r][c];
        }
        return out;
    }

    // ===================== LITERAL =====================

    /**
     * Recursive-descent reader for nested sequences. Produces a tree of {@code Double}
     * leaves and {@code List} nodes, then checks it is a 2D rectangle.
     */
    private static final class LiteralParser {
        private final List<Token> tokens;
        private int current = 0;

        LiteralParser(List<Token> tokens) {
            this.tokens = tokens;
        }

        double[][] parseMatrix(boolean allowFlat) {
            Object tree = topLevel();
            return toMatrix(tree, allowFlat);
        }

        // a bare top-level "1, 2" or "[1, 2], [3, 4]" is a sequence, as in "(…)"
        private Object topLevel() {
            List<Object> items = new ArrayList<>();
            boolean sawComma = false;
            items.add(element());
            while (match(TokenType.COMMA)) {
                sawComma = true;
                if (check(TokenType.EOF)) break;
                items.add(element());
            }
            consume(TokenType.EOF, "Unexpected '" + peek().lexeme + "'");
            return sawComma ? items : items.get(0);
        }

        private Object element() {
            if (match(TokenType.LEFT_BRACKET)) {
                return sequence(TokenType.RIGHT_BRACKET, true);
            }
            if (match(TokenType.LEFT_PAREN)) {
                return sequence(TokenType.RIGHT_PAREN, false);
            }
            return signedNumber();
        }

        // "(x)" without a comma is just x; "[x]" is always a list
        private Object sequence(TokenType close, boolean alwaysList) {
            List<Object> items = new ArrayList<>();
            boolean sawComma = false;
            while (!check(close)) {
                items.add(element());
                if (!match(TokenType.COMMA)) break;
                sawComma = true;
            }
            consume(close, "Expected '" + (close == TokenType.RIGHT_BRACKET ? "]" : ")") + "'");
            if (!alwaysList && !sawComma && items.size() == 1) return items.get(0);
            return items;
        }

        // at most one sign: "--1" is not a number
        private Double signedNumber() {
            boolean negative = match(TokenType.MINUS);
            if (!negative) match(TokenType.PLUS);
            Token t = consume(TokenType.NUMBER, "Expected a number");
            return negative ? -t.value : t.value;
        }

        private double[][] toMatrix(Object tree, boolean allowFlat) {
            if (!(tree instanceof List)) throw new ParseError("The input must describe a 2D matrix");
            List<?> outer = (List<?>) tree;
            if (outer.isEmpty()) throw new ParseError("The input must describe a 2D matrix");

            if (allLeaves(outer)) {
                if (!allowFlat) throw new ParseError("The input must describe a 2D matrix");
                return new double[][] { toRow(outer) };
            }

            int cols = -1;
            double[][] out = new double[outer.size()][];
            for (int r = 0; r < outer.size(); r++) {
                Object row = outer.get(r);
                if (!(row instanceof List) || !allLeaves((List<?>) row)) {
                    throw new ParseError("The input must describe a 2D matrix");
                }
                List<?> cells = (List<?>) row;
                if (cols < 0) cols = cells.size();
                if (cells.size() != cols) {
                    throw new ParseError("All rows must have the same number of columns (row " + (r + 1) + " has " + cells.size() + ", expected " + cols + ")");
                }
                out[r] = toRow(cells);
            }
            if (cols == 0) throw new ParseError("No values found");
            return out;
        }

        private static boolean allLeaves(List<?> items) {
            for (Object o : items) if (!(o instanceof Double)) return false;
            return true;
        }

        private static double[] toRow(List<?> cells) {
            double[] row = new double[cells.size()];
            for (int i = 0; i < row.length; i++) row[i] = (Double) cells.get(i);
            return row;
        }

        private boolean match(TokenType type) {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        private Token consume(TokenType type, String message) {
            if (check(type)) return advance();
            throw new ParseError("[col " + (peek().position + 1) + "] " + message);
        }

        private boolean check(TokenType type) {
            return peek().type == type;
        }

        private Token advance() {
            Token t = peek();
            if (t.type != TokenType.EOF) current++;
            return t;
        }

        private Token peek() { return tokens.get(current); }
    }
}
