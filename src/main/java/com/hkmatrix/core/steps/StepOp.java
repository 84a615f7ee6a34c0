package com.hkmatrix.core.steps;

import com.hkmatrix.core.rational.Rational;

/**
 * Structured description of the single change a {@link Step} records.
 *
 * Renderers dispatch on the variant through {@link Visitor} instead of reading the
 * human-readable description. Row and column indices here are 0-based.
 */
public class StepOp {

    public enum Kind { INITIAL, SWAP, SCALE, COMBINE, CELL, SUBSTITUTE, NOTE, DONE }

    public interface Op {
        Kind kind();
        <R> R accept(Visitor<R> visitor);
    }

    public interface Visitor<R> {
        R visitInitial(Initial op);
        R visitSwap(Swap op);
        R visitScale(Scale op);
        R visitCombine(Combine op);
        R visitCell(Cell op);
        R visitSubstitute(Substitute op);
        R visitNote(Note op);
        R visitDone(Done op);
    }

    private static final Initial INITIAL = new Initial();
    private static final Note NOTE = new Note();
    private static final Done DONE = new Done();

    public static Initial initial() { return INITIAL; }
    public static Note note() { return NOTE; }
    public static Done done() { return DONE; }
    public static Swap swap(int first, int second) { return new Swap(first, second); }
    public static Scale scale(int row, Rational divisor) { return new Scale(row, divisor); }
    public static Combine combine(int target, int source, Rational factor) { return new Combine(target, source, factor); }
    public static Cell cell(int row, int col, Rational value) { return new Cell(row, col, value); }
    public static Substitute substitute(int column) { return new Substitute(column); }

    /** Starting state of a trace. */
    public static final class Initial implements Op {
        private Initial() {}
        public Kind kind() { return Kind.INITIAL; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitInitial(this); }
    }

    /** Rows {@code first} and {@code second} exchanged. */
    public static final class Swap implements Op {
        public final int first;
        public final int second;
        Swap(int first, int second) { this.first = first; this.second = second; }
        public Kind kind() { return Kind.SWAP; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSwap(this); }
    }

    /** Row divided by {@code divisor}. */
    public static final class Scale implements Op {
        public final int row;
        public final Rational divisor;
        Scale(int row, Rational divisor) { this.row = row; this.divisor = divisor; }
        public Kind kind() { return Kind.SCALE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitScale(this); }
    }

    /** target <- target - factor * source. */
    public static final class Combine implements Op {
        public final int target;
        public final int source;
        public final Rational factor;
        Combine(int target, int source, Rational factor) {
            this.target = target;
            this.source = source;
            this.factor = factor;
        }
        public Kind kind() { return Kind.COMBINE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCombine(this); }
    }

    /** One result cell computed. */
    public static final class Cell implements Op {
        public final int row;
        public final int col;
        public final Rational value;
        Cell(int row, int col, Rational value) { this.row = row; this.col = col; this.value = value; }
        public Kind kind() { return Kind.CELL; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCell(this); }
    }

    /** A column replaced by the right-hand side (Cramer). */
    public static final class Substitute implements Op {
        public final int column;
        Substitute(int column) { this.column = column; }
        public Kind kind() { return Kind.SUBSTITUTE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSubstitute(this); }
    }

    /** Informational step; the snapshot shows the matrix the note is about. */
    public static final class Note implements Op {
        private Note() {}
        public Kind kind() { return Kind.NOTE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitNote(this); }
    }

    /** Terminal step holding the final result. */
    public static final class Done implements Op {
        private Done() {}
        public Kind kind() { return Kind.DONE; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitDone(this); }
    }
}
