package com.hkmatrix.core.steps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import com.hkmatrix.core.matrix.MatrixWorkspace;
import com.hkmatrix.core.matrix.RationalMatrix;

/**
 * Ordered, append-only trace of an algorithm run.
 *
 * Insertion order is the only order. Snapshots are immutable matrices, and
 * {@link #record(String, MatrixWorkspace, StepOp.Op)} copies the workspace at the moment of
 * the call. Engines {@link #freeze()} a log before handing it out; a frozen log rejects
 * further records.
 */
public final class StepLog implements Iterable<Step> {

    private final List<Step> steps = new ArrayList<>();
    private boolean frozen;

    public StepLog record(String description, RationalMatrix snapshot, StepOp.Op op) {
        requireOpen();
        steps.add(new Step(description, snapshot, op));
        return this;
    }

    public StepLog record(String description, MatrixWorkspace workspace, StepOp.Op op) {
        return record(description, workspace.snapshot(), op);
    }

    /** Appends every step of {@code other}, in order. */
    public StepLog append(StepLog other) {
        requireOpen();
        steps.addAll(other.steps);
        return this;
    }

    public StepLog freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() { return frozen; }

    private void requireOpen() {
        if (frozen) throw new IllegalStateException("step log is frozen");
    }

    public List<Step> steps() {
        return Collections.unmodifiableList(steps);
    }

    public int size() { return steps.size(); }
    public boolean isEmpty() { return steps.isEmpty(); }
    public Step get(int index) { return steps.get(index); }

    public Step first() {
        if (steps.isEmpty()) throw new IllegalStateException("empty step log");
        return steps.get(0);
    }

    public Step last() {
        if (steps.isEmpty()) throw new IllegalStateException("empty step log");
        return steps.get(steps.size() - 1);
    }

    /** Snapshot of the last step. */
    public RationalMatrix finalMatrix() {
        return last().snapshot();
    }

    public List<String> descriptions() {
        List<String> out = new ArrayList<>(steps.size());
        for (Step s : steps) out.add(s.description());
        return out;
    }

    public int count(StepOp.Kind kind) {
        int n = 0;
        for (Step s : steps) if (s.op().kind() == kind) n++;
        return n;
    }

    @Override
    public Iterator<Step> iterator() {
        return steps().iterator();
    }
}
