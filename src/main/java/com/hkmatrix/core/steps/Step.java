package com.hkmatrix.core.steps;

import java.util.Objects;

import com.hkmatrix.core.matrix.RationalMatrix;

public final class Step {
    private final String description;
    private final RationalMatrix snapshot;
    private final StepOp.Op op;

    public Step(String description, RationalMatrix snapshot, StepOp.Op op) {
        this.description = Objects.requireNonNull(description, "description");
        this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
        this.op = Objects.requireNonNull(op, "op");
    }

    public String description() { return description; }
    public RationalMatrix snapshot() { return snapshot; }
    public StepOp.Op op() { return op; }

    @Override
    public String toString() {
        return description + " " + snapshot;
    }
}
