package com.hkmatrix.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;

import com.hkmatrix.core.format.NumberFormatter;
import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.Step;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;

/**
 * JSON rendering of a step trace for viewers outside the JVM.
 *
 * Shape:
 * {
 *   "steps": [
 *     { "index": 0, "description": "...", "op": { "kind": "swap", "rows": [1, 0] },
 *       "rows": 2, "cols": 2, "matrix": [["1", "1/2"], ...], "display": "[[1, 0.5]\n ...]" }
 *   ]
 * }
 *
 * Rationals are exact strings ("n" or "n/d"). Indices inside "op" are 0-based.
 */
public final class StepLogJson {

    private static final ObjectMapper om = new ObjectMapper();

    private StepLogJson() {}

    public static ObjectNode toJson(StepLog log, int precision) {
        ObjectNode root = om.createObjectNode();
        ArrayNode steps = root.putArray("steps");
        int index = 0;
        for (Step s : log) {
            ObjectNode n = steps.addObject();
            n.put("index", index++);
            n.put("description", s.description());
            n.set("op", s.op().accept(new OpWriter()));
            RationalMatrix m = s.snapshot();
            n.put("rows", m.rows());
            n.put("cols", m.cols());
            n.set("matrix", matrix(m));
            n.put("display", NumberFormatter.fmtMatrix(m, precision));
        }
        return root;
    }

    public static String write(StepLog log, int precision) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(log, precision));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("StepLogJson: failed to serialize trace", e);
        }
    }

    public static ArrayNode matrix(RationalMatrix m) {
        ArrayNode rows = om.createArrayNode();
        for (int r = 0; r < m.rows(); r++) {
            ArrayNode row = rows.addArray();
            for (int c = 0; c < m.cols(); c++) row.add(m.get(r, c).toString());
        }
        return rows;
    }

    private static final class OpWriter implements StepOp.Visitor<ObjectNode> {

        private ObjectNode kind(StepOp.Op op) {
            ObjectNode n = om.createObjectNode();
            n.put("kind", op.kind().name().toLowerCase(Locale.ROOT));
            return n;
        }

        private static String exact(Rational x) {
            return x.toString();
        }

        @Override public ObjectNode visitInitial(StepOp.Initial op) { return kind(op); }
        @Override public ObjectNode visitNote(StepOp.Note op) { return kind(op); }
        @Override public ObjectNode visitDone(StepOp.Done op) { return kind(op); }

        @Override
        public ObjectNode visitSwap(StepOp.Swap op) {
            ObjectNode n = kind(op);
            n.putArray("rows").add(op.first).add(op.second);
            return n;
        }

        @Override
        public ObjectNode visitScale(StepOp.Scale op) {
            ObjectNode n = kind(op);
            n.put("row", op.row);
            n.put("divisor", exact(op.divisor));
            return n;
        }

        @Override
        public ObjectNode visitCombine(StepOp.Combine op) {
            ObjectNode n = kind(op);
            n.put("target", op.target);
            n.put("source", op.source);
            n.put("factor", exact(op.factor));
            return n;
        }

        @Override
        public ObjectNode visitCell(StepOp.Cell op) {
            ObjectNode n = kind(op);
            n.put("row", op.row);
            n.put("col", op.col);
            n.put("value", exact(op.value));
            return n;
        }

        @Override
        public ObjectNode visitSubstitute(StepOp.Substitute op) {
            ObjectNode n = kind(op);
            n.put("column", op.column);
            return n;
        }
    }
}
