import com.hkmatrix.core.engine.ElementwiseEngine;
import com.hkmatrix.core.engine.TransposeEngine;
import com.hkmatrix.core.engine.ValidationError;
import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ElementwiseEngineTest {

    private static final RationalMatrix A = RationalMatrix.ofLongs(new long[][] { { 1, 2 }, { 3, 4 } });
    private static final RationalMatrix B = RationalMatrix.ofLongs(new long[][] { { 5, 6 }, { 7, 8 } });

    @Test
    void add_logs_one_step_per_cell() {
        StepLog log = ElementwiseEngine.add(A, B);

        assertEquals(6, log.size());
        assertEquals("Initial result matrix (zeros)", log.first().description());
        assertEquals(RationalMatrix.zeros(2, 2), log.first().snapshot());
        assertEquals("Compute C[1,1] = 1 + 5 = 6", log.get(1).description());
        assertEquals("Compute C[2,2] = 4 + 8 = 12", log.get(4).description());
        assertEquals("Sum complete A + B", log.last().description());
        assertEquals(RationalMatrix.ofLongs(new long[][] { { 6, 8 }, { 10, 12 } }), log.finalMatrix());
    }

    @Test
    void cell_steps_fill_in_row_major_order() {
        StepLog log = ElementwiseEngine.add(A, B);
        RationalMatrix afterFirst = log.get(1).snapshot();
        assertEquals(Rational.of(6), afterFirst.get(0, 0));
        assertTrue(afterFirst.get(0, 1).isZero());

        StepOp.Cell cell = (StepOp.Cell) log.get(2).op();
        assertEquals(0, cell.row);
        assertEquals(1, cell.col);
        assertEquals(Rational.of(8), cell.value);
    }

    @Test
    void each_intermediate_step_changes_exactly_its_cell() {
        StepLog log = ElementwiseEngine.add(A, B);
        for (int k = 1; k < log.size() - 1; k++) {
            RationalMatrix before = log.get(k - 1).snapshot();
            RationalMatrix after = log.get(k).snapshot();
            StepOp.Cell cell = (StepOp.Cell) log.get(k).op();
            assertEquals((k - 1) / 2, cell.row);
            assertEquals((k - 1) % 2, cell.col);
            for (int i = 0; i < 2; i++) {
                for (int j = 0; j < 2; j++) {
                    if (i == cell.row && j == cell.col) {
                        assertEquals(cell.value, after.get(i, j));
                    } else {
                        assertEquals(before.get(i, j), after.get(i, j));
                    }
                }
            }
        }
    }

    @Test
    void subtract_wraps_negative_operands() {
        RationalMatrix x = RationalMatrix.ofLongs(new long[][] { { 1 } });
        RationalMatrix y = RationalMatrix.ofLongs(new long[][] { { -2 } });
        StepLog log = ElementwiseEngine.subtract(x, y);

        assertEquals("Compute C[1,1] = 1 - (-2) = 3", log.get(1).description());
        assertEquals("Difference complete A - B", log.last().description());
        assertEquals(RationalMatrix.ofLongs(new long[][] { { 3 } }), log.finalMatrix());
    }

    @Test
    void subtract_scenario() {
        StepLog log = ElementwiseEngine.subtract(B, A);
        assertEquals(RationalMatrix.ofLongs(new long[][] { { 4, 4 }, { 4, 4 } }), log.finalMatrix());
    }

    @Test
    void multiply_lists_every_term() {
        StepLog log = ElementwiseEngine.multiply(A, B);

        assertEquals("Compute C[1,1] = 1*5 + 2*7 = 19", log.get(1).description());
        assertEquals("Product complete A·B", log.last().description());
        assertEquals(RationalMatrix.ofLongs(new long[][] { { 19, 22 }, { 43, 50 } }), log.finalMatrix());
    }

    @Test
    void multiply_non_square_shapes() {
        RationalMatrix row = RationalMatrix.ofLongs(new long[][] { { 1, 2, 3 } });
        RationalMatrix column = RationalMatrix.ofLongs(new long[][] { { 4 }, { -5 }, { 6 } });
        StepLog log = ElementwiseEngine.multiply(row, column);

        assertEquals(3, log.size());
        assertEquals("Compute C[1,1] = 1*4 + 2*(-5) + 3*6 = 12", log.get(1).description());
        assertEquals(3, ElementwiseEngine.multiply(column, row).finalMatrix().rows());
    }

    @Test
    void shape_mismatch_is_rejected() {
        RationalMatrix wide = RationalMatrix.ofLongs(new long[][] { { 1, 2, 3 } });
        assertThrows(ValidationError.class, () -> ElementwiseEngine.add(A, wide));
        assertThrows(ValidationError.class, () -> ElementwiseEngine.subtract(A, wide));
        assertThrows(ValidationError.class, () -> ElementwiseEngine.multiply(A, wide));
    }

    @Test
    void transpose_has_two_steps() {
        RationalMatrix a = RationalMatrix.ofLongs(new long[][] { { 1, 2, 3 } });
        StepLog log = TransposeEngine.transpose(a);

        assertEquals(2, log.size());
        assertEquals("Original matrix A", log.first().description());
        assertEquals("Transpose: A^T (rows <-> columns)", log.last().description());
        assertEquals(RationalMatrix.ofLongs(new long[][] { { 1 }, { 2 }, { 3 } }), log.finalMatrix());
    }
}
