import com.hkmatrix.core.engine.DeterminantEngine;
import com.hkmatrix.core.engine.DeterminantResult;
import com.hkmatrix.core.engine.MatrixGenerator;
import com.hkmatrix.core.engine.ValidationError;
import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.StepOp;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class DeterminantEngineTest {

    // Laplace expansion along the first row
    private static Rational cofactorDet(RationalMatrix a) {
        int n = a.rows();
        if (n == 1) return a.get(0, 0);
        Rational sum = Rational.ZERO;
        for (int j = 0; j < n; j++) {
            Rational[][] minor = new Rational[n - 1][n - 1];
            for (int r = 1; r < n; r++) {
                int k = 0;
                for (int c = 0; c < n; c++) {
                    if (c == j) continue;
                    minor[r - 1][k++] = a.get(r, c);
                }
            }
            Rational term = a.get(0, j).multiply(cofactorDet(RationalMatrix.of(minor)));
            sum = (j % 2 == 0) ? sum.add(term) : sum.subtract(term);
        }
        return sum;
    }

    @Test
    void matches_cofactor_expansion_up_to_4x4() {
        Random random = new Random(42);
        for (int n = 1; n <= 4; n++) {
            for (int i = 0; i < 25; i++) {
                RationalMatrix a = MatrixGenerator.randomIntegers(n, n, -4, 4, random);
                DeterminantResult d = DeterminantEngine.determinant(a);
                assertTrue(d.isDefined());
                assertEquals(cofactorDet(a), d.value(), "det of " + a);
            }
        }
    }

    @Test
    void fractional_entries_stay_exact() {
        RationalMatrix a = RationalMatrix.fromDoubles(new double[][] { { 0.5, 0.25 }, { 0.1, 3 } });
        // 1/2 * 3 - 1/4 * 1/10
        assertEquals(Rational.of(59, 40), DeterminantEngine.determinant(a).value());
    }

    @Test
    void swap_flips_sign_and_is_described() {
        DeterminantResult d = DeterminantEngine.determinant(RationalMatrix.ofLongs(new long[][] { { 0, 1 }, { 1, 0 } }));

        assertEquals(Rational.MINUS_ONE, d.value());
        assertEquals(1, d.swaps());
        assertEquals("Swap rows 2<->1 (flips the sign of the determinant)", d.steps().get(1).description());
        assertEquals("Determinant = product of diagonal * (-1)^swaps = -1", d.steps().last().description());
    }

    @Test
    void elimination_steps_are_labelled() {
        DeterminantResult d = DeterminantEngine.determinant(RationalMatrix.ofLongs(new long[][] { { 2, 1 }, { 1, 1 } }));

        assertEquals(Rational.ONE, d.value());
        assertEquals("Eliminate below pivot: R2 <- R2 - (1/2)*R1", d.steps().get(1).description());
        assertEquals(0, d.steps().count(StepOp.Kind.SCALE));
    }

    @Test
    void singular_matrix_has_zero_determinant() {
        DeterminantResult d = DeterminantEngine.determinant(RationalMatrix.ofLongs(new long[][] { { 1, 2 }, { 2, 4 } }));
        assertTrue(d.isDefined());
        assertTrue(d.value().isZero());
    }

    @Test
    void non_square_is_logged_not_thrown() {
        RationalMatrix a = RationalMatrix.ofLongs(new long[][] { { 1, 2, 3 }, { 4, 5, 6 } });
        DeterminantResult d = DeterminantEngine.determinant(a);

        assertFalse(d.isDefined());
        assertNull(d.value());
        assertEquals(2, d.steps().size());
        assertEquals("Not square: determinant undefined", d.steps().last().description());
        assertEquals(StepOp.Kind.NOTE, d.steps().last().op().kind());

        assertThrows(ValidationError.class, () -> DeterminantEngine.value(a));
    }

    @Test
    void identity_has_determinant_one_without_operations() {
        DeterminantResult d = DeterminantEngine.determinant(RationalMatrix.identity(4));
        assertEquals(Rational.ONE, d.value());
        assertEquals(2, d.steps().size());
    }
}
