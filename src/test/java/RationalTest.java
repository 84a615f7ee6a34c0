import com.hkmatrix.core.rational.Rational;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RationalTest {

    @Test
    void construction_reduces_and_normalizes_sign() {
        Rational r = Rational.of(6, -4);
        assertEquals(BigInteger.valueOf(-3), r.numerator());
        assertEquals(BigInteger.valueOf(2), r.denominator());
        assertEquals("-3/2", r.toString());
        assertEquals(Rational.ZERO, Rational.of(0, -7));
        assertEquals("0", Rational.of(0, 5).toString());
    }

    @Test
    void zero_denominator_is_rejected() {
        assertThrows(ArithmeticException.class, () -> Rational.of(1, 0));
        assertThrows(ArithmeticException.class, () -> Rational.ONE.divide(Rational.ZERO));
        assertThrows(ArithmeticException.class, () -> Rational.ZERO.reciprocal());
    }

    @Test
    void arithmetic_is_exact() {
        Rational third = Rational.of(1, 3);
        Rational sixth = Rational.of(1, 6);
        assertEquals(Rational.of(1, 2), third.add(sixth));
        assertEquals(Rational.of(1, 6), third.subtract(sixth));
        assertEquals(Rational.of(1, 18), third.multiply(sixth));
        assertEquals(Rational.of(2), third.divide(sixth));
        assertEquals(Rational.of(-1, 3), third.negate());
        assertEquals(third, third.negate().abs());
        assertEquals(Rational.of(3), third.reciprocal());
    }

    @Test
    void three_times_one_third_is_exactly_one() {
        Rational sum = Rational.ZERO;
        for (int i = 0; i < 3; i++) sum = sum.add(Rational.of(1, 3));
        assertTrue(sum.isOne());
        assertTrue(sum.isInteger());
    }

    @Test
    void fromDouble_uses_shortest_decimal() {
        assertEquals(Rational.of(1, 10), Rational.fromDouble(0.1));
        assertEquals(Rational.of(-5, 4), Rational.fromDouble(-1.25));
        assertEquals(Rational.of(3), Rational.fromDouble(3.0));
        assertEquals(Rational.of(1500), Rational.fromDouble(1.5e3));
    }

    @Test
    void fromDouble_rejects_non_finite() {
        assertThrows(ArithmeticException.class, () -> Rational.fromDouble(Double.NaN));
        assertThrows(ArithmeticException.class, () -> Rational.fromDouble(Double.POSITIVE_INFINITY));
    }

    @Test
    void parse_accepts_fractions_and_decimals() {
        assertEquals(Rational.of(3, 4), Rational.parse("3/4"));
        assertEquals(Rational.of(-1, 2), Rational.parse(" 2 / -4 "));
        assertEquals(Rational.of(-5, 4), Rational.parse("-1.25"));
        assertEquals(Rational.of(7), Rational.parse("7"));
        assertEquals(Rational.of(5, 2), Rational.of(new BigDecimal("2.50")));
        assertThrows(NumberFormatException.class, () -> Rational.parse("abc"));
    }

    @Test
    void comparison_and_signum() {
        assertTrue(Rational.of(1, 3).compareTo(Rational.of(1, 2)) < 0);
        assertTrue(Rational.of(-1, 2).compareTo(Rational.of(-2, 3)) > 0);
        assertEquals(0, Rational.of(2, 4).compareTo(Rational.of(1, 2)));
        assertEquals(-1, Rational.MINUS_ONE.signum());
        assertTrue(Rational.ZERO.isZero());
        assertEquals(Rational.of(2, 4).hashCode(), Rational.of(1, 2).hashCode());
    }

    @Test
    void doubleValue_approximates() {
        assertEquals(0.3333333333333333, Rational.of(1, 3).doubleValue(), 1e-15);
        assertEquals(-2.0, Rational.of(-2).doubleValue(), 0.0);
    }

    @Test
    void doubleValue_is_the_nearest_double() {
        // 16 significant digits would round 2/3 up to the next double
        assertEquals(2.0 / 3.0, Rational.of(2, 3).doubleValue(), 0.0);
        assertEquals(1.0 / 3.0, Rational.of(1, 3).doubleValue(), 0.0);
        assertEquals(-22.0 / 7.0, Rational.of(-22, 7).doubleValue(), 0.0);
        assertEquals(0.1, Rational.of(1, 10).doubleValue(), 0.0);
    }
}
