package com.hkmatrix.core.rational;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Objects;

/** Immutable arbitrary-precision rational with normalized sign and gcd reduction. */
public final class Rational implements Comparable<Rational> {
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
    public static final Rational ONE  = new Rational(BigInteger.ONE,  BigInteger.ONE);
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    // 40 digits before the single rounding to double
    private static final MathContext TO_DOUBLE = new MathContext(40);

    private final BigInteger n;        // numerator
    private final BigInteger d;        // denominator > 0

    /** Creates and reduces; denominator must be nonzero. */
    public Rational(BigInteger num, BigInteger den) {
        Objects.requireNonNull(num, "numerator");
        Objects.requireNonNull(den, "denominator");
        if (den.signum() == 0) throw new ArithmeticException("Zero denominator");
        if (den.signum() < 0) { num = num.negate(); den = den.negate(); }
        BigInteger g = num.gcd(den);
        this.n = num.divide(g);
        this.d = den.divide(g);
    }

    public static Rational of(long k) { return new Rational(BigInteger.valueOf(k), BigInteger.ONE); }
    public static Rational of(long num, long den) { return new Rational(BigInteger.valueOf(num), BigInteger.valueOf(den)); }
    public static Rational of(BigInteger k) { return new Rational(k, BigInteger.ONE); }

    /** Exact value of a decimal: 2.50 -> 5/2. */
    public static Rational of(BigDecimal x) {
        BigInteger unscaled = x.unscaledValue();
        int scale = x.scale();
        if (scale <= 0) return of(unscaled.multiply(BigInteger.TEN.pow(-scale)));
        return new Rational(unscaled, BigInteger.TEN.pow(scale));
    }

    /**
     * Promotes a double through its shortest decimal representation, so 0.1 becomes 1/10
     * rather than the binary fraction the double actually holds.
     */
    public static Rational fromDouble(double x) {
        if (Double.isNaN(x) || Double.isInfinite(x)) {
            throw new ArithmeticException("Not a finite number: " + x);
        }
        return of(BigDecimal.valueOf(x));
    }

    /** Parse "a/b", "a" or a decimal such as "-1.25" (whitespace ok). */
    public static Rational parse(String s) {
        String t = s.trim();
        int slash = t.indexOf('/');
        if (slash < 0) return of(new BigDecimal(t));
        Rational a = of(new BigDecimal(t.substring(0, slash).trim()));
        Rational b = of(new BigDecimal(t.substring(slash + 1).trim()));
        return a.divide(b);
    }

    public BigInteger numerator()   { return n; }
    public BigInteger denominator() { return d; }

    public Rational add(Rational o) {
        if (d.equals(o.d)) return new Rational(n.add(o.n), d);
        return new Rational(n.multiply(o.d).add(o.n.multiply(d)), d.multiply(o.d));
    }

    public Rational subtract(Rational o) {
        return add(o.negate());
    }

    public Rational multiply(Rational o) {
        // cross-cancel to limit growth
        BigInteger g1 = n.gcd(o.d);
        BigInteger g2 = d.gcd(o.n);
        BigInteger a = n.divide(g1);
        BigInteger b = o.n.divide(g2);
        BigInteger c = d.divide(g2);
        BigInteger e = o.d.divide(g1);
        return new Rational(a.multiply(b), c.multiply(e));
    }

    public Rational divide(Rational o) {
        if (o.n.signum() == 0) throw new ArithmeticException("Divide by zero");
        return multiply(o.reciprocal());
    }

    public Rational reciprocal() {
        if (n.signum() == 0) throw new ArithmeticException("Zero has no reciprocal");
        return new Rational(d, n);
    }

    public Rational negate() { return n.signum() == 0 ? ZERO : new Rational(n.negate(), d); }
    public Rational abs()    { return n.signum() < 0 ? negate() : this; }
    public int signum()      { return n.signum(); }
    public boolean isZero()  { return n.signum() == 0; }
    public boolean isOne()   { return n.equals(BigInteger.ONE) && d.equals(BigInteger.ONE); }
    public boolean isInteger() { return d.equals(BigInteger.ONE); }

    public double doubleValue() {
        if (isInteger()) return n.doubleValue();
        return new BigDecimal(n).divide(new BigDecimal(d), TO_DOUBLE).doubleValue();
    }

    @Override public int compareTo(Rational o) {
        // a/b ? c/d  <=>  ad ? cb
        return n.multiply(o.d).compareTo(o.n.multiply(d));
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rational)) return false;
        Rational o = (Rational) obj;
        return n.equals(o.n) && d.equals(o.d);
    }

    @Override public int hashCode() { return n.hashCode() * 31 + d.hashCode(); }

    /** Integers print as integers, everything else as n/d. */
    @Override public String toString() {
        return d.equals(BigInteger.ONE) ? n.toString() : n + "/" + d;
    }
}
