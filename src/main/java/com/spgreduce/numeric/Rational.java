package com.spgreduce.numeric;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Arbitrary precision rational number, always kept in lowest terms with a positive denominator.
 */
public final class Rational extends Number implements Comparable<Rational> {
  private static final long serialVersionUID = 1L;

  public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE);
  public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);

  private final BigInteger numerator;
  private final BigInteger denominator;

  private Rational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static Rational of(BigInteger numerator, BigInteger denominator) {
    checkArgument(denominator.signum() != 0, "Zero denominator");
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new Rational(numerator, denominator);
  }

  public static Rational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  public static Rational of(long value) {
    return new Rational(BigInteger.valueOf(value), BigInteger.ONE);
  }

  public static Rational of(BigInteger value) {
    return new Rational(value, BigInteger.ONE);
  }

  /**
   * Returns the exact value of the given double, i.e. the binary fraction it represents, without
   * any decimal rounding.
   */
  public static Rational valueOf(double value) {
    checkArgument(Double.isFinite(value), "Not a finite value: %s", value);
    return valueOf(new BigDecimal(value));
  }

  public static Rational valueOf(BigDecimal value) {
    if (value.scale() <= 0) {
      return of(value.toBigIntegerExact());
    }
    return of(value.unscaledValue(), BigInteger.TEN.pow(value.scale()));
  }

  /**
   * Parses either a fraction {@code a/b} or a decimal number.
   */
  public static Rational parse(String string) {
    String trimmed = string.trim();
    int slash = trimmed.indexOf('/');
    try {
      if (slash < 0) {
        return valueOf(new BigDecimal(trimmed));
      }
      return of(new BigInteger(trimmed.substring(0, slash).trim()),
          new BigInteger(trimmed.substring(slash + 1).trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid rational " + string, e);
    }
  }

  public BigInteger numerator() {
    return numerator;
  }

  public BigInteger denominator() {
    return denominator;
  }

  public int signum() {
    return numerator.signum();
  }

  public boolean isZero() {
    return numerator.signum() == 0;
  }

  public boolean isOne() {
    return numerator.equals(denominator);
  }

  public Rational add(Rational other) {
    if (denominator.equals(other.denominator)) {
      return of(numerator.add(other.numerator), denominator);
    }
    return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
        denominator.multiply(other.denominator));
  }

  public Rational add(long value) {
    return add(of(value));
  }

  public Rational subtract(Rational other) {
    return add(other.negate());
  }

  public Rational multiply(Rational other) {
    return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
  }

  public Rational multiply(long factor) {
    return of(numerator.multiply(BigInteger.valueOf(factor)), denominator);
  }

  public Rational divide(Rational other) {
    checkArgument(!other.isZero(), "Division by zero");
    return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
  }

  public Rational negate() {
    return new Rational(numerator.negate(), denominator);
  }

  public Rational pow(int exponent) {
    checkArgument(exponent >= 0, "Negative exponent %s", exponent);
    return new Rational(numerator.pow(exponent), denominator.pow(exponent));
  }

  /**
   * Closest rational whose denominator does not exceed {@code maxDenominator}, found by walking the
   * continued fraction expansion and comparing the last convergent with the best semiconvergent.
   */
  public Rational limitDenominator(long maxDenominator) {
    checkArgument(maxDenominator >= 1, "Maximal denominator must be at least 1");
    BigInteger max = BigInteger.valueOf(maxDenominator);
    if (denominator.compareTo(max) <= 0) {
      return this;
    }
    // Positive values up to 1 / (2 max) are at least as close to 0 as to 1 / max
    if (numerator.signum() > 0 && numerator.multiply(max).shiftLeft(1).compareTo(denominator) <= 0) {
      return ZERO;
    }

    BigInteger p0 = BigInteger.ZERO;
    BigInteger q0 = BigInteger.ONE;
    BigInteger p1 = BigInteger.ONE;
    BigInteger q1 = BigInteger.ZERO;
    BigInteger n = numerator;
    BigInteger d = denominator;
    while (true) {
      BigInteger a = floorDivide(n, d);
      BigInteger q2 = q0.add(a.multiply(q1));
      if (q2.compareTo(max) > 0) {
        break;
      }
      BigInteger p2 = p0.add(a.multiply(p1));
      p0 = p1;
      q0 = q1;
      p1 = p2;
      q1 = q2;
      BigInteger remainder = n.subtract(a.multiply(d));
      n = d;
      d = remainder;
    }

    BigInteger k = max.subtract(q0).divide(q1);
    BigInteger semiNumerator = p0.add(k.multiply(p1));
    BigInteger semiDenominator = q0.add(k.multiply(q1));
    // |p1/q1 - x| <= |ps/qs - x| without normalizing the differences
    BigInteger convergentError = p1.multiply(denominator).subtract(q1.multiply(numerator)).abs()
        .multiply(semiDenominator);
    BigInteger semiconvergentError = semiNumerator.multiply(denominator).subtract(semiDenominator.multiply(numerator))
        .abs().multiply(q1);
    return convergentError.compareTo(semiconvergentError) <= 0
        ? of(p1, q1)
        : of(semiNumerator, semiDenominator);
  }

  public Rational abs() {
    return numerator.signum() < 0 ? negate() : this;
  }

  private static BigInteger floorDivide(BigInteger n, BigInteger d) {
    BigInteger[] division = n.divideAndRemainder(d);
    if (division[1].signum() != 0 && (division[1].signum() != d.signum())) {
      return division[0].subtract(BigInteger.ONE);
    }
    return division[0];
  }

  @Override
  public int compareTo(Rational o) {
    return numerator.multiply(o.denominator).compareTo(o.numerator.multiply(denominator));
  }

  @Override
  public double doubleValue() {
    // Numerator and denominator may both exceed the double range. The quotient is computed to 65
    // bits plus a sticky bit for the remainder, which keeps the final rounding correct.
    if (numerator.signum() == 0) {
      return 0.0;
    }
    BigInteger magnitude = numerator.abs();
    int shift = denominator.bitLength() - magnitude.bitLength() + 65;
    BigInteger[] division = shift >= 0
        ? magnitude.shiftLeft(shift).divideAndRemainder(denominator)
        : magnitude.divideAndRemainder(denominator.shiftLeft(-shift));
    BigInteger quotient = division[0];
    if (division[1].signum() != 0) {
      quotient = quotient.shiftLeft(1).setBit(0);
      shift += 1;
    }
    double value = Math.scalb(quotient.doubleValue(), -shift);
    return numerator.signum() < 0 ? -value : value;
  }

  @Override
  public float floatValue() {
    return (float) doubleValue();
  }

  @Override
  public int intValue() {
    return numerator.divide(denominator).intValue();
  }

  @Override
  public long longValue() {
    return numerator.divide(denominator).longValue();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Rational that
        && numerator.equals(that.numerator) && denominator.equals(that.denominator));
  }

  @Override
  public int hashCode() {
    return 31 * numerator.hashCode() + denominator.hashCode();
  }

  @Override
  public String toString() {
    return denominator.equals(BigInteger.ONE) ? numerator.toString() : numerator + "/" + denominator;
  }
}
