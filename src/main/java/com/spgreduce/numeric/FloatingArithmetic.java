package com.spgreduce.numeric;

final class FloatingArithmetic implements Arithmetic<Double> {
  static final FloatingArithmetic INSTANCE = new FloatingArithmetic();
  static final double TOLERANCE = 1.0e-9;

  private FloatingArithmetic() {}

  @Override
  public NumericMode mode() {
    return NumericMode.FLOATING;
  }

  @Override
  public Double zero() {
    return 0.0;
  }

  @Override
  public Double one() {
    return 1.0;
  }

  @Override
  public Double add(Double first, Double second) {
    return first + second;
  }

  @Override
  public Double subtract(Double first, Double second) {
    return first - second;
  }

  @Override
  public Double multiply(Double first, Double second) {
    return first * second;
  }

  @Override
  public int compare(Double first, Double second) {
    return Double.compare(first, second);
  }

  @Override
  public boolean isOne(Double value) {
    return Math.abs(value - 1.0) <= TOLERANCE;
  }

  @Override
  public Double fromRational(Rational value) {
    return value.doubleValue();
  }

  @Override
  public Rational toRational(Double value) {
    return Rational.valueOf(value);
  }

  @Override
  public double toDouble(Double value) {
    return value;
  }

  @Override
  public Double parse(String string) {
    String trimmed = string.trim();
    return trimmed.indexOf('/') < 0 ? Double.parseDouble(trimmed) : Rational.parse(trimmed).doubleValue();
  }

  @Override
  public String toString() {
    return "floating";
  }
}
