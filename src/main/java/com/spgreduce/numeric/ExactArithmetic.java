package com.spgreduce.numeric;

final class ExactArithmetic implements Arithmetic<Rational> {
  static final ExactArithmetic INSTANCE = new ExactArithmetic();

  private ExactArithmetic() {}

  @Override
  public NumericMode mode() {
    return NumericMode.EXACT;
  }

  @Override
  public Rational zero() {
    return Rational.ZERO;
  }

  @Override
  public Rational one() {
    return Rational.ONE;
  }

  @Override
  public Rational add(Rational first, Rational second) {
    return first.add(second);
  }

  @Override
  public Rational subtract(Rational first, Rational second) {
    return first.subtract(second);
  }

  @Override
  public Rational multiply(Rational first, Rational second) {
    return first.multiply(second);
  }

  @Override
  public int compare(Rational first, Rational second) {
    return first.compareTo(second);
  }

  @Override
  public boolean isOne(Rational value) {
    return value.isOne();
  }

  @Override
  public Rational fromRational(Rational value) {
    return value;
  }

  @Override
  public Rational toRational(Rational value) {
    return value;
  }

  @Override
  public double toDouble(Rational value) {
    return value.doubleValue();
  }

  @Override
  public Rational parse(String string) {
    return Rational.parse(string);
  }

  @Override
  public String toString() {
    return "exact";
  }
}
