package com.spgreduce.numeric;

public enum NumericMode {
  EXACT, FLOATING;

  public Arithmetic<?> arithmetic() {
    return switch (this) {
      case EXACT -> Arithmetic.exact();
      case FLOATING -> Arithmetic.floating();
    };
  }

  public static NumericMode parse(String string) {
    return switch (string.trim().toLowerCase()) {
      case "exact", "rational" -> EXACT;
      case "floating", "float", "double" -> FLOATING;
      default -> throw new IllegalArgumentException("Unsupported numeric mode " + string);
    };
  }
}
