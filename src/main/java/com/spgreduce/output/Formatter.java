package com.spgreduce.output;

import com.spgreduce.numeric.NumericMode;
import com.spgreduce.numeric.Rational;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class Formatter {
  private Formatter() {}

  /**
   * One line per priority with the alpha as double and, for exact arithmetic, the closest rational
   * with denominator at most {@code maxDenominator}.
   */
  public static String formatAlphas(Map<Integer, Rational> alphas, NumericMode mode, long maxDenominator) {
    return new TreeMap<>(alphas).entrySet().stream()
        .map(entry -> formatAlpha(entry.getKey(), entry.getValue(), mode, maxDenominator))
        .collect(Collectors.joining("\n", "Computed alphas:\n", ""));
  }

  public static String formatAlpha(int priority, Rational alpha, NumericMode mode, long maxDenominator) {
    String line = "Priority %d: %s".formatted(priority, alpha.doubleValue());
    return mode == NumericMode.EXACT
        ? line + " | Optimized to " + alpha.limitDenominator(maxDenominator)
        : line;
  }
}
