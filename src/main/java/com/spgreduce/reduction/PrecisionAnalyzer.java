package com.spgreduce.reduction;

import static com.google.common.base.Preconditions.checkArgument;

import com.spgreduce.model.Distribution;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.numeric.Arithmetic;
import java.util.HashSet;
import java.util.Set;

public final class PrecisionAnalyzer {
  private PrecisionAnalyzer() {}

  public static <P> Precision<P> analyze(StochasticParityGame<P> game) {
    return analyze(game, ReductionSettings.DEFAULT_DENOMINATOR_CAP);
  }

  public static <P> Precision<P> analyze(StochasticParityGame<P> game, long denominatorCap) {
    checkArgument(denominatorCap >= 1, "Denominator cap must be positive, got %s", denominatorCap);
    Arithmetic<P> arithmetic = game.arithmetic();

    Set<P> probabilities = new HashSet<>();
    game.transitions()
        .flatMap(transition -> transition.distribution().stream())
        .map(Distribution.Branch::probability)
        .forEach(probabilities::add);
    if (probabilities.isEmpty()) {
      throw new EmptyGameException("Game %s has no transitions".formatted(game));
    }

    P minimum = probabilities.stream().min(arithmetic).orElseThrow();
    long denominatorBound = probabilities.stream()
        .map(arithmetic::toRational)
        .map(probability -> probability.limitDenominator(denominatorCap))
        .mapToLong(rounded -> rounded.denominator().longValueExact())
        .max()
        .orElseThrow();
    return new Precision<>(minimum, denominatorBound);
  }
}
