package com.spgreduce.reduction;

import com.google.common.math.BigIntegerMath;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.numeric.Arithmetic;
import com.spgreduce.numeric.Rational;
import com.spgreduce.output.Formatter;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Derives the threshold probability ("alpha") of every priority of a game. The alpha of the smallest
 * priority is derived from the minimal transition probability and the size of the game, every
 * further priority gets the alpha of its predecessor in ascending order multiplied by a fixed ratio.
 *
 * <p>Without epsilon, the bounds are chosen such that the reachability value of the reduced game is
 * provably close to the parity value. With epsilon, the bounds only depend on epsilon and the
 * minimal probability, which keeps the numbers manageable for larger games.</p>
 *
 * <p>All intermediate computations are exact; the result is converted to the arithmetic of the game
 * at the very end.</p>
 */
public final class AlphaCalculator {
  private static final Logger log = Logger.getLogger(AlphaCalculator.class.getName());

  private static final Rational FOUR = Rational.of(4);
  private static final Rational EIGHT = Rational.of(8);

  private final ReductionSettings settings;

  public AlphaCalculator(ReductionSettings settings) {
    this.settings = settings;
  }

  public <P> Alphas<P> computeAlphas(StochasticParityGame<P> game, @Nullable Rational epsilon) {
    if (epsilon != null) {
      ReductionSettings.checkEpsilon(epsilon);
    }
    Arithmetic<P> arithmetic = game.arithmetic();
    Precision<P> precision = PrecisionAnalyzer.analyze(game, settings.denominatorCap());
    int vertices = game.vertexCount();

    Rational delta = arithmetic.toRational(precision.minimumProbability()).limitDenominator(settings.denominatorCap());
    if (delta.isZero()) {
      throw new NumericDomainException(("Minimal probability %s of %s rounds to zero with denominators up to %d, "
          + "increase the denominator cap").formatted(precision.minimumProbability(), game, settings.denominatorCap()));
    }
    if (delta.isOne()) {
      throw new NumericDomainException("All transitions of %s are deterministic, alphas are undefined"
          .formatted(game));
    }
    Rational deltaPower = delta.pow(vertices);
    Rational oneMinusDelta = Rational.ONE.subtract(delta);

    Rational initial;
    Rational ratio;
    if (epsilon == null) {
      if (vertices > settings.soundModeVertexLimit()) {
        throw new NumericDomainException(("Sound alphas for %d vertices exceed the limit of %d vertices, "
            + "use an epsilon instead").formatted(vertices, settings.soundModeVertexLimit()));
      }
      // 8 * (n!)^2 * M^(2n^2)
      BigInteger denominator = BigIntegerMath.factorial(vertices).pow(2)
          .multiply(BigInteger.valueOf(precision.denominatorBound()).pow(Math.multiplyExact(2 * vertices, vertices)))
          .shiftLeft(3);
      initial = deltaPower.divide(Rational.of(denominator));
      ratio = oneMinusDelta.multiply(deltaPower).divide(Rational.of(denominator.add(BigInteger.ONE)));
    } else {
      Rational fourMinusEpsilon = FOUR.subtract(epsilon);
      initial = FOUR.multiply(epsilon).multiply(deltaPower).divide(fourMinusEpsilon.multiply(EIGHT));
      ratio = oneMinusDelta.multiply(deltaPower)
          .divide(EIGHT.multiply(fourMinusEpsilon).divide(FOUR.multiply(epsilon)).add(1));
    }
    log.log(Level.FINE, () -> "Deriving alphas for %s: delta %s, denominator bound %d, epsilon %s"
        .formatted(game, delta, precision.denominatorBound(), epsilon == null ? "none" : epsilon));

    int[] priorities = game.priorities().toIntArray();
    Map<Integer, Rational> exact = new HashMap<>();
    exact.put(priorities[0], initial);
    Rational previous = initial;
    for (int rank = 1; rank < priorities.length; rank++) {
      int priority = priorities[rank];
      // The decay only depends on the rank, not on the distance between the priorities
      int gap = priority - priorities[rank - 1];
      log.log(Level.FINER, () -> "Priority %d has gap %d to its predecessor".formatted(priority, gap));
      previous = previous.multiply(ratio);
      exact.put(priority, previous);
    }

    Map<Integer, P> alphas = new HashMap<>();
    exact.forEach((priority, alpha) -> {
      P value = arithmetic.fromRational(alpha);
      if (arithmetic.compare(value, arithmetic.zero()) <= 0 || arithmetic.compare(value, arithmetic.one()) >= 0) {
        throw new NumericDomainException("Alpha %s of priority %d is not in (0, 1) under %s arithmetic"
            .formatted(value, priority, arithmetic));
      }
      alphas.put(priority, value);
    });

    Level level = settings.printAlphas() ? Level.INFO : Level.FINE;
    if (log.isLoggable(level)) {
      log.log(level, Formatter.formatAlphas(exact, arithmetic.mode(), settings.diagnosticDenominator()));
    }
    return new Alphas<>(alphas);
  }
}
