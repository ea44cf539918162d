package com.spgreduce.reduction;

import com.google.common.base.Stopwatch;
import com.spgreduce.model.SimpleStochasticGame;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.numeric.Rational;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Entry point of the reduction from stochastic parity games to simple stochastic games. Instances
 * hold no state besides their settings and may be shared between threads.
 */
public final class Reduction {
  private static final Logger log = Logger.getLogger(Reduction.class.getName());

  private final ReductionSettings settings;
  private final AlphaCalculator alphaCalculator;
  private final SpgToSsgTransformer transformer;

  public Reduction(ReductionSettings settings) {
    this.settings = settings;
    this.alphaCalculator = new AlphaCalculator(settings);
    this.transformer = new SpgToSsgTransformer(settings);
  }

  public Reduction() {
    this(ReductionSettings.defaults());
  }

  public ReductionSettings settings() {
    return settings;
  }

  /**
   * Alphas of the game with the configured epsilon.
   */
  public <P> Alphas<P> computeAlphas(StochasticParityGame<P> game) {
    return computeAlphas(game, settings.epsilon());
  }

  /**
   * Alphas of the game, sound if {@code epsilon} is {@code null}.
   */
  public <P> Alphas<P> computeAlphas(StochasticParityGame<P> game, @Nullable Rational epsilon) {
    return alphaCalculator.computeAlphas(game, epsilon);
  }

  public <P> SimpleStochasticGame<P> reduce(StochasticParityGame<P> game) {
    return reduce(game, settings.epsilon());
  }

  public <P> SimpleStochasticGame<P> reduce(StochasticParityGame<P> game, @Nullable Rational epsilon) {
    Stopwatch timer = Stopwatch.createStarted();
    Alphas<P> alphas = alphaCalculator.computeAlphas(game, epsilon);
    SimpleStochasticGame<P> reduced = transformer.transform(game, alphas);
    log.log(Level.INFO, () -> "Reduced %s to %s in %s".formatted(game, reduced, timer));
    return reduced;
  }
}
