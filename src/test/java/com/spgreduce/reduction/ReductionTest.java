package com.spgreduce.reduction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.spgreduce.Games;
import com.spgreduce.model.SimpleStochasticGame;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.numeric.Arithmetic;
import com.spgreduce.numeric.NumericMode;
import com.spgreduce.numeric.Rational;
import com.spgreduce.solver.ReachabilityBounds;
import com.spgreduce.solver.ValueIterationSolver;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ReductionTest {
  private static final double TOLERANCE = 1.0e-6;

  private final ValueIterationSolver solver = new ValueIterationSolver();

  @ParameterizedTest
  @CsvSource({"1, 0.5", "3, 0.5", "2, 0.75", "3, 0.75", "4, 0.6"})
  public void chainIsWonAlmostSurely(int length, double probability) {
    StochasticParityGame<Double> chain = Games.chain(length, probability, Arithmetic.floating());
    SimpleStochasticGame<Double> reduced = new Reduction().reduce(chain, Rational.of(1, 2));
    assertEquals(2 * (length + 1) + 2, reduced.vertexCount());

    ReachabilityBounds bounds = solver.solve(reduced);
    assertEquals(1.0, bounds.minimum(), TOLERANCE);
    assertEquals(1.0, bounds.maximum(), TOLERANCE);
  }

  @Test
  public void mutexIsLostAlmostSurely() {
    StochasticParityGame<Double> mutex = Games.mutex(Arithmetic.floating());
    SimpleStochasticGame<Double> reduced = new Reduction().reduce(mutex, Rational.of(1, 2));
    assertEquals(40, reduced.vertexCount());
    assertEquals(44, reduced.transitionCount());

    ReachabilityBounds bounds = solver.solve(reduced);
    assertEquals(0.0, bounds.minimum(), TOLERANCE);
    assertEquals(0.0, bounds.maximum(), TOLERANCE);
  }

  @Test
  public void configuredEpsilonIsUsedByDefault() {
    StochasticParityGame<Rational> coin = Games.coin(Arithmetic.exact(), Rational.of(1, 2));
    Reduction reduction = new Reduction(ReductionSettings.defaults().withEpsilon(Rational.ONE));
    assertEquals(reduction.computeAlphas(coin, Rational.ONE), reduction.computeAlphas(coin));
    assertEquals(Rational.of(1, 24), reduction.computeAlphas(coin).get(0));

    SimpleStochasticGame<Rational> reduced = reduction.reduce(coin);
    assertEquals(Rational.of(1, 24), reduced.transition(2, SpgToSsgTransformer.ALPHA_ACTION).orElseThrow()
        .distribution().branches().get(0).probability());
  }

  @Test
  public void soundExactReductionConservesProbability() {
    StochasticParityGame<Rational> mutex = Games.mutex(Arithmetic.exact());
    SimpleStochasticGame<Rational> reduced = new Reduction().reduce(mutex);
    assertEquals(40, reduced.vertexCount());
    reduced.transitions().forEach(transition ->
        assertEquals(Rational.ONE, transition.distribution().sum(Arithmetic.exact())));
    reduced.transitions()
        .flatMap(transition -> transition.distribution().probabilities())
        .forEach(probability -> assertTrue(probability.signum() > 0));
  }

  @Test
  public void settingsDefaults() {
    ReductionSettings settings = ReductionSettings.fromProperties(new Properties());
    assertEquals(ReductionSettings.defaults(), settings);
    assertEquals(NumericMode.FLOATING, settings.numericMode());
    assertEquals(10_000L, settings.denominatorCap());
    assertNull(settings.epsilon());
    assertFalse(settings.printAlphas());
    assertTrue(settings.rejectDeadlocks());
  }

  @Test
  public void settingsFromProperties() {
    Properties properties = new Properties();
    properties.setProperty("spgreduce.numeric-mode", "exact");
    properties.setProperty("spgreduce.denominator-cap", "100");
    properties.setProperty("spgreduce.epsilon", "1/2");
    properties.setProperty("spgreduce.print-alphas", "true");
    properties.setProperty("spgreduce.sound-vertex-limit", " 8 ");
    properties.setProperty("spgreduce.name-attempts", "5");
    properties.setProperty("spgreduce.reject-deadlocks", "false");

    ReductionSettings settings = ReductionSettings.fromProperties(properties);
    assertEquals(NumericMode.EXACT, settings.numericMode());
    assertEquals(100L, settings.denominatorCap());
    assertEquals(Rational.of(1, 2), settings.epsilon());
    assertTrue(settings.printAlphas());
    assertEquals(8, settings.soundModeVertexLimit());
    assertEquals(5, settings.nameAttempts());
    assertFalse(settings.rejectDeadlocks());
    assertEquals(ReductionSettings.DEFAULT_DIAGNOSTIC_DENOMINATOR, settings.diagnosticDenominator());
  }

  @Test
  public void invalidSettingsAreRejected() {
    ReductionSettings defaults = ReductionSettings.defaults();
    assertThrows(IllegalArgumentException.class, () -> defaults.withEpsilon(Rational.of(4)));
    assertThrows(IllegalArgumentException.class, () -> defaults.withEpsilon(Rational.ZERO));
    assertThrows(IllegalArgumentException.class, () -> defaults.withDenominatorCap(0));
    assertThrows(IllegalArgumentException.class, () -> defaults.withNameAttempts(0));

    Properties properties = new Properties();
    properties.setProperty("spgreduce.numeric-mode", "decimal");
    assertThrows(IllegalArgumentException.class, () -> ReductionSettings.fromProperties(properties));
  }
}
