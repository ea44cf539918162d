package com.spgreduce.solver;

import com.spgreduce.model.SimpleStochasticGame;

/**
 * Computes the value of a simple stochastic game, typically by handing it to an external model
 * checker.
 */
public interface ReachabilitySolver {
  <P> ReachabilityBounds solve(SimpleStochasticGame<P> game);
}
