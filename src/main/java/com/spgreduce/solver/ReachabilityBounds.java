package com.spgreduce.solver;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Probability of reaching the target from the initial vertex, when Eve minimizes and when she
 * maximizes it.
 */
public record ReachabilityBounds(double minimum, double maximum) {
  public ReachabilityBounds {
    checkArgument(0.0 <= minimum && minimum <= maximum && maximum <= 1.0,
        "Invalid bounds [%s, %s]", minimum, maximum);
  }
}
