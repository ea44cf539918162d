package com.spgreduce.reduction;

import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedSet;

/**
 * Threshold probability per priority, see {@link AlphaCalculator}.
 */
public final class Alphas<P> {
  private final ImmutableSortedMap<Integer, P> alphas;

  public Alphas(Map<Integer, P> alphas) {
    this.alphas = ImmutableSortedMap.copyOf(alphas);
  }

  public P get(int priority) {
    P alpha = alphas.get(priority);
    if (alpha == null) {
      throw new MissingAlphaException(priority);
    }
    return alpha;
  }

  public boolean contains(int priority) {
    return alphas.containsKey(priority);
  }

  public SortedSet<Integer> priorities() {
    return alphas.keySet();
  }

  public NavigableMap<Integer, P> asMap() {
    return alphas;
  }

  public int size() {
    return alphas.size();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Alphas<?> that && alphas.equals(that.alphas));
  }

  @Override
  public int hashCode() {
    return alphas.hashCode();
  }

  @Override
  public String toString() {
    return alphas.toString();
  }
}
