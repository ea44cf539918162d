package com.spgreduce.reduction;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out unique vertex names. A requested name is returned unchanged if it is still free,
 * otherwise the smallest non-negative integer suffix yielding a free name is appended.
 */
public final class NameAllocator {
  private final Set<String> taken = new HashSet<>();
  private final int maxAttempts;

  public NameAllocator(int maxAttempts) {
    checkArgument(maxAttempts >= 1);
    this.maxAttempts = maxAttempts;
  }

  /**
   * Marks the given name as used. Fails if it already is.
   */
  public void reserve(String name) {
    checkArgument(taken.add(name), "Name %s already taken", name);
  }

  public boolean isTaken(String name) {
    return taken.contains(name);
  }

  public String allocate(String base) {
    if (taken.add(base)) {
      return base;
    }
    for (int suffix = 0; suffix < maxAttempts; suffix++) {
      String candidate = base + suffix;
      if (taken.add(candidate)) {
        return candidate;
      }
    }
    throw new NameCollisionExhaustedException(base, maxAttempts);
  }
}
