package com.spgreduce.reduction;

public class NameCollisionExhaustedException extends ReductionException {
  public NameCollisionExhaustedException(String base, int attempts) {
    super("Could not find a free name for %s within %d attempts".formatted(base, attempts));
  }
}
