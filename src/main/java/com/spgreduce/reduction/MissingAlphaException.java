package com.spgreduce.reduction;

public class MissingAlphaException extends ReductionException {
  private final int priority;

  public MissingAlphaException(int priority) {
    super("No alpha for priority %d".formatted(priority));
    this.priority = priority;
  }

  public int priority() {
    return priority;
  }
}
