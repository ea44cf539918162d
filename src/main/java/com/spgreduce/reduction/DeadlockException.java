package com.spgreduce.reduction;

import java.util.List;

public class DeadlockException extends ReductionException {
  private final List<String> vertices;

  public DeadlockException(List<String> vertices) {
    super("Vertices without outgoing transitions: " + vertices);
    this.vertices = List.copyOf(vertices);
  }

  public List<String> vertices() {
    return vertices;
  }
}
