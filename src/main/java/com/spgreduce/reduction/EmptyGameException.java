package com.spgreduce.reduction;

public class EmptyGameException extends ReductionException {
  public EmptyGameException(String message) {
    super(message);
  }
}
