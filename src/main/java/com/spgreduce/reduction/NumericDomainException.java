package com.spgreduce.reduction;

public class NumericDomainException extends ReductionException {
  public NumericDomainException(String message) {
    super(message);
  }
}
