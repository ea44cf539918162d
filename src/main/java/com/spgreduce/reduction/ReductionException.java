package com.spgreduce.reduction;

/**
 * Base class of all failures of a reduction. A failed reduction has no partial result.
 */
public class ReductionException extends RuntimeException {
  public ReductionException(String message) {
    super(message);
  }

  public ReductionException(String message, Throwable cause) {
    super(message, cause);
  }
}
