package com.spgreduce.reduction;

/**
 * Result of {@link PrecisionAnalyzer#analyze}.
 *
 * @param minimumProbability smallest probability of any branch of any transition
 * @param denominatorBound largest denominator among all probabilities after rounding each of them
 *     to the closest rational below the denominator cap
 */
public record Precision<P>(P minimumProbability, long denominatorBound) {}
