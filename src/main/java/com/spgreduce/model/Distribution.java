package com.spgreduce.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.spgreduce.numeric.Arithmetic;
import java.util.List;
import java.util.function.IntUnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Finite probability distribution over vertex ids. Branches are kept in insertion order; the same
 * destination may occur more than once.
 */
public final class Distribution<P> {
    public record Branch<P>(P probability, int destination) {
        @Override
        public String toString() {
            return probability + ":" + destination;
        }
    }

    private final List<Branch<P>> branches;

    private Distribution(List<Branch<P>> branches) {
        this.branches = branches;
    }

    /**
     * Creates a distribution, checking that each probability lies in (0, 1] and that they sum to one.
     */
    public static <P> Distribution<P> of(Arithmetic<P> arithmetic, List<Branch<P>> branches) {
        checkArgument(!branches.isEmpty(), "Empty distribution");
        P sum = arithmetic.zero();
        for (Branch<P> branch : branches) {
            checkArgument(arithmetic.isProbability(branch.probability()),
                    "Invalid probability %s for destination %s", branch.probability(), branch.destination());
            checkArgument(branch.destination() >= 0, "Invalid destination %s", branch.destination());
            sum = arithmetic.add(sum, branch.probability());
        }
        checkArgument(arithmetic.isOne(sum), "Probabilities %s sum up to %s", branches, sum);
        return new Distribution<>(ImmutableList.copyOf(branches));
    }

    public static <P> Distribution<P> dirac(Arithmetic<P> arithmetic, int destination) {
        return of(arithmetic, List.of(new Branch<>(arithmetic.one(), destination)));
    }

    public static <P> Distribution<P> coin(Arithmetic<P> arithmetic, P probability, int first, int second) {
        return of(arithmetic, List.of(new Branch<>(probability, first),
                new Branch<>(arithmetic.complement(probability), second)));
    }

    public List<Branch<P>> branches() {
        return branches;
    }

    public Stream<Branch<P>> stream() {
        return branches.stream();
    }

    public IntStream destinations() {
        return branches.stream().mapToInt(Branch::destination);
    }

    public Stream<P> probabilities() {
        return branches.stream().map(Branch::probability);
    }

    public int size() {
        return branches.size();
    }

    public P sum(Arithmetic<P> arithmetic) {
        return probabilities().reduce(arithmetic.zero(), arithmetic::add);
    }

    /**
     * Same probabilities, destinations renamed through the given mapping. The sum is unchanged, so no
     * re-validation happens.
     */
    public Distribution<P> withDestinations(IntUnaryOperator mapping) {
        return new Distribution<>(branches.stream()
                .map(branch -> new Branch<>(branch.probability(), mapping.applyAsInt(branch.destination())))
                .collect(ImmutableList.toImmutableList()));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Distribution<?> that && branches.equals(that.branches));
    }

    @Override
    public int hashCode() {
        return branches.hashCode();
    }

    @Override
    public String toString() {
        return branches.stream().map(Branch::toString).collect(Collectors.joining(", ", "{", "}"));
    }
}
