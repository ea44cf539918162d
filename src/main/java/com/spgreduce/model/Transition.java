package com.spgreduce.model;

import java.util.Objects;
import java.util.function.IntUnaryOperator;

public record Transition<P>(int source, String action, Distribution<P> distribution) {
    public Transition {
        Objects.requireNonNull(action);
        Objects.requireNonNull(distribution);
    }

    public Transition<P> relocate(IntUnaryOperator sourceMapping, IntUnaryOperator destinationMapping) {
        return new Transition<>(sourceMapping.applyAsInt(source), action,
                distribution.withDestinations(destinationMapping));
    }

    @Override
    public String toString() {
        return source + " -" + action + "-> " + distribution;
    }
}
