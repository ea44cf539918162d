package com.spgreduce.model;

import static com.google.common.base.Preconditions.checkState;

import com.spgreduce.numeric.Arithmetic;

/**
 * Stochastic game with a reachability objective: Eve tries to reach the single target vertex.
 */
public final class SimpleStochasticGame<P> extends StochasticGame<SsgVertex, P> {
    private final int target;

    private SimpleStochasticGame(Builder<P> builder) {
        super(builder);
        int[] targets = vertexIds().filter(id -> vertex(id).target()).toArray();
        checkState(targets.length == 1, "Expected exactly one target vertex, got %s", targets.length);
        this.target = targets[0];
    }

    public static <P> Builder<P> builder(Arithmetic<P> arithmetic) {
        return new Builder<>(arithmetic);
    }

    public int target() {
        return target;
    }

    public SsgVertex targetVertex() {
        return vertex(target);
    }

    public Player owner(int vertex) {
        return vertex(vertex).owner();
    }

    public static final class Builder<P> extends StochasticGame.Builder<SsgVertex, P, SimpleStochasticGame<P>> {
        private Builder(Arithmetic<P> arithmetic) {
            super(arithmetic);
        }

        public int addVertex(String name, Player owner, boolean target) {
            return add(new SsgVertex(name, owner, target));
        }

        @Override
        public SimpleStochasticGame<P> build() {
            return new SimpleStochasticGame<>(this);
        }
    }
}
