package com.spgreduce.model;

import com.spgreduce.numeric.Arithmetic;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;

/**
 * Stochastic parity game: each vertex carries an owner and a priority, transitions are chosen by the
 * owner and resolved by a probability distribution.
 */
public final class StochasticParityGame<P> extends StochasticGame<SpgVertex, P> {
    private StochasticParityGame(Builder<P> builder) {
        super(builder);
    }

    public static <P> Builder<P> builder(Arithmetic<P> arithmetic) {
        return new Builder<>(arithmetic);
    }

    public int priority(int vertex) {
        return vertex(vertex).priority();
    }

    public Player owner(int vertex) {
        return vertex(vertex).owner();
    }

    /**
     * The distinct priorities occurring in this game, in ascending order.
     */
    public IntSortedSet priorities() {
        IntSortedSet priorities = new IntRBTreeSet();
        vertices().forEach(vertex -> priorities.add(vertex.priority()));
        return priorities;
    }

    public static final class Builder<P> extends StochasticGame.Builder<SpgVertex, P, StochasticParityGame<P>> {
        private Builder(Arithmetic<P> arithmetic) {
            super(arithmetic);
        }

        public int addVertex(String name, Player owner, int priority) {
            return add(new SpgVertex(name, owner, priority));
        }

        public int addVertex(SpgVertex vertex) {
            return add(vertex);
        }

        @Override
        public StochasticParityGame<P> build() {
            return new StochasticParityGame<>(this);
        }
    }
}
