package com.spgreduce.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.spgreduce.numeric.Arithmetic;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Turn-based stochastic game graph. Vertices are identified by their index in insertion order, names
 * are only kept for lookup at the boundary. Instances are immutable.
 *
 * @param <V> vertex type
 * @param <P> probability type
 */
public abstract class StochasticGame<V extends GameVertex, P> {
    private final Arithmetic<P> arithmetic;
    private final List<V> vertices;
    private final List<List<Transition<P>>> transitions;
    private final int initialVertex;
    private final Object2IntMap<String> ids;

    protected StochasticGame(Builder<V, P, ?> builder) {
        checkState(builder.initialVertex >= 0, "No initial vertex");
        this.arithmetic = builder.arithmetic;
        this.vertices = ImmutableList.copyOf(builder.vertices);
        this.transitions = builder.transitions.stream()
                .map(ImmutableList::copyOf)
                .collect(ImmutableList.toImmutableList());
        this.initialVertex = builder.initialVertex;
        Object2IntMap<String> ids = new Object2IntOpenHashMap<>(builder.ids);
        ids.defaultReturnValue(-1);
        this.ids = ids;

        assert transitions.size() == vertices.size();
        assert transitions().allMatch(t -> t.distribution().destinations().allMatch(d -> d < vertices.size()));
    }

    public Arithmetic<P> arithmetic() {
        return arithmetic;
    }

    public int vertexCount() {
        return vertices.size();
    }

    public List<V> vertices() {
        return vertices;
    }

    public V vertex(int id) {
        return vertices.get(id);
    }

    public IntStream vertexIds() {
        return IntStream.range(0, vertices.size());
    }

    public boolean contains(String name) {
        return ids.containsKey(name);
    }

    public int id(String name) {
        int id = ids.getInt(name);
        if (id < 0) {
            throw new NoSuchElementException("No vertex named " + name);
        }
        return id;
    }

    public V vertex(String name) {
        return vertex(id(name));
    }

    public int initialVertex() {
        return initialVertex;
    }

    public V initial() {
        return vertex(initialVertex);
    }

    public List<Transition<P>> transitions(int source) {
        return transitions.get(source);
    }

    public Stream<Transition<P>> transitions() {
        return transitions.stream().flatMap(List::stream);
    }

    public int transitionCount() {
        return transitions.stream().mapToInt(List::size).sum();
    }

    public Optional<Transition<P>> transition(int source, String action) {
        return transitions(source).stream().filter(t -> t.action().equals(action)).findAny();
    }

    public IntStream successors(int source) {
        return transitions(source).stream().flatMapToInt(t -> t.distribution().destinations()).distinct();
    }

    /**
     * Vertices without any outgoing transition.
     */
    public IntStream deadlocks() {
        return vertexIds().filter(id -> transitions.get(id).isEmpty());
    }

    @Override
    public String toString() {
        return "%s[%d vertices, %d transitions, initial %s]".formatted(getClass().getSimpleName(),
                vertexCount(), transitionCount(), initial().name());
    }

    public abstract static class Builder<V extends GameVertex, P, G extends StochasticGame<V, P>> {
        final Arithmetic<P> arithmetic;
        final List<V> vertices = new ArrayList<>();
        final List<List<Transition<P>>> transitions = new ArrayList<>();
        final Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
        private final List<Set<String>> actions = new ArrayList<>();
        int initialVertex = -1;

        protected Builder(Arithmetic<P> arithmetic) {
            this.arithmetic = arithmetic;
            ids.defaultReturnValue(-1);
        }

        public Arithmetic<P> arithmetic() {
            return arithmetic;
        }

        public int size() {
            return vertices.size();
        }

        public boolean contains(String name) {
            return ids.containsKey(name);
        }

        public int id(String name) {
            int id = ids.getInt(name);
            if (id < 0) {
                throw new NoSuchElementException("No vertex named " + name);
            }
            return id;
        }

        protected int add(V vertex) {
            checkArgument(!ids.containsKey(vertex.name()), "Duplicate vertex %s", vertex.name());
            int id = vertices.size();
            vertices.add(vertex);
            transitions.add(new ArrayList<>());
            actions.add(new HashSet<>());
            ids.put(vertex.name(), id);
            return id;
        }

        public Builder<V, P, G> addTransition(int source, String action, Distribution<P> distribution) {
            checkArgument(0 <= source && source < vertices.size(), "Unknown source %s", source);
            checkArgument(distribution.destinations().allMatch(d -> d < vertices.size()),
                    "Unknown destination in %s", distribution);
            checkArgument(actions.get(source).add(action), "Duplicate action %s on vertex %s",
                    action, vertices.get(source).name());
            transitions.get(source).add(new Transition<>(source, action, distribution));
            return this;
        }

        public Builder<V, P, G> addTransition(String source, String action, Map<String, P> distribution) {
            List<Distribution.Branch<P>> branches = new ArrayList<>(distribution.size());
            distribution.forEach((destination, probability) ->
                    branches.add(new Distribution.Branch<>(probability, id(destination))));
            return addTransition(id(source), action, Distribution.of(arithmetic, branches));
        }

        public Builder<V, P, G> initial(int id) {
            checkArgument(0 <= id && id < vertices.size(), "Unknown initial vertex %s", id);
            this.initialVertex = id;
            return this;
        }

        public Builder<V, P, G> initial(String name) {
            return initial(id(name));
        }

        public abstract G build();
    }
}
