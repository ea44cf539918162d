package com.spgreduce.model;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

public record SpgVertex(String name, Player owner, int priority) implements GameVertex {
    public SpgVertex {
        Objects.requireNonNull(name);
        Objects.requireNonNull(owner);
        checkArgument(priority >= 0, "Negative priority %s on vertex %s", priority, name);
    }

    public boolean isEven() {
        return priority % 2 == 0;
    }

    @Override
    public String toString() {
        return "%s[%s,%d]".formatted(name, owner, priority);
    }
}
