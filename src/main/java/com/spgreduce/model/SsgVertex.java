package com.spgreduce.model;

import java.util.Objects;

public record SsgVertex(String name, Player owner, boolean target) implements GameVertex {
    public SsgVertex {
        Objects.requireNonNull(name);
        Objects.requireNonNull(owner);
    }

    @Override
    public String toString() {
        return target ? "%s[%s,target]".formatted(name, owner) : "%s[%s]".formatted(name, owner);
    }
}
