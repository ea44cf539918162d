package com.spgreduce.model;

public interface GameVertex {
    String name();

    Player owner();
}
