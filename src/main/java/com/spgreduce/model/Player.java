package com.spgreduce.model;

public enum Player {
    EVE, ADAM;

    public int id() {
        return switch (this) {
            case EVE -> 0;
            case ADAM -> 1;
        };
    }

    public Player opponent() {
        return this == EVE ? ADAM : EVE;
    }

    public static Player parse(String string) {
        return switch (string.trim().toLowerCase()) {
            case "eve", "0", "true" -> EVE;
            case "adam", "1", "false" -> ADAM;
            default -> throw new IllegalArgumentException("Unsupported player " + string);
        };
    }
}
