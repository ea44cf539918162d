package com.spgreduce;

import com.spgreduce.model.Player;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.numeric.Arithmetic;
import com.spgreduce.parser.GameParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class Games {
  private Games() {}

  /**
   * Vertices v0 to v{length}, all owned by Eve with priority 0. Vertex vi moves on to v(i+1) with the
   * given probability and falls back to v0 otherwise, the last vertex loops.
   */
  public static <P> StochasticParityGame<P> chain(int length, P probability, Arithmetic<P> arithmetic) {
    StochasticParityGame.Builder<P> builder = StochasticParityGame.builder(arithmetic);
    for (int i = 0; i <= length; i++) {
      builder.addVertex("v" + i, Player.EVE, 0);
    }
    for (int i = 0; i < length; i++) {
      Map<String, P> distribution = new LinkedHashMap<>();
      distribution.put("v" + (i + 1), probability);
      distribution.put("v0", arithmetic.complement(probability));
      builder.addTransition("v" + i, "next", distribution);
    }
    builder.addTransition("v" + length, "end", Map.of("v" + length, arithmetic.one()));
    builder.initial("v0");
    return builder.build();
  }

  /**
   * Two vertices: {@code a} (Eve, priority 0) moves to itself or {@code b} with probability one half
   * each, {@code b} (Adam, priority 1) returns to {@code a}.
   */
  public static <P> StochasticParityGame<P> coin(Arithmetic<P> arithmetic, P half) {
    StochasticParityGame.Builder<P> builder = StochasticParityGame.builder(arithmetic);
    builder.addVertex("a", Player.EVE, 0);
    builder.addVertex("b", Player.ADAM, 1);
    Map<String, P> distribution = new LinkedHashMap<>();
    distribution.put("a", half);
    distribution.put("b", half);
    builder.addTransition("a", "go", distribution);
    builder.addTransition("b", "back", Map.of("a", arithmetic.one()));
    builder.initial("a");
    return builder.build();
  }

  public static <P> StochasticParityGame<P> mutex(Arithmetic<P> arithmetic) {
    return load("games/mutex.json", arithmetic);
  }

  public static <P> StochasticParityGame<P> load(String resource, Arithmetic<P> arithmetic) {
    InputStream stream = Objects.requireNonNull(Games.class.getClassLoader().getResourceAsStream(resource),
        () -> "Missing resource " + resource);
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return GameParser.parse(reader, arithmetic);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
