package com.spgreduce.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.spgreduce.Games;
import com.spgreduce.model.Distribution;
import com.spgreduce.model.Player;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.numeric.Arithmetic;
import com.spgreduce.numeric.NumericMode;
import com.spgreduce.numeric.Rational;
import com.spgreduce.reduction.ReductionSettings;
import java.io.StringReader;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class GameParserTest {
  private static final String SMALL = """
      {
        "initial": "s",
        "vertices": {
          "s": {"owner": "eve", "priority": 2, "transitions": {"go": {"s": 0.25, "t": "3/4"}}},
          "t": {"owner": "adam", "priority": 1, "transitions": {"back": {"s": 1}}}
        }
      }
      """;

  @Test
  public void parsesMutexGame() {
    StochasticParityGame<Rational> game = Games.mutex(Arithmetic.exact());
    assertEquals(19, game.vertexCount());
    assertEquals(25, game.transitionCount());
    assertEquals("start", game.initial().name());
    assertEquals(List.of(0, 1, 2, 3), List.copyOf(game.priorities()));
    assertEquals(Player.ADAM, game.vertex("(N,N,1)").owner());
    assertTrue(game.transitions()
        .flatMap(transition -> transition.distribution().probabilities())
        .allMatch(Rational.of(1, 2)::equals));
    assertEquals(0, game.deadlocks().count());
  }

  @Test
  public void parsesNumbersAndFractions() {
    StochasticParityGame<Rational> game = GameParser.parse(new StringReader(SMALL), Arithmetic.exact());
    assertEquals(0, game.id("s"));
    assertEquals(2, game.priority(0));
    assertEquals(Player.ADAM, game.owner(1));
    assertEquals(List.of(
        new Distribution.Branch<>(Rational.of(1, 4), 0),
        new Distribution.Branch<>(Rational.of(3, 4), 1)),
        game.transition(0, "go").orElseThrow().distribution().branches());
  }

  @Test
  public void numericModeSelectsArithmetic() {
    JsonObject json = JsonParser.parseString(SMALL).getAsJsonObject();
    StochasticParityGame<?> exact = GameParser.parse(json, NumericMode.EXACT);
    StochasticParityGame<?> floating = GameParser.parse(json, NumericMode.FLOATING);
    assertEquals(Rational.of(3, 4), exact.transition(0, "go").orElseThrow().distribution().branches()
        .get(1).probability());
    assertEquals(0.75, floating.transition(0, "go").orElseThrow().distribution().branches()
        .get(1).probability());
  }

  @Test
  public void missingMembersAreReported() {
    assertThrows(NullPointerException.class, () -> parse("{\"initial\": \"s\"}"));
    assertThrows(NullPointerException.class, () -> parse("{\"vertices\": {}}"));
    assertThrows(NullPointerException.class,
        () -> parse("{\"initial\": \"s\", \"vertices\": {\"s\": {\"priority\": 0}}}"));
    assertThrows(NullPointerException.class,
        () -> parse("{\"initial\": \"s\", \"vertices\": {\"s\": {\"owner\": \"eve\"}}}"));
  }

  @Test
  public void invalidReferencesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": \"x\", \"vertices\": {\"s\": {\"owner\": \"eve\", \"priority\": 0}}}"));
    assertThrows(IllegalArgumentException.class, () -> parse("""
        {"initial": "s", "vertices": {"s": {"owner": "eve", "priority": 0, "transitions": {"go": {"x": 1}}}}}
        """));
    assertThrows(IllegalArgumentException.class, () -> parse("""
        {"initial": "s", "vertices": {"s": {"owner": "eve", "priority": 0, "transitions": {"go": {"s": 0.5}}}}}
        """));
    assertThrows(IllegalArgumentException.class, () -> parse("""
        {"initial": "s", "vertices": {"s": {"owner": "nobody", "priority": 0}}}
        """));
  }

  @Test
  public void wronglyTypedMembersAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> parse("{\"initial\": \"s\", \"vertices\": []}"));
    assertThrows(IllegalArgumentException.class, () -> parse("{\"initial\": {}, \"vertices\": {}}"));
    assertThrows(IllegalArgumentException.class, () -> parse("{\"initial\": \"s\", \"vertices\": {\"s\": 1}}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": \"s\", \"vertices\": {\"s\": {\"owner\": [], \"priority\": 0}}}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": \"s\", \"vertices\": {\"s\": {\"owner\": \"eve\", \"priority\": {}}}}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"initial\": \"s\", \"vertices\": {\"s\": {\"owner\": \"eve\", \"priority\": \"2\"}}}"));
    assertThrows(IllegalArgumentException.class, () -> parse("""
        {"initial": "s", "vertices": {"s": {"owner": "eve", "priority": 0, "transitions": []}}}
        """));
    assertThrows(IllegalArgumentException.class, () -> parse("""
        {"initial": "s", "vertices": {"s": {"owner": "eve", "priority": 0, "transitions": {"go": 1}}}}
        """));
  }

  @Test
  public void fractionalPrioritiesAreRejected() {
    for (String priority : new String[] {"1.5", "2.5", "-1", "3000000000"}) {
      String json = """
          {"initial": "s", "vertices": {"s": {"owner": "eve", "priority": %s,
              "transitions": {"loop": {"s": 1}}}}}
          """.formatted(priority);
      assertThrows(IllegalArgumentException.class, () -> parse(json), priority);
    }
    StochasticParityGame<Rational> game = parse("""
        {"initial": "s", "vertices": {"s": {"owner": "eve", "priority": 2.0,
            "transitions": {"loop": {"s": 1}}}}}
        """);
    assertEquals(2, game.priority(0));
  }

  @Test
  public void configuredNumericModeSelectsArithmetic() {
    Properties properties = new Properties();
    properties.setProperty("spgreduce.numeric-mode", "exact");
    ReductionSettings exact = ReductionSettings.fromProperties(properties);
    StochasticParityGame<?> game = GameParser.parse(new StringReader(SMALL), exact);
    assertEquals(NumericMode.EXACT, game.arithmetic().mode());
    assertEquals(Rational.of(1, 4), game.transition(0, "go").orElseThrow().distribution().branches()
        .get(0).probability());

    StochasticParityGame<?> floating = GameParser.parse(JsonParser.parseString(SMALL).getAsJsonObject(),
        ReductionSettings.defaults());
    assertEquals(NumericMode.FLOATING, floating.arithmetic().mode());
    assertEquals(0.25, floating.transition(0, "go").orElseThrow().distribution().branches()
        .get(0).probability());
  }

  @Test
  public void malformedJsonIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> parse("{\"initial\": "));
    assertThrows(IllegalArgumentException.class, () -> parse("[1, 2]"));
  }

  private static StochasticParityGame<Rational> parse(String json) {
    return GameParser.parse(new StringReader(json), Arithmetic.exact());
  }
}
