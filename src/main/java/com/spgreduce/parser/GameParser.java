package com.spgreduce.parser;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.spgreduce.model.Player;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.numeric.Arithmetic;
import com.spgreduce.numeric.NumericMode;
import com.spgreduce.reduction.ReductionSettings;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads stochastic parity games from JSON of the form
 *
 * <pre>
 * {
 *   "initial": "v0",
 *   "vertices": {
 *     "v0": {"owner": "eve", "priority": 0, "transitions": {"next": {"v1": "1/2", "v0": 0.5}}},
 *     ...
 *   }
 * }
 * </pre>
 *
 * Vertex ids follow the order of the vertices object. Probabilities are numbers or fraction strings.
 */
public final class GameParser {
  private GameParser() {}

  /**
   * Parses with the arithmetic of the configured {@link ReductionSettings#numericMode()}.
   */
  public static StochasticParityGame<?> parse(Reader reader, ReductionSettings settings) {
    return parse(reader, settings.numericMode().arithmetic());
  }

  public static StochasticParityGame<?> parse(JsonObject json, ReductionSettings settings) {
    return parse(json, settings.numericMode());
  }

  public static StochasticParityGame<?> parse(JsonObject json, NumericMode mode) {
    return parse(json, mode.arithmetic());
  }

  public static <P> StochasticParityGame<P> parse(Reader reader, Arithmetic<P> arithmetic) {
    JsonElement element;
    try {
      element = JsonParser.parseReader(reader);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Malformed game description", e);
    }
    checkArgument(element.isJsonObject(), "Game description is not an object");
    return parse(element.getAsJsonObject(), arithmetic);
  }

  public static <P> StochasticParityGame<P> parse(JsonObject json, Arithmetic<P> arithmetic) {
    JsonObject vertices = object(requireNonNull(json.get("vertices"), "Missing vertices definition"),
        "Vertices definition");
    String initial = string(requireNonNull(json.get("initial"), "Missing initial vertex"), "Initial vertex");

    StochasticParityGame.Builder<P> builder = StochasticParityGame.builder(arithmetic);
    for (var vertexEntry : vertices.entrySet()) {
      String vertexName = vertexEntry.getKey();
      JsonObject vertexData = object(vertexEntry.getValue(), "Vertex " + vertexName);
      Player owner = Player.parse(string(requireNonNull(vertexData.get("owner"),
          () -> "Missing owner for vertex %s".formatted(vertexName)), "Owner of vertex " + vertexName));
      int priority = priority(requireNonNull(vertexData.get("priority"),
          () -> "Missing priority for vertex %s".formatted(vertexName)), vertexName);
      builder.addVertex(vertexName, owner, priority);
    }
    checkArgument(builder.contains(initial), "Unknown initial vertex %s", initial);
    builder.initial(initial);

    for (var vertexEntry : vertices.entrySet()) {
      String vertexName = vertexEntry.getKey();
      JsonElement transitionsElement = vertexEntry.getValue().getAsJsonObject().get("transitions");
      if (transitionsElement == null || transitionsElement.isJsonNull()) {
        continue;
      }
      JsonObject transitions = object(transitionsElement, "Transitions of vertex " + vertexName);
      for (var transitionEntry : transitions.entrySet()) {
        String action = transitionEntry.getKey();
        JsonObject branches = object(transitionEntry.getValue(),
            "Distribution of action %s on vertex %s".formatted(action, vertexName));
        Map<String, P> distribution = new LinkedHashMap<>();
        for (var branch : branches.entrySet()) {
          checkArgument(builder.contains(branch.getKey()), "Unknown destination %s of action %s on vertex %s",
              branch.getKey(), action, vertexName);
          distribution.put(branch.getKey(), parseProbability(branch.getValue(), arithmetic));
        }
        builder.addTransition(vertexName, action, distribution);
      }
    }
    return builder.build();
  }

  private static JsonObject object(JsonElement element, String description) {
    checkArgument(element.isJsonObject(), "%s is not an object", description);
    return element.getAsJsonObject();
  }

  private static String string(JsonElement element, String description) {
    checkArgument(element.isJsonPrimitive(), "%s is not a primitive value", description);
    return element.getAsString();
  }

  private static int priority(JsonElement element, String vertexName) {
    checkArgument(element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber(),
        "Priority of vertex %s is not a number", vertexName);
    try {
      return element.getAsBigDecimal().intValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Priority %s of vertex %s is not an integer"
          .formatted(element, vertexName), e);
    }
  }

  private static <P> P parseProbability(JsonElement element, Arithmetic<P> arithmetic) {
    checkArgument(element.isJsonPrimitive(), "Invalid probability %s", element);
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    checkArgument(primitive.isNumber() || primitive.isString(), "Invalid probability %s", primitive);
    return arithmetic.parse(primitive.getAsString());
  }
}
