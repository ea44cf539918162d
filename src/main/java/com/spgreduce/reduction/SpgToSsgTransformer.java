package com.spgreduce.reduction;

import com.spgreduce.model.Distribution;
import com.spgreduce.model.Player;
import com.spgreduce.model.SimpleStochasticGame;
import com.spgreduce.model.SpgVertex;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.numeric.Arithmetic;
import java.util.Comparator;
import java.util.List;
import java.util.function.IntUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the simple stochastic game simulating the parity condition of a stochastic parity game.
 *
 * <p>Every vertex v of the parity game yields a decision vertex, which keeps the choices of v, and an
 * intermediate vertex, which is entered whenever a transition would move to v. The intermediate
 * vertex is owned by the opponent of v's owner and flips a coin: with the alpha of v's priority, the
 * play ends in the winning sink (even priority) or in the losing sink (odd priority); otherwise it
 * continues at the decision vertex of v.</p>
 *
 * <p>With n vertices in the parity game, the decision vertex of vertex i has id i, its intermediate
 * vertex id n + i, the winning sink id 2n and the losing sink id 2n + 1.</p>
 */
public final class SpgToSsgTransformer {
  private static final Logger log = Logger.getLogger(SpgToSsgTransformer.class.getName());

  public static final String INTERMEDIATE_MARKER = "'";
  public static final String WIN_NAME = "v_win";
  public static final String LOSE_NAME = "v_lose";
  public static final String ALPHA_ACTION = "alpha";

  private final ReductionSettings settings;

  public SpgToSsgTransformer(ReductionSettings settings) {
    this.settings = settings;
  }

  public <P> SimpleStochasticGame<P> transform(StochasticParityGame<P> game, Alphas<P> alphas) {
    checkDeadlocks(game);
    for (int priority : game.priorities().toIntArray()) {
      alphas.get(priority);
    }

    Arithmetic<P> arithmetic = game.arithmetic();
    int size = game.vertexCount();

    NameAllocator names = new NameAllocator(settings.nameAttempts());
    game.vertices().forEach(vertex -> names.reserve(vertex.name()));
    String[] intermediateNames = new String[size];
    game.vertexIds().boxed()
        .sorted(Comparator.comparing(id -> game.vertex(id).name()))
        .forEach(id -> intermediateNames[id] = names.allocate(game.vertex(id).name() + INTERMEDIATE_MARKER));
    String winName = names.allocate(WIN_NAME);
    String loseName = names.allocate(LOSE_NAME);

    SimpleStochasticGame.Builder<P> builder = SimpleStochasticGame.builder(arithmetic);
    for (SpgVertex vertex : game.vertices()) {
      builder.addVertex(vertex.name(), vertex.owner(), false);
    }
    for (int id = 0; id < size; id++) {
      builder.addVertex(intermediateNames[id], game.owner(id).opponent(), false);
    }
    int win = builder.addVertex(winName, Player.EVE, true);
    int lose = builder.addVertex(loseName, Player.ADAM, false);
    assert win == 2 * size && lose == 2 * size + 1;

    IntUnaryOperator intermediate = id -> size + id;
    game.transitions()
        .map(transition -> transition.relocate(IntUnaryOperator.identity(), intermediate))
        .forEach(transition -> builder.addTransition(transition.source(), transition.action(),
            transition.distribution()));

    for (int id = 0; id < size; id++) {
      SpgVertex vertex = game.vertex(id);
      P alpha = alphas.get(vertex.priority());
      builder.addTransition(intermediate.applyAsInt(id), ALPHA_ACTION,
          Distribution.coin(arithmetic, alpha, vertex.isEven() ? win : lose, id));
    }
    builder.initial(game.initialVertex());
    return builder.build();
  }

  private void checkDeadlocks(StochasticParityGame<?> game) {
    List<String> deadlocks = game.deadlocks().mapToObj(id -> game.vertex(id).name()).toList();
    if (deadlocks.isEmpty()) {
      return;
    }
    if (settings.rejectDeadlocks()) {
      throw new DeadlockException(deadlocks);
    }
    log.log(Level.WARNING, () -> "Vertices %s have no outgoing transitions, their decision vertices "
        .formatted(deadlocks) + "will be deadlocks");
  }
}
