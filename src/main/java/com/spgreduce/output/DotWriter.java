package com.spgreduce.output;

import com.spgreduce.model.Distribution;
import com.spgreduce.model.GameVertex;
import com.spgreduce.model.Player;
import com.spgreduce.model.SimpleStochasticGame;
import com.spgreduce.model.StochasticGame;
import com.spgreduce.model.StochasticParityGame;
import com.spgreduce.model.Transition;
import java.io.PrintStream;
import java.util.function.IntFunction;
import java.util.regex.Pattern;

/**
 * Graphviz rendering of games. Eve's vertices are boxes, Adam's ellipses; each transition gets a
 * point node from which its probabilistic branches leave.
 */
public final class DotWriter {
    private static final Pattern ESCAPED = Pattern.compile("([\"\\\\])");

    private DotWriter() {
    }

    public static <P> void writeParityGame(StochasticParityGame<P> game, PrintStream writer) {
        write(game, writer, id -> "%s %d".formatted(game.vertex(id).name(), game.priority(id)));
    }

    public static <P> void writeStochasticGame(SimpleStochasticGame<P> game, PrintStream writer) {
        write(game, writer, id -> game.vertex(id).name());
    }

    private static <V extends GameVertex, P> void write(StochasticGame<V, P> game, PrintStream writer,
                                                        IntFunction<String> label) {
        writer.append("digraph {\n");
        game.vertexIds().forEach(id -> {
            V vertex = game.vertex(id);
            String shape = vertex.owner() == Player.EVE ? "box" : "ellipse";
            boolean target = game instanceof SimpleStochasticGame<?> ssg && ssg.target() == id;
            writer.append("S_%d [shape=%s%s%s,label=\"%s\"]\n".formatted(id, shape,
                    target ? ",peripheries=2" : "",
                    id == game.initialVertex() ? ",style=bold" : "",
                    escape(label.apply(id))));
        });

        int index = 0;
        for (Transition<P> transition : game.transitions().toList()) {
            writer.append("T_%d [shape=point]\n".formatted(index));
            writer.append("S_%d -> T_%d [arrowhead=none,label=\"%s\"]\n".formatted(transition.source(), index,
                    escape(transition.action())));
            for (Distribution.Branch<P> branch : transition.distribution().branches()) {
                writer.append("T_%d -> S_%d [label=\"%s\"]\n".formatted(index, branch.destination(),
                        escape(String.valueOf(branch.probability()))));
            }
            index += 1;
        }
        writer.append("}");
    }

    static String escape(String string) {
        return ESCAPED.matcher(string).replaceAll("\\\\$1");
    }
}
