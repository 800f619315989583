package ai.pulse.graph.algo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

public class Algorithms {
    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;

    /**
     * Looks for a cycle in a graph given as vertex to its upstream vertices.
     *
     * @return vertices of the first cycle found, the first vertex repeated at the end; empty if acyclic
     */
    public static Optional<List<String>> findCycle(Map<String, List<String>> upstream) {
        var colors = new HashMap<String, Integer>();
        var prev = new HashMap<String, String>();

        for (var vertex : upstream.keySet()) {
            if (colors.getOrDefault(vertex, WHITE) == WHITE) {
                var cycleEnds = dfs(vertex, upstream, colors, prev);
                if (cycleEnds != null) {
                    var cycle = new LinkedList<String>();
                    cycle.add(cycleEnds[0]);
                    for (var v = cycleEnds[1]; !v.equals(cycleEnds[0]); v = prev.get(v)) {
                        cycle.addFirst(v);
                    }
                    cycle.addFirst(cycleEnds[0]);
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private static String[] dfs(String v, Map<String, List<String>> upstream, Map<String, Integer> colors,
                                Map<String, String> prev)
    {
        colors.put(v, GREY);

        for (var u : upstream.getOrDefault(v, List.of())) {
            var color = colors.getOrDefault(u, WHITE);
            if (color == WHITE) {
                prev.put(u, v);
                var cycleEnds = dfs(u, upstream, colors, prev);
                if (cycleEnds != null) {
                    return cycleEnds;
                }
            } else if (color == GREY) {
                return new String[] {u, v};
            }
        }

        colors.put(v, BLACK);
        return null;
    }

    /**
     * Orders vertices so that each one follows all of its upstream vertices. Among vertices ready at the
     * same time the one declared first goes first.
     *
     * @param upstream    vertex to its upstream vertices; the graph must be acyclic
     * @param declaration every vertex, in declaration order
     */
    public static List<String> topologicalOrder(Map<String, List<String>> upstream, List<String> declaration) {
        var index = new HashMap<String, Integer>();
        for (int i = 0; i < declaration.size(); i++) {
            index.put(declaration.get(i), i);
        }

        var pendingInputs = new HashMap<String, Integer>();
        var downstream = new HashMap<String, List<String>>();
        for (var vertex : declaration) {
            var inputs = upstream.getOrDefault(vertex, List.of());
            pendingInputs.put(vertex, inputs.size());
            for (var input : inputs) {
                downstream.computeIfAbsent(input, k -> new ArrayList<>()).add(vertex);
            }
        }

        var ready = new PriorityQueue<String>((a, b) -> Integer.compare(index.get(a), index.get(b)));
        pendingInputs.forEach((vertex, count) -> {
            if (count == 0) {
                ready.add(vertex);
            }
        });

        var order = new ArrayList<String>(declaration.size());
        while (!ready.isEmpty()) {
            var vertex = ready.poll();
            order.add(vertex);
            for (var next : downstream.getOrDefault(vertex, List.of())) {
                if (pendingInputs.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }

        if (order.size() != declaration.size()) {
            throw new IllegalStateException("Graph contains cycles");
        }
        return order;
    }
}
