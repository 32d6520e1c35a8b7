package hlsyde.common.binding;

import hlsyde.common.ExclusionGraph;
import hlsyde.core.InfeasibilityException;
import org.jgrapht.alg.clique.BronKerboschCliqueFinder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Minimum coloring of several exclusion graphs as one binary program.
 *
 * For graph {@code g} with color bound {@code K}, {@code x[g][v][k]} is 1 when
 * node {@code v} takes color {@code k} and {@code c[g][k]} is 1 when color
 * {@code k} is used. The objective is the total number of used colors, or,
 * when minimizing multiplexers, the number of connections {@code y} between
 * colors that some {@link Link} needs.
 */
public final class ColoringFormulation {

    /**
     * Port {@code sourcePort} of node {@code source} in graph
     * {@code sourceGraph} feeds port {@code targetPort} of {@code target} in
     * graph {@code targetGraph}. Memories use port 0.
     */
    public record Link(int sourceGraph, String source, int sourcePort, int targetGraph, String target,
            int targetPort) {
    }

    private final LinearProgram program;
    private final List<List<String>> nodes;
    private final List<int[][]> nodeColorVariables;
    private final List<int[]> colorVariables;
    private final List<Integer> connectionVariables;

    private ColoringFormulation(LinearProgram program, List<List<String>> nodes, List<int[][]> nodeColorVariables,
            List<int[]> colorVariables, List<Integer> connectionVariables) {
        this.program = program;
        this.nodes = nodes;
        this.nodeColorVariables = nodeColorVariables;
        this.colorVariables = colorVariables;
        this.connectionVariables = connectionVariables;
    }

    /**
     * @param bounds maximum number of colors per graph, same order as the
     *               graphs.
     * @throws InfeasibilityException when a clique of a graph is larger than
     *                                its bound.
     */
    public static ColoringFormulation formulate(List<ExclusionGraph> graphs, List<Integer> bounds) {
        return formulate(graphs, bounds, null);
    }

    /**
     * Colors the graphs within their bounds while using as few connections
     * between colors as possible.
     *
     * @throws InfeasibilityException when a clique of a graph is larger than
     *                                its bound.
     */
    public static ColoringFormulation formulateMinMux(List<ExclusionGraph> graphs, List<Integer> bounds,
            List<Link> links) {
        return formulate(graphs, bounds, links);
    }

    private static ColoringFormulation formulate(List<ExclusionGraph> graphs, List<Integer> bounds,
            List<Link> links) {
        if (graphs.size() != bounds.size()) {
            throw new IllegalArgumentException("One bound per graph is needed");
        }
        var builder = LinearProgram.builder();
        var allNodes = new ArrayList<List<String>>();
        var allX = new ArrayList<int[][]>();
        var allC = new ArrayList<int[]>();
        var allIndices = new ArrayList<Map<String, Integer>>();
        for (int g = 0; g < graphs.size(); g++) {
            var graph = graphs.get(g).graph();
            var names = graphs.get(g).collection().names();
            int bound = names.isEmpty() ? 0 : bounds.get(g);
            var index = new TreeMap<String, Integer>();
            for (int v = 0; v < names.size(); v++) {
                index.put(names.get(v), v);
            }
            var c = new int[bound];
            for (int k = 0; k < bound; k++) {
                c[k] = builder.binaryVariable("c[%d][%d]".formatted(g, k));
                if (links == null) {
                    builder.minimize(c[k], 1);
                }
            }
            var x = new int[names.size()][bound];
            for (int v = 0; v < names.size(); v++) {
                for (int k = 0; k < bound; k++) {
                    x[v][k] = builder.binaryVariable("x[%d][%s][%d]".formatted(g, names.get(v), k));
                }
            }
            for (int v = 0; v < names.size(); v++) {
                var row = new ArrayList<Integer>();
                for (int k = 0; k < bound; k++) {
                    row.add(x[v][k]);
                }
                builder.sum(row, LinearProgram.Relation.EQUAL, 1);
            }
            for (var edge : graph.edgeSet()) {
                int u = index.get(graph.getEdgeSource(edge));
                int w = index.get(graph.getEdgeTarget(edge));
                for (int k = 0; k < bound; k++) {
                    builder.sum(List.of(x[u][k], x[w][k]), LinearProgram.Relation.LESS_EQUAL, 1);
                }
            }
            for (int k = 0; k < bound; k++) {
                var column = new ArrayList<Integer>();
                for (int v = 0; v < names.size(); v++) {
                    builder.constraint(new int[] { x[v][k], c[k] }, new int[] { 1, -1 },
                            LinearProgram.Relation.LESS_EQUAL, 0);
                    column.add(x[v][k]);
                }
                var indices = new int[column.size() + 1];
                var coefficients = new int[column.size() + 1];
                indices[0] = c[k];
                coefficients[0] = 1;
                for (int i = 0; i < column.size(); i++) {
                    indices[i + 1] = column.get(i);
                    coefficients[i + 1] = -1;
                }
                builder.constraint(indices, coefficients, LinearProgram.Relation.LESS_EQUAL, 0);
            }
            for (int k = 0; k + 1 < bound; k++) {
                builder.constraint(new int[] { c[k + 1], c[k] }, new int[] { 1, -1 },
                        LinearProgram.Relation.LESS_EQUAL, 0);
            }
            if (!names.isEmpty()) {
                var cliques = new BronKerboschCliqueFinder<>(graph).iterator();
                if (cliques.hasNext()) {
                    var clique = new TreeSet<>(cliques.next());
                    if (clique.size() > bound) {
                        throw new InfeasibilityException(
                                "Clique of size %d does not fit in %d resources".formatted(clique.size(), bound));
                    }
                    int k = 0;
                    for (var name : clique) {
                        builder.constraint(new int[] { x[index.get(name)][k] }, new int[] { 1 },
                                LinearProgram.Relation.EQUAL, 1);
                        builder.constraint(new int[] { c[k] }, new int[] { 1 }, LinearProgram.Relation.EQUAL, 1);
                        k++;
                    }
                }
            }
            allNodes.add(names);
            allX.add(x);
            allC.add(c);
            allIndices.add(index);
        }
        var connections = new LinkedHashMap<String, Integer>();
        if (links != null) {
            for (var link : links) {
                var source = allIndices.get(link.sourceGraph()).get(link.source());
                var target = allIndices.get(link.targetGraph()).get(link.target());
                if (source == null || target == null) {
                    throw new IllegalArgumentException("Link %s refers to an unknown node".formatted(link));
                }
                var sourceX = allX.get(link.sourceGraph())[source];
                var targetX = allX.get(link.targetGraph())[target];
                for (int ks = 0; ks < sourceX.length; ks++) {
                    for (int kt = 0; kt < targetX.length; kt++) {
                        var name = "y[%d][%d][%d][%d][%d][%d]".formatted(link.sourceGraph(), ks, link.sourcePort(),
                                link.targetGraph(), kt, link.targetPort());
                        int y = connections.computeIfAbsent(name, n -> {
                            int variable = builder.binaryVariable(n);
                            builder.minimize(variable, 1);
                            return variable;
                        });
                        // y >= x[source][ks] + x[target][kt] - 1
                        builder.constraint(new int[] { sourceX[ks], targetX[kt], y }, new int[] { 1, 1, -1 },
                                LinearProgram.Relation.LESS_EQUAL, 1);
                    }
                }
            }
        }
        return new ColoringFormulation(builder.build(), allNodes, allX, allC, List.copyOf(connections.values()));
    }

    public LinearProgram program() {
        return program;
    }

    /**
     * @return the number of connections between colors set in a solution, 0
     *         when colors are minimized instead.
     */
    public int connectionCount(MilpSolution solution) {
        return (int) connectionVariables.stream().filter(y -> solution.value(y) == 1).count();
    }

    /**
     * Reads the colors out of a solution, renumbered 0, 1, ... in color order.
     *
     * @return per graph, node name to color.
     */
    public List<Map<String, Integer>> colors(MilpSolution solution) {
        var result = new ArrayList<Map<String, Integer>>();
        for (int g = 0; g < nodes.size(); g++) {
            var names = nodes.get(g);
            var x = nodeColorVariables.get(g);
            int bound = colorVariables.get(g).length;
            var raw = new TreeMap<String, Integer>();
            for (int v = 0; v < names.size(); v++) {
                for (int k = 0; k < bound; k++) {
                    if (solution.value(x[v][k]) == 1) {
                        raw.put(names.get(v), k);
                    }
                }
            }
            var used = new TreeSet<>(raw.values());
            var dense = new TreeMap<Integer, Integer>();
            for (var k : used) {
                dense.put(k, dense.size());
            }
            var colors = new LinkedHashMap<String, Integer>();
            for (var name : names) {
                colors.put(name, dense.get(raw.get(name)));
            }
            result.add(colors);
        }
        return result;
    }
}
