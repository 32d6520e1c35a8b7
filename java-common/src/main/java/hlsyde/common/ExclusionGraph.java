package hlsyde.common;

import org.jgrapht.Graph;
import org.jgrapht.alg.color.SaturationDegreeColoring;
import org.jgrapht.alg.interfaces.VertexColoringAlgorithm;
import org.jgrapht.graph.DefaultEdge;

import java.util.ArrayList;
import java.util.List;

/**
 * A collection together with a graph over its process names in which adjacent
 * processes must not share a resource.
 */
public record ExclusionGraph(ProcessCollection collection, Graph<String, DefaultEdge> graph) {

    public int degreeOf(String name) {
        return graph.degreeOf(name);
    }

    public boolean excludes(String a, String b) {
        return graph.containsEdge(a, b);
    }

    public VertexColoringAlgorithm.Coloring<String> saturationDegreeColoring() {
        return new SaturationDegreeColoring<>(graph).getColoring();
    }

    /**
     * Colors the graph greedily by saturation degree and returns one collection
     * per color, in color order.
     */
    public List<ProcessCollection> colorClasses() {
        var coloring = saturationDegreeColoring();
        var cells = new ArrayList<ProcessCollection>();
        for (int i = 0; i < coloring.getNumberColors(); i++) {
            cells.add(collection.emptyCopy());
        }
        for (var process : collection) {
            cells.get(coloring.getColors().get(process.name())).addProcess(process);
        }
        return cells;
    }
}
