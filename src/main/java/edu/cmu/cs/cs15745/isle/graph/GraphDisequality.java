package edu.cmu.cs.cs15745.isle.graph;

import java.util.LinkedHashSet;
import java.util.Set;

import edu.cmu.cs.cs15745.isle.num.DisequalityOracle;

/**
 * Disequalities that hold by separation: two distinct nodes that both own a
 * non-empty points-to block denote distinct addresses. The blocks are recorded when the
 * oracle is built, so later edge removals in the graph do not weaken it.
 */
public final class GraphDisequality implements DisequalityOracle {
	private final Set<Integer> owners = new LinkedHashSet<>();

	public GraphDisequality(HeapGraph graph) {
		for (int id : graph.nodeIds()) {
			var edge = graph.edge(id);
			if (edge.kind() == EdgeKind.POINTS_TO && ((Edge.PointsTo) edge).block().cardinal() > 0) {
				owners.add(id);
			}
		}
	}

	@Override
	public boolean distinct(int x, int y) {
		return x != y && owners.contains(x) && owners.contains(y);
	}
}
