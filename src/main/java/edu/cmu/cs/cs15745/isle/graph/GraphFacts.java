package edu.cmu.cs.cs15745.isle.graph;

import edu.cmu.cs.cs15745.isle.num.FactBase;
import edu.cmu.cs.cs15745.isle.num.NumConstraint;
import edu.cmu.cs.cs15745.isle.num.NumExpr;

/** Numeric facts implied by the shape of a graph. */
public final class GraphFacts {
	private GraphFacts() { }

	/** Every node that owns memory is a valid, hence non-null, address. */
	public static FactBase of(HeapGraph graph) {
		var facts = new FactBase();
		for (int id : graph.nodeIds()) {
			if (graph.kind(id) == EdgeKind.POINTS_TO) {
				facts.assume(NumConstraint.diseq(NumExpr.var(id), NumExpr.constant(0)));
			}
		}
		return facts;
	}
}
