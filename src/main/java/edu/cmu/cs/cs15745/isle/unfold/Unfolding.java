package edu.cmu.cs.cs15745.isle.unfold;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.num.NumConstraint;

/**
 * One alternative of an unfolding: the rewritten graph, and the numeric constraints
 * (over its nodes) under which that alternative describes memory.
 */
public final class Unfolding {
  private final HeapGraph graph;
  private final List<NumConstraint> constraints;

  public Unfolding(HeapGraph graph, List<NumConstraint> constraints) {
    this.graph = Objects.requireNonNull(graph);
    this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
  }

  public HeapGraph graph() {
    return graph;
  }

  public List<NumConstraint> constraints() {
    return constraints;
  }

  @Override
  public String toString() {
    return String.format("%s\nConstraints: %s", graph, constraints);
  }
}
