package edu.cmu.cs.cs15745.isle.unfold;

import java.util.List;

import edu.cmu.cs.cs15745.isle.graph.HeapGraph;

/**
 * Unfolds the inductive or segment edge of one node into the finite list of cases of
 * its definition. Alternatives never carry pending node identifications: the graph of
 * each one is already rewritten, and identities it implies are returned as equality
 * constraints.
 */
public interface Materializer {
  /**
   * @param submem whether the graph describes a sub-memory (no allocation tracking)
   * @param preferEmpty whether empty cases come first
   * @param node the node whose edge gets unfolded
   * @param graph the graph, left untouched
   */
  List<Unfolding> materialize(boolean submem, boolean preferEmpty, int node, HeapGraph graph);
}
