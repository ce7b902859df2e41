package edu.cmu.cs.cs15745.isle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.num.DisequalityOracle;
import edu.cmu.cs.cs15745.isle.num.NumConstraint;
import edu.cmu.cs.cs15745.isle.num.NumExpr;
import edu.cmu.cs.cs15745.isle.num.SatOracle;

/**
 * Configuration of an inclusion check in progress.
 * <ul>
 * <li>the left graph, which only loses edges, and the right graph, which also gains
 * nodes and edges synthesized to align segments;</li>
 * <li>the embedding (right to left) and the pending rules;</li>
 * <li>the left nodes whose edge was consumed;</li>
 * <li>the constraints on right nodes that remain to be proven;</li>
 * <li>the right nodes that may be instantiated, and their instantiations;</li>
 * <li>the stop nodes and segment ends, the right edges set aside at stop nodes
 * (renamed into left nodes), and the oracles of the left argument.</li>
 * </ul>
 * States are mutable. Backtracking points work on {@link #copy()}.
 */
public final class InclusionState {
  private final HeapGraph left;
  private HeapGraph right;
  private final NodeEmbedding embedding;
  private final RuleWorklist rules;
  private final Set<Integer> consumedLeft;
  private final List<NumConstraint> residual;
  private final Set<Integer> instantiable;
  private Map<Integer, NumExpr> instantiations;
  private final boolean submem;
  private final boolean empBoth;
  private final Set<Integer> stopNodes; // null when no hint was given
  private final Set<Integer> segmentEnds;
  private final HeapGraph excluded;
  private boolean success;
  private final SatOracle leftSat;
  private final DisequalityOracle leftDiseq;
  private final InclusionFlags flags;

  InclusionState(HeapGraph left, HeapGraph right, NodeEmbedding embedding, Set<Integer> instantiable,
      boolean submem, boolean empBoth, Optional<Set<Integer>> hint, Set<Integer> segmentEnds,
      SatOracle leftSat, DisequalityOracle leftDiseq, InclusionFlags flags) {
    this(left, right, embedding, new RuleWorklist(), new LinkedHashSet<>(), new ArrayList<>(),
        new LinkedHashSet<>(instantiable), new LinkedHashMap<>(), submem, empBoth,
        hint.map(LinkedHashSet::new).orElse(null), new LinkedHashSet<>(segmentEnds), new HeapGraph(),
        false, leftSat, leftDiseq, flags);
  }

  private InclusionState(HeapGraph left, HeapGraph right, NodeEmbedding embedding, RuleWorklist rules,
      Set<Integer> consumedLeft, List<NumConstraint> residual, Set<Integer> instantiable,
      Map<Integer, NumExpr> instantiations, boolean submem, boolean empBoth, Set<Integer> stopNodes,
      Set<Integer> segmentEnds, HeapGraph excluded, boolean success, SatOracle leftSat,
      DisequalityOracle leftDiseq, InclusionFlags flags) {
    this.left = Objects.requireNonNull(left);
    this.right = Objects.requireNonNull(right);
    this.embedding = Objects.requireNonNull(embedding);
    this.rules = rules;
    this.consumedLeft = consumedLeft;
    this.residual = residual;
    this.instantiable = instantiable;
    this.instantiations = instantiations;
    this.submem = submem;
    this.empBoth = empBoth;
    this.stopNodes = stopNodes;
    this.segmentEnds = segmentEnds;
    this.excluded = excluded;
    this.success = success;
    this.leftSat = Objects.requireNonNull(leftSat);
    this.leftDiseq = Objects.requireNonNull(leftDiseq);
    this.flags = Objects.requireNonNull(flags);
  }

  /** Snapshot: nothing mutable is shared with the copy; the oracles are. */
  InclusionState copy() {
    return new InclusionState(left.copy(), right.copy(), embedding.copy(), rules.copy(),
        new LinkedHashSet<>(consumedLeft), new ArrayList<>(residual), instantiable,
        new LinkedHashMap<>(instantiations), submem, empBoth, stopNodes, segmentEnds, excluded.copy(),
        success, leftSat, leftDiseq, flags);
  }

  public HeapGraph left() {
    return left;
  }

  public HeapGraph right() {
    return right;
  }

  void installRight(HeapGraph graph) {
    right = Objects.requireNonNull(graph);
  }

  public NodeEmbedding embedding() {
    return embedding;
  }

  RuleWorklist rules() {
    return rules;
  }

  /** Left nodes whose edge was matched and removed. */
  public Set<Integer> consumedLeft() {
    return Collections.unmodifiableSet(consumedLeft);
  }

  void consume(int leftNode) {
    consumedLeft.add(leftNode);
  }

  List<NumConstraint> residual() {
    return residual;
  }

  /** Constraints of an unfolding go in front of those accumulated so far. */
  void prependResidual(List<NumConstraint> constraints) {
    residual.addAll(0, constraints);
  }

  public Set<Integer> instantiable() {
    return Collections.unmodifiableSet(instantiable);
  }

  /** Right node -> left expression it was instantiated with. */
  public Map<Integer, NumExpr> instantiations() {
    return Collections.unmodifiableMap(instantiations);
  }

  void setInstantiations(Map<Integer, NumExpr> instantiations) {
    this.instantiations = instantiations;
  }

  public boolean submem() {
    return submem;
  }

  public boolean empBoth() {
    return empBoth;
  }

  public boolean isStopNode(int leftNode) {
    return stopNodes != null && stopNodes.contains(leftNode);
  }

  public boolean isSegmentEnd(int leftNode) {
    return segmentEnds.contains(leftNode);
  }

  /** Right edges set aside at stop nodes, over left nodes. */
  public HeapGraph excluded() {
    return excluded;
  }

  public boolean success() {
    return success;
  }

  void setSuccess(boolean success) {
    this.success = success;
  }

  SatOracle leftSat() {
    return leftSat;
  }

  DisequalityOracle leftDiseq() {
    return leftDiseq;
  }

  InclusionFlags flags() {
    return flags;
  }

  @Override
  public String toString() {
    String sep = "------------------------------------------\n";
    return String.format("%sLeft:\n%s\nRight:\n%s\nInjection:\n%s%s", sep, left, right, embedding, sep);
  }
}
