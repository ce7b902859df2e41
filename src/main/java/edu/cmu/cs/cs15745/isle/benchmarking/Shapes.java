package edu.cmu.cs.cs15745.isle.benchmarking;

import java.util.List;

import edu.cmu.cs.cs15745.isle.graph.Allocation;
import edu.cmu.cs.cs15745.isle.graph.Args;
import edu.cmu.cs.cs15745.isle.graph.Block;
import edu.cmu.cs.cs15745.isle.graph.Cell;
import edu.cmu.cs.cs15745.isle.graph.Edge;
import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.graph.NodeType;
import edu.cmu.cs.cs15745.isle.graph.Predicate;
import edu.cmu.cs.cs15745.isle.graph.PredicateRule;
import edu.cmu.cs.cs15745.isle.graph.Ref;
import edu.cmu.cs.cs15745.isle.num.Relation;

/** Singly linked lists and binary trees, as predicates and as concrete graphs. */
public final class Shapes {
  private Shapes() { }

  /** list := emp, this = 0 | this@0 -> n * n.list(), this != 0 */
  public static Predicate list() {
    var list = new Predicate("list", 0, 0, true);
    return list.define(List.of(
        PredicateRule.empty()
            .constraint(Relation.EQ, Ref.owner(), Ref.nil())
            .build(),
        PredicateRule.nonEmpty()
            .fresh(NodeType.ADDR)
            .cell(0, 8, Ref.fresh(0))
            .call(Ref.fresh(0), list)
            .constraint(Relation.DISEQ, Ref.owner(), Ref.nil())
            .build()));
  }

  /** tree := emp, this = 0 | this@0 -> l, this@8 -> r * l.tree() * r.tree(), this != 0 */
  public static Predicate tree() {
    var tree = new Predicate("tree", 0, 0, true);
    return tree.define(List.of(
        PredicateRule.empty()
            .constraint(Relation.EQ, Ref.owner(), Ref.nil())
            .build(),
        PredicateRule.nonEmpty()
            .fresh(NodeType.ADDR)
            .fresh(NodeType.ADDR)
            .cell(0, 8, Ref.fresh(0))
            .cell(8, 8, Ref.fresh(1))
            .call(Ref.fresh(0), tree)
            .call(Ref.fresh(1), tree)
            .constraint(Relation.DISEQ, Ref.owner(), Ref.nil())
            .build()));
  }

  /**
   * Nodes 0 to length - 1 each point to the next one; node {@code length} is the null
   * node ending the list.
   */
  public static HeapGraph concreteList(int length) {
    var g = new HeapGraph();
    for (int i = 0; i <= length; i++) {
      g.addNode(i, NodeType.ADDR);
    }
    for (int i = 0; i < length; i++) {
      g.setEdge(i, new Edge.PointsTo(Block.of(Cell.of(0, 8, i + 1))));
    }
    return g;
  }

  /** Node 0 is the root; node 1 is the null node all leaves point to. */
  public static HeapGraph concreteTree(int depth) {
    var g = new HeapGraph();
    g.addNode(0, NodeType.ADDR);
    g.addNode(1, NodeType.ADDR);
    buildTree(g, 0, depth);
    return g;
  }

  private static void buildTree(HeapGraph g, int node, int depth) {
    int left = 1;
    int right = 1;
    if (depth > 1) {
      left = g.addFresh(NodeType.ADDR, Allocation.none());
      right = g.addFresh(NodeType.ADDR, Allocation.none());
      buildTree(g, left, depth - 1);
      buildTree(g, right, depth - 1);
    }
    g.setEdge(node, new Edge.PointsTo(Block.of(Cell.of(0, 8, left), Cell.of(8, 8, right))));
  }

  /** Node 0 starts {@code segments} list segments in a row, the last node owns a list. */
  public static HeapGraph segmentChain(Predicate predicate, int segments) {
    var g = new HeapGraph();
    for (int i = 0; i <= segments; i++) {
      g.addNode(i, NodeType.ADDR);
    }
    for (int i = 0; i < segments; i++) {
      g.setEdge(i, new Edge.Segment(predicate, Args.none(), Args.none(), i + 1));
    }
    g.setEdge(segments, new Edge.Inductive(predicate, Args.none()));
    return g;
  }

  /** A single node 0 owning an instance of the predicate. */
  public static HeapGraph abstractShape(Predicate predicate) {
    var g = new HeapGraph();
    g.addNode(0, NodeType.ADDR);
    g.setEdge(0, new Edge.Inductive(predicate, Args.none()));
    return g;
  }
}
