package edu.cmu.cs.cs15745.isle;

import static edu.cmu.cs.cs15745.isle.GraphFixtures.checker;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.graph;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.ind;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.pointsTo;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.seg;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.isle.benchmarking.Shapes;
import edu.cmu.cs.cs15745.isle.graph.Allocation;
import edu.cmu.cs.cs15745.isle.graph.Args;
import edu.cmu.cs.cs15745.isle.graph.Edge;
import edu.cmu.cs.cs15745.isle.graph.GraphFacts;
import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.graph.NodeType;
import edu.cmu.cs.cs15745.isle.num.FactBase;

/**
 * Full inclusion checks, end to end.
 */
public class TestInclusion {

  private static Optional<Map<Integer, Integer>> check(HeapGraph left, HeapGraph right, Map<Integer, Integer> map) {
    return checker().checkInclusion(false, left, Optional.empty(), GraphFacts.of(left), right, map);
  }

  @Test
  public void pointsToMatch() {
    var left = pointsTo(graph(0, 1), 0, 1);
    var right = pointsTo(graph(10, 11), 10, 11);
    var result = check(left, right, Map.of(10, 0));
    Assert.assertEquals(Optional.of(Map.of(10, 0, 11, 1)), result);
  }

  @Test
  public void sizeMismatch() {
    var left = pointsTo(graph(0, 1, 2), 0, 1, 2);
    var right = pointsTo(graph(10, 11), 10, 11);
    Assert.assertEquals(Optional.empty(), check(left, right, Map.of(10, 0)));
  }

  @Test
  public void inputsAreNotModified() {
    var left = pointsTo(graph(0, 1), 0, 1);
    var right = pointsTo(graph(10, 11), 10, 11);
    check(left, right, Map.of(10, 0));
    Assert.assertEquals(1, left.numEdges());
    Assert.assertEquals(1, right.numEdges());
  }

  @Test
  public void allocationMismatchIsFatal() {
    var left = new HeapGraph().addNode(0, NodeType.ADDR, Allocation.heap("r1")).addNode(1, NodeType.ADDR);
    pointsTo(left, 0, 1);
    var right = new HeapGraph().addNode(10, NodeType.ADDR, Allocation.stack()).addNode(11, NodeType.ADDR);
    pointsTo(right, 10, 11);
    Assert.assertThrows(InclusionError.class, () -> check(left, right, Map.of(10, 0)));
  }

  @Test
  public void subMemorySkipsAllocationCheck() {
    var left = new HeapGraph().addNode(0, NodeType.ADDR, Allocation.heap("r1")).addNode(1, NodeType.ADDR);
    pointsTo(left, 0, 1);
    var right = new HeapGraph().addNode(10, NodeType.ADDR, Allocation.stack()).addNode(11, NodeType.ADDR);
    pointsTo(right, 10, 11);
    var result = checker().checkInclusion(true, left, Optional.empty(), new FactBase(), right, Map.of(10, 0));
    Assert.assertTrue(result.isPresent());
  }

  @Test
  public void reflexivity() {
    var list = Shapes.list();
    var g = ind(pointsTo(graph(0, 1), 0, 1), 1, list);
    var result = check(g, g.copy(), Map.of(0, 0));
    Assert.assertEquals(Optional.of(Map.of(0, 0, 1, 1)), result);
  }

  @Test
  public void reflexivityOfSegments() {
    var list = Shapes.list();
    var g = ind(seg(graph(0, 1), 0, list, 1), 1, list);
    var result = check(g, g.copy(), Map.of(0, 0));
    Assert.assertEquals(Optional.of(Map.of(0, 0, 1, 1)), result);
  }

  @Test
  public void concreteListIsList() {
    var left = Shapes.concreteList(3);
    var facts = GraphFacts.of(left).bind(3, 0);
    var result = checker().checkInclusion(false, left, Optional.empty(), facts, Shapes.abstractShape(Shapes.list()),
        Map.of(0, 0));
    Assert.assertTrue(result.isPresent());
    var map = result.get();
    Assert.assertEquals(Integer.valueOf(0), map.get(0));
    // One right node per left node, the null node included.
    Assert.assertEquals(Set.of(0, 1, 2, 3), Set.copyOf(map.values()));
  }

  @Test
  public void listWithoutNullEndIsNotList() {
    var left = Shapes.concreteList(2);
    var result = check(left, Shapes.abstractShape(Shapes.list()), Map.of(0, 0));
    Assert.assertEquals(Optional.empty(), result);
  }

  @Test
  public void segmentPeeling() {
    var list = Shapes.list();
    // a *= nullL  against  a *= b * b *= nullR
    var left = seg(graph(0, 1), 0, list, 1);
    var right = seg(seg(graph(10, 11, 12), 10, list, 11), 11, list, 12);
    var result = check(left, right, Map.of(10, 0));
    Assert.assertTrue(result.isPresent());
    Assert.assertEquals(Integer.valueOf(0), result.get().get(10));
    Assert.assertEquals(Integer.valueOf(1), result.get().get(12));
    Assert.assertEquals(Integer.valueOf(1), result.get().get(11));
  }

  @Test
  public void ruleRequeuedWhenSiteChangesKind() {
    var list = Shapes.list();
    // 5@0 -> 0 * emp  against  12@0 -> 11 * 10 *= 11: the segment end is only
    // mapped once the points-to edges are matched, the segment is then empty.
    var left = pointsTo(graph(0, 5), 5, 0);
    var right = seg(pointsTo(graph(10, 11, 12), 12, 11), 10, list, 11);
    var result = check(left, right, Map.of(10, 0, 12, 5));
    Assert.assertEquals(Optional.of(Map.of(10, 0, 11, 0, 12, 5)), result);
    // Same inclusion with the segment end mapped from the start.
    var seeded = check(left, right, Map.of(10, 0, 11, 0, 12, 5));
    Assert.assertEquals(result, seeded);
  }

  private static void assertVerdict(boolean included, String name, HeapGraph left, FactBase facts, HeapGraph right) {
    var initial = Map.of(0, 0);
    var result = checker().checkInclusion(false, left, Optional.empty(), facts, right, initial);
    Assert.assertEquals(name, included, result.isPresent());
    if (result.isPresent()) {
      for (var entry : initial.entrySet()) {
        Assert.assertEquals(name, entry.getValue(), result.get().get(entry.getKey()));
      }
      // Every right node mapped lands on a left node.
      for (var target : result.get().values()) {
        Assert.assertTrue(name, left.contains(target));
      }
    }
  }

  @Test
  public void smallShapes() {
    var list = Shapes.list();
    var tree = Shapes.tree();
    for (int length = 0; length <= 3; length++) {
      var concrete = Shapes.concreteList(length);
      assertVerdict(true, "null terminated list " + length, concrete, GraphFacts.of(concrete).bind(length, 0),
          Shapes.abstractShape(list));
      assertVerdict(false, "unterminated list " + length, concrete, GraphFacts.of(concrete),
          Shapes.abstractShape(list));
    }
    for (int length = 1; length <= 3; length++) {
      var abstractList = Shapes.abstractShape(list);
      assertVerdict(false, "list in concrete list " + length, abstractList, GraphFacts.of(abstractList),
          Shapes.concreteList(length));
    }
    for (int segments = 1; segments <= 3; segments++) {
      var chain = Shapes.segmentChain(list, segments);
      assertVerdict(true, "segments " + segments, chain, GraphFacts.of(chain), Shapes.abstractShape(list));
    }
    for (int depth = 1; depth <= 2; depth++) {
      var concrete = Shapes.concreteTree(depth);
      assertVerdict(true, "tree " + depth, concrete, GraphFacts.of(concrete).bind(1, 0), Shapes.abstractShape(tree));
    }
  }

  @Test
  public void segmentThenListIsList() {
    var list = Shapes.list();
    var left = ind(seg(graph(0, 1), 0, list, 1), 1, list);
    var right = ind(graph(10), 10, list);
    var result = check(left, right, Map.of(10, 0));
    Assert.assertTrue(result.isPresent());
    Assert.assertEquals(2, result.get().size());
    // The right list is split at the end of the left segment.
    Assert.assertTrue(result.get().containsValue(1));
  }

  @Test
  public void emptySegmentMatchesNothing() {
    var list = Shapes.list();
    var left = graph(0);
    var right = seg(graph(10, 11), 10, list, 11);
    var result = check(left, right, Map.of(10, 0, 11, 0));
    Assert.assertEquals(Optional.of(Map.of(10, 0, 11, 0)), result);
  }

  @Test
  public void emptySegmentIdentifiesItsArguments() {
    var listTo = GraphFixtures.listTo();
    var left = graph(0, 5);
    var right = graph(10, 11, 12, 13);
    right.setEdge(10, new Edge.Segment(listTo, Args.ptr(12), Args.ptr(13), 11));
    var result = check(left, right, Map.of(10, 0, 11, 0, 12, 5));
    Assert.assertTrue(result.isPresent());
    Assert.assertEquals(Integer.valueOf(5), result.get().get(13));
  }

  @Test
  public void emptySegmentWithUnknownArgumentsFails() {
    var listTo = GraphFixtures.listTo();
    var left = graph(0);
    var right = graph(10, 11, 12, 13);
    right.setEdge(10, new Edge.Segment(listTo, Args.ptr(12), Args.ptr(13), 11));
    Assert.assertEquals(Optional.empty(), check(left, right, Map.of(10, 0, 11, 0)));
  }

  @Test
  public void segmentIntoNonEmptyRegionIsUnsupported() {
    var list = Shapes.list();
    var left = pointsTo(graph(0, 1, 2), 1, 2);
    var right = seg(graph(10, 11), 10, list, 11);
    Assert.assertThrows(UnsupportedInclusionCase.class, () -> check(left, right, Map.of(10, 0, 11, 1)));
  }

  @Test
  public void distinctPredicatesAreFatal() {
    var left = ind(graph(0), 0, Shapes.list());
    var right = ind(graph(10), 10, Shapes.tree());
    Assert.assertThrows(InclusionError.class, () -> check(left, right, Map.of(10, 0)));
  }

  @Test
  public void segmentAgainstOtherPredicateIsUnsupported() {
    var list = Shapes.list();
    var left = seg(graph(0, 1), 0, list, 1);
    var right = ind(graph(10), 10, Shapes.tree());
    Assert.assertThrows(UnsupportedInclusionCase.class, () -> check(left, right, Map.of(10, 0)));
  }

  @Test
  public void leftoverLeftEdgeFails() {
    var left = pointsTo(pointsTo(graph(0, 1, 2), 0, 1), 1, 2);
    var right = pointsTo(graph(10, 11), 10, 11);
    Assert.assertEquals(Optional.empty(), check(left, right, Map.of(10, 0)));
  }

  @Test
  public void conflictingDestinationsFail() {
    // Two cells of the right block point to the same node, not so on the left.
    var left = pointsTo(graph(0, 1, 2), 0, 1, 2);
    var right = pointsTo(graph(10, 11), 10, 11, 11);
    Assert.assertEquals(Optional.empty(), check(left, right, Map.of(10, 0)));
  }

  @Test
  public void stopNodeLeftoverIsFatal() {
    var list = Shapes.list();
    var left = pointsTo(graph(0, 1), 0, 1);
    var right = ind(pointsTo(graph(10, 11), 10, 11), 11, list);
    Assert.assertThrows(InclusionError.class, () -> checker().checkInclusion(false, left, Optional.of(Set.of(1)),
        GraphFacts.of(left), right, Map.of(10, 0)));
  }
}
