package edu.cmu.cs.cs15745.isle;

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
import edu.cmu.cs.cs15745.isle.graph.GraphDisequality;
import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.graph.Predicate;
import edu.cmu.cs.cs15745.isle.num.FactBase;

public class TestRuleClassifier {
  private final Predicate list = Shapes.list();

  private static Optional<RuleKind> classify(HeapGraph left, HeapGraph right, Map<Integer, Integer> map,
      Set<Integer> hint, Set<Integer> segmentEnds) {
    var s = new InclusionState(left, right, NodeEmbedding.of(map), Set.of(), false, true, Optional.of(hint),
        segmentEnds, new FactBase(), new GraphDisequality(left), InclusionFlags.defaults());
    return RuleClassifier.classify(s, 0, 10);
  }

  private static Optional<RuleKind> classify(HeapGraph left, HeapGraph right) {
    return classify(left, right, Map.of(10, 0), Set.of(), Set.of());
  }

  @Test
  public void structuralPairs() {
    Assert.assertEquals(Optional.of(RuleKind.PT_PT),
        classify(pointsTo(graph(0, 1), 0, 1), pointsTo(graph(10, 11), 10, 11)));
    Assert.assertEquals(Optional.of(RuleKind.IND_IND), classify(ind(graph(0), 0, list), ind(graph(10), 10, list)));
    Assert.assertEquals(Optional.of(RuleKind.SEG_SEG),
        classify(seg(graph(0, 1), 0, list, 1), seg(graph(10, 11), 10, list, 11)));
    Assert.assertEquals(Optional.of(RuleKind.SEG_IND), classify(seg(graph(0, 1), 0, list, 1), ind(graph(10), 10, list)));
  }

  @Test
  public void unfoldingPairs() {
    Assert.assertEquals(Optional.of(RuleKind.UNFOLD_PREFER_EMPTY), classify(graph(0), ind(graph(10), 10, list)));
    Assert.assertEquals(Optional.of(RuleKind.UNFOLD_PREFER_NON_EMPTY),
        classify(pointsTo(graph(0, 1), 0, 1), ind(graph(10), 10, list)));
    Assert.assertEquals(Optional.of(RuleKind.UNFOLD_PREFER_NON_EMPTY),
        classify(pointsTo(graph(0, 1), 0, 1), seg(graph(10, 11), 10, list, 11)));
    Assert.assertEquals(Optional.of(RuleKind.UNFOLD_PREFER_EMPTY),
        classify(ind(graph(0), 0, list), seg(graph(10, 11), 10, list, 11)));
  }

  @Test
  public void emptySegmentDependsOnItsEnd() {
    var right = seg(graph(10, 11), 10, list, 11);
    Assert.assertEquals(Optional.of(RuleKind.UNFOLD_PREFER_EMPTY), classify(graph(0), right));
    Assert.assertEquals(Optional.of(RuleKind.VOID_SEG),
        classify(graph(0), right, Map.of(10, 0, 11, 0), Set.of(), Set.of()));
  }

  @Test
  public void noRule() {
    // Right empty.
    Assert.assertEquals(Optional.empty(), classify(pointsTo(graph(0, 1), 0, 1), graph(10)));
    // Left never unfolded.
    Assert.assertEquals(Optional.empty(), classify(ind(graph(0), 0, list), pointsTo(graph(10, 11), 10, 11)));
    Assert.assertEquals(Optional.empty(), classify(graph(0), pointsTo(graph(10, 11), 10, 11)));
    // Missing node.
    Assert.assertEquals(Optional.empty(), classify(graph(1), ind(graph(10), 10, list)));
  }

  @Test
  public void stopAndSegmentEnds() {
    var left = ind(graph(0), 0, list);
    var right = ind(graph(10), 10, list);
    Assert.assertEquals(Optional.of(RuleKind.STOP), classify(left, right, Map.of(10, 0), Set.of(0), Set.of()));
    Assert.assertEquals(Optional.empty(), classify(left, right, Map.of(10, 0), Set.of(), Set.of(0)));
    Assert.assertEquals(Optional.empty(), classify(left, right, Map.of(10, 0), Set.of(0), Set.of(0)));
  }

  @Test
  public void staleRules() {
    var s = new InclusionState(pointsTo(graph(0, 1), 0, 1), pointsTo(graph(10, 11), 10, 11), new NodeEmbedding(),
        Set.of(), false, true, Optional.empty(), Set.of(), new FactBase(), new GraphDisequality(graph()),
        InclusionFlags.defaults());
    var rule = new Rule(RuleKind.PT_PT, 0, 10);
    Assert.assertTrue(RuleClassifier.isCurrent(s, rule));
    s.right().removeEdge(10);
    Assert.assertFalse(RuleClassifier.isCurrent(s, rule));
  }
}
