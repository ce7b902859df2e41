package edu.cmu.cs.cs15745.isle;

import static edu.cmu.cs.cs15745.isle.GraphFixtures.graph;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.ind;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.pointsTo;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.isle.benchmarking.Shapes;
import edu.cmu.cs.cs15745.isle.graph.EdgeKind;
import edu.cmu.cs.cs15745.isle.graph.GraphFacts;
import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.unfold.DefinitionMaterializer;
import edu.cmu.cs.cs15745.isle.unfold.Materializer;
import edu.cmu.cs.cs15745.isle.unfold.Unfolding;

/**
 * Backtracking over unfoldings.
 */
public class TestUnfolder {

  // Records the nodes unfolded and the preference asked for.
  static class CountingMaterializer implements Materializer {
    final Materializer inner = new DefinitionMaterializer();
    final List<Integer> nodes = new ArrayList<>();
    final List<Boolean> preferences = new ArrayList<>();

    @Override
    public List<Unfolding> materialize(boolean submem, boolean preferEmpty, int node, HeapGraph graph) {
      nodes.add(node);
      preferences.add(preferEmpty);
      return inner.materialize(submem, preferEmpty, node, graph);
    }
  }

  @Test
  public void emptyAlternativeFailsThenRecursiveOneSucceeds() {
    var left = pointsTo(graph(0, 1), 0, 1);
    var right = ind(graph(10), 10, Shapes.list());
    var facts = GraphFacts.of(left).bind(1, 0);
    var s = state(left, right, Map.of(10, 0), true, Set.of(), facts);

    var materializer = new CountingMaterializer();
    var unfolder = new Unfolder(materializer, new InclusionSearch(materializer));
    var outcome = unfolder.unfold(true, s, 0, 10);

    Assert.assertTrue(outcome.toString(), outcome.isSuccess());
    // The list at 10, then the list at its successor, mapped to the null node.
    Assert.assertEquals(2, materializer.nodes.size());
    Assert.assertEquals(Integer.valueOf(10), materializer.nodes.get(0));
    var end = outcome.value();
    Assert.assertTrue(end.success());
    int next = materializer.nodes.get(1);
    Assert.assertEquals(Integer.valueOf(1), end.embedding().lookup(next).get());
    Assert.assertEquals(Set.of(0), end.consumedLeft());
    // The state the unfolding started from is left as it was.
    Assert.assertEquals(EdgeKind.INDUCTIVE, s.right().kind(10));
    Assert.assertEquals(EdgeKind.POINTS_TO, s.left().kind(0));
  }

  @Test
  public void noSuccessfulBranch() {
    // Nothing proves that 1 is null: the list cannot end there.
    var left = pointsTo(graph(0, 1), 0, 1);
    var right = ind(graph(10), 10, Shapes.list());
    var s = state(left, right, Map.of(10, 0), true, Set.of(), GraphFacts.of(left));
    var materializer = new CountingMaterializer();
    var unfolder = new Unfolder(materializer, new InclusionSearch(materializer));
    var outcome = unfolder.unfold(true, s, 0, 10);
    Assert.assertFalse(outcome.isSuccess());
    Assert.assertEquals(Unfolder.NO_BRANCH, outcome.reason());
  }

  @Test
  public void preferNonEmptyStillTriesEmptyAlternative() {
    // The right list at 10 is empty, its node mapped to a null left node.
    var left = graph(0);
    var right = ind(graph(10), 10, Shapes.list());
    var facts = GraphFacts.of(left).bind(0, 0);
    var s = state(left, right, Map.of(10, 0), true, Set.of(), facts);
    var materializer = new CountingMaterializer();
    var unfolder = new Unfolder(materializer, new InclusionSearch(materializer));
    var outcome = unfolder.unfold(s, new Rule(RuleKind.UNFOLD_PREFER_NON_EMPTY, 0, 10));
    Assert.assertTrue(outcome.isSuccess());
    Assert.assertEquals(List.of(false), materializer.preferences);
  }

  @Test
  public void preferNonEmptyFallsBackToPreferEmpty() {
    var left = graph(0);
    var right = ind(graph(10), 10, Shapes.list());
    var facts = GraphFacts.of(left).bind(0, 0);
    var s = state(left, right, Map.of(10, 0), true, Set.of(), facts);
    // Only offers alternatives when the empty ones come first.
    var materializer = new CountingMaterializer() {
      @Override
      public List<Unfolding> materialize(boolean submem, boolean preferEmpty, int node, HeapGraph graph) {
        var result = super.materialize(submem, preferEmpty, node, graph);
        return preferEmpty ? result : List.of();
      }
    };
    var unfolder = new Unfolder(materializer, new InclusionSearch(materializer));
    var outcome = unfolder.unfold(s, new Rule(RuleKind.UNFOLD_PREFER_NON_EMPTY, 0, 10));
    Assert.assertTrue(outcome.isSuccess());
    Assert.assertEquals(List.of(false, true), materializer.preferences);
  }

  @Test
  public void structuralRuleIsNotUnfolding() {
    var s = state(graph(0), graph(10), Map.of(10, 0), true, Set.of(), GraphFacts.of(graph(0)));
    var materializer = new CountingMaterializer();
    var unfolder = new Unfolder(materializer, new InclusionSearch(materializer));
    Assert.assertThrows(InclusionError.class, () -> unfolder.unfold(s, new Rule(RuleKind.PT_PT, 0, 10)));
  }
}
