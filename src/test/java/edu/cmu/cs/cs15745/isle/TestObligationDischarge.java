package edu.cmu.cs.cs15745.isle;

import static edu.cmu.cs.cs15745.isle.GraphFixtures.graph;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.pointsTo;
import static edu.cmu.cs.cs15745.isle.GraphFixtures.state;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.isle.num.FactBase;
import edu.cmu.cs.cs15745.isle.num.NumConstraint;
import edu.cmu.cs.cs15745.isle.num.NumExpr;
import edu.cmu.cs.cs15745.isle.num.Relation;

public class TestObligationDischarge {

  @Test
  public void instantiation() throws NotIncludedException {
    var s = state(graph(0), graph(10, 20), Map.of(10, 0), false, Set.of(20), new FactBase());
    s.prependResidual(List.of(NumConstraint.eq(NumExpr.var(20), NumExpr.var(10).plus(1))));
    ObligationDischarge.discharge(s);
    Assert.assertTrue(s.success());
    Assert.assertEquals(Map.of(20, NumExpr.var(0).plus(1)), s.instantiations());
    Assert.assertTrue(s.residual().isEmpty());
  }

  @Test
  public void nonInstantiableNode() {
    var s = state(graph(0), graph(10, 20), Map.of(10, 0), false, Set.of(), new FactBase());
    s.prependResidual(List.of(NumConstraint.eq(NumExpr.var(20), NumExpr.var(10).plus(1))));
    Assert.assertThrows(NotIncludedException.class, () -> ObligationDischarge.discharge(s));
    Assert.assertTrue(s.residual().isEmpty());
  }

  @Test(expected = NotIncludedException.class)
  public void instantiatedTwice() throws NotIncludedException {
    var s = state(graph(0, 1), graph(10, 11, 20), Map.of(10, 0, 11, 1), false, Set.of(20), new FactBase());
    s.prependResidual(List.of(
        NumConstraint.eq(NumExpr.var(20), NumExpr.var(10).plus(1)),
        NumConstraint.eq(NumExpr.var(20), NumExpr.var(11).plus(1))));
    ObligationDischarge.discharge(s);
  }

  @Test
  public void equalityMapsUnmappedSide() throws NotIncludedException {
    var s = state(graph(0), graph(10, 11), Map.of(10, 0), false, Set.of(), new FactBase());
    s.prependResidual(List.of(NumConstraint.eqVars(11, 10)));
    ObligationDischarge.discharge(s);
    Assert.assertTrue(s.success());
    Assert.assertEquals(Integer.valueOf(0), s.embedding().lookup(11).get());
  }

  @Test
  public void disequalityFromLeftShape() throws NotIncludedException {
    var left = pointsTo(pointsTo(graph(0, 1, 2), 0, 2), 1, 2);
    var s = state(left, graph(10, 11), Map.of(10, 0, 11, 1), false, Set.of(), new FactBase());
    s.prependResidual(List.of(NumConstraint.diseq(NumExpr.var(10), NumExpr.var(11))));
    ObligationDischarge.discharge(s);
    Assert.assertTrue(s.success());
  }

  @Test
  public void unprovableDisequality() throws NotIncludedException {
    var left = pointsTo(graph(0, 1, 2), 0, 2);
    var s = state(left, graph(10, 11), Map.of(10, 0, 11, 1), false, Set.of(), new FactBase());
    s.prependResidual(List.of(NumConstraint.diseq(NumExpr.var(10), NumExpr.var(11))));
    ObligationDischarge.discharge(s);
    Assert.assertFalse(s.success());
    Assert.assertTrue(s.residual().isEmpty());
  }

  @Test
  public void constraintsProvenByLeftFacts() throws NotIncludedException {
    var facts = new FactBase().bind(0, 4);
    var s = state(graph(0), graph(10), Map.of(10, 0), true, Set.of(), facts);
    s.prependResidual(List.of(
        new NumConstraint(Relation.SUP, NumExpr.var(10), NumExpr.constant(3)),
        NumConstraint.eq(NumExpr.var(10), NumExpr.constant(4))));
    ObligationDischarge.discharge(s);
    Assert.assertTrue(s.success());
  }

  @Test
  public void rightEdgesLeft() throws NotIncludedException {
    var s = state(graph(0, 1), pointsTo(graph(10, 11), 10, 11), Map.of(), false, Set.of(), new FactBase());
    ObligationDischarge.discharge(s);
    Assert.assertFalse(s.success());
  }

  @Test
  public void leftEdgesLeftOnlyMatterWhenBothMustBeEmpty() throws NotIncludedException {
    var left = pointsTo(graph(0, 1), 0, 1);
    var partial = state(left, graph(10), Map.of(), false, Set.of(), new FactBase());
    ObligationDischarge.discharge(partial);
    Assert.assertTrue(partial.success());

    var full = state(left.copy(), graph(10), Map.of(), true, Set.of(), new FactBase());
    ObligationDischarge.discharge(full);
    Assert.assertFalse(full.success());
  }
}
