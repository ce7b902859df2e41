package edu.cmu.cs.cs15745.isle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.isle.num.NumConstraint;
import edu.cmu.cs.cs15745.isle.num.Relation;

/**
 * Final step of a branch, once no rule applies: checks that the graphs were consumed,
 * then proves the constraints collected on right nodes in the left argument.
 * <ol>
 * <li>constraints whose variables are all mapped are translated to left nodes;</li>
 * <li>equalities {@code x = y} with one side mapped map the other side alike, and
 * the constraints left over are translated again;</li>
 * <li>what still cannot be translated must read {@code i = e}, with i instantiable
 * and e translatable, and becomes an instantiation of i;</li>
 * <li>translated constraints must hold in the left argument, disequalities between
 * two nodes may also be proven by the shape of the left graph.</li>
 * </ol>
 */
final class ObligationDischarge {
  private static final Logger logger = LogManager.getLogger(ObligationDischarge.class);

  private ObligationDischarge() { }

  /** Residual constraints are cleared on return, whatever the outcome. */
  static void discharge(InclusionState s) throws NotIncludedException {
    try {
      prove(s);
    } finally {
      s.residual().clear();
    }
  }

  private static void prove(InclusionState s) throws NotIncludedException {
    int leftEdges = s.left().numEdges();
    int rightEdges = s.right().numEdges();
    logger.debug("Return from is_le: {} | {}", leftEdges, rightEdges);
    if ((s.empBoth() && leftEdges != 0) || rightEdges != 0) {
      s.setSuccess(false);
      return;
    }
    var embedding = s.embedding();
    List<NumConstraint> translated = new ArrayList<>();
    List<NumConstraint> pending = translate(s, s.residual(), translated);

    for (var c : pending) {
      if (c.relation() != Relation.EQ) {
        continue;
      }
      var x = c.lhs().asVariable();
      var y = c.rhs().asVariable();
      if (x.isEmpty() || y.isEmpty()) {
        continue;
      }
      int i = x.get();
      int j = y.get();
      if (embedding.contains(i) && !embedding.contains(j)) {
        embedding.add(j, embedding.find(i));
      } else if (embedding.contains(j) && !embedding.contains(i)) {
        embedding.add(i, embedding.find(j));
      }
    }
    pending = translate(s, pending, translated);

    var instantiations = new LinkedHashMap<>(s.instantiations());
    for (var c : pending) {
      var i = c.lhs().asVariable();
      if (c.relation() != Relation.EQ || i.isEmpty()) {
        throw new NotIncludedException("failed to find instantiable constraint: " + c);
      }
      if (!s.instantiable().contains(i.get())) {
        throw new NotIncludedException("non instantiable node: " + i.get());
      }
      var e = c.rhs().rename(embedding::lookup)
          .orElseThrow(() -> new NotIncludedException("cannot translate " + c.rhs()));
      if (instantiations.containsKey(i.get())) {
        throw new NotIncludedException("node cannot be instantiated twice: " + i.get());
      }
      logger.debug("Instantiating {} with {}", i.get(), e);
      instantiations.put(i.get(), e);
    }

    List<NumConstraint> remaining = new ArrayList<>();
    for (var c : translated) {
      boolean holds = s.leftSat().sat(c) || isDistinctPair(s, c);
      logger.debug("Verifying constraint on left node: {} => {}", c, holds);
      if (!holds) {
        remaining.add(c);
      }
    }
    s.setInstantiations(instantiations);
    s.setSuccess(remaining.isEmpty());
  }

  /** Translates what can be; returns the constraints that cannot, in order. */
  private static List<NumConstraint> translate(InclusionState s, List<NumConstraint> constraints,
      List<NumConstraint> translated) {
    List<NumConstraint> rest = new ArrayList<>();
    for (var c : constraints) {
      Optional<NumConstraint> t = c.rename(s.embedding()::lookup);
      if (t.isPresent()) {
        translated.add(t.get());
      } else {
        logger.debug("Renaming fails: {}", c);
        rest.add(c);
      }
    }
    return rest;
  }

  private static boolean isDistinctPair(InclusionState s, NumConstraint c) {
    if (c.relation() != Relation.DISEQ) {
      return false;
    }
    var x = c.lhs().asVariable();
    var y = c.rhs().asVariable();
    return x.isPresent() && y.isPresent() && s.leftDiseq().distinct(x.get(), y.get());
  }
}
