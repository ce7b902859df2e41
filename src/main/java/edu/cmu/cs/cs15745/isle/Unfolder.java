package edu.cmu.cs.cs15745.isle;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.isle.unfold.Materializer;

/**
 * Case split on a right predicate. Each unfolding is explored on a copy of the state,
 * in the order the materializer gives them; the first one that succeeds wins.
 */
final class Unfolder {
  private static final Logger logger = LogManager.getLogger(Unfolder.class);

  static final String NO_BRANCH = "unfold: no successful branch";

  private final Materializer materializer;
  private final InclusionSearch search;

  Unfolder(Materializer materializer, InclusionSearch search) {
    this.materializer = materializer;
    this.search = search;
  }

  Outcome<InclusionState> unfold(InclusionState s, Rule rule) {
    switch (rule.kind()) {
    case UNFOLD_PREFER_EMPTY:
      return unfold(true, s, rule.left(), rule.right());
    case UNFOLD_PREFER_NON_EMPTY:
      var outcome = unfold(false, s, rule.left(), rule.right());
      if (outcome.isSuccess()) {
        return outcome;
      }
      return unfold(true, s, rule.left(), rule.right());
    default:
      throw new InclusionError("not an unfolding rule: " + rule);
    }
  }

  /** Try every alternative; {@code s} itself is left untouched. */
  Outcome<InclusionState> unfold(boolean preferEmpty, InclusionState s, int il, int ir) {
    logger.debug("IsLe triggering unfolding<{}> at ({}, {})", preferEmpty, il, ir);
    var alternatives = materializer.materialize(s.submem(), preferEmpty, ir, s.right());
    logger.debug("IsLe performed unfolding: {}", alternatives.size());
    for (var alternative : alternatives) {
      var branch = s.copy();
      branch.installRight(alternative.graph());
      branch.prependResidual(alternative.constraints());
      RuleClassifier.collect(branch, il, ir);
      var outcome = search.start(branch);
      if (outcome.isSuccess()) {
        return outcome;
      }
      logger.debug("Alternative failed: {}", outcome.reason());
    }
    return Outcome.failure(NO_BRANCH);
  }
}
