package edu.cmu.cs.cs15745.isle;

import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.isle.unfold.Materializer;

/**
 * The rule loop: applies pending rules, best tier first, until none is left. Unfolding
 * rules hand over to the {@link Unfolder}, whose successful branch becomes the current
 * state.
 */
final class InclusionSearch {
  private static final Logger logger = LogManager.getLogger(InclusionSearch.class);

  private final Unfolder unfolder;

  InclusionSearch(Materializer materializer) {
    this.unfolder = new Unfolder(Objects.requireNonNull(materializer), this);
  }

  /** Apply rules until none is left; returns the state reached. */
  InclusionState run(InclusionState s) throws NotIncludedException {
    while (true) {
      var next = s.rules().next();
      if (next.isEmpty()) {
        if (s.flags().debugLevel() > 1) {
          logger.trace("IsLe-NoRule:\n{}", s);
        }
        return s;
      }
      var rule = next.get();
      if (!RuleClassifier.isCurrent(s, rule)) {
        // Edges or mappings at the site changed since it was scheduled: requeue under
        // its current kind, or drop it when nothing applies anymore.
        logger.debug("Reclassifying rule {}", rule);
        RuleClassifier.collect(s, rule.left(), rule.right());
        continue;
      }
      if (s.flags().debugLevel() > 0) {
        logger.debug("IsLe-Treating {}", rule);
      }
      if (s.flags().debugLevel() > 1) {
        logger.trace("{}Pending rules: {}", s, s.rules());
      }
      if (rule.kind().isUnfolding()) {
        var outcome = unfolder.unfold(s, rule);
        if (!outcome.isSuccess()) {
          throw new NotIncludedException(outcome.reason());
        }
        s = outcome.value();
      } else {
        RuleAppliers.apply(s, rule);
      }
    }
  }

  /**
   * Explore a branch to its end: rule loop then obligation discharge. Soft failures
   * come back as a failed outcome; fatal errors go through.
   */
  Outcome<InclusionState> start(InclusionState s) {
    try {
      var end = run(s);
      ObligationDischarge.discharge(end);
      if (end.success()) {
        return Outcome.success(end);
      }
      return Outcome.failure("obligations not discharged");
    } catch (NotIncludedException e) {
      logger.debug("Branch failed: {}", e.getMessage());
      return Outcome.failure(e.getMessage());
    }
  }
}
