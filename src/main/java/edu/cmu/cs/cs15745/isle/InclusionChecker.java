package edu.cmu.cs.cs15745.isle;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.isle.graph.GraphDisequality;
import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.num.NumExpr;
import edu.cmu.cs.cs15745.isle.num.SatOracle;
import edu.cmu.cs.cs15745.isle.unfold.Materializer;

/**
 * Entry points of the inclusion check of a right graph into a left graph. The
 * {@code initialMap} arguments give the known right node -> left node pairs, the
 * roots of the search. Input graphs are never modified.
 */
public final class InclusionChecker {
  private static final Logger logger = LogManager.getLogger(InclusionChecker.class);

  private final Materializer materializer;
  private final InclusionFlags flags;

  public InclusionChecker(Materializer materializer, InclusionFlags flags) {
    this.materializer = Objects.requireNonNull(materializer);
    this.flags = Objects.requireNonNull(flags);
  }

  /**
   * Full inclusion: both graphs must be consumed. Returns the extended right -> left
   * map when the inclusion holds.
   *
   * @param hint left nodes where right inductive edges are set aside instead of
   *        matched; any edge set aside makes this check fail fatally
   */
  public Optional<Map<Integer, Integer>> checkInclusion(boolean submem, HeapGraph left,
      Optional<Set<Integer>> hint, SatOracle leftSat, HeapGraph right, Map<Integer, Integer> initialMap) {
    var result = checkInclusionGeneric(Set.of(), submem, true, left, hint, Set.of(), leftSat, right, initialMap);
    if (result.isEmpty()) {
      return Optional.empty();
    }
    var s = result.get();
    if (s.excluded().numEdges() != 0) {
      throw new InclusionError("is_le did not completely consume right argument");
    }
    return Optional.of(s.embedding().image());
  }

  /**
   * Inclusion of the right graph into part of the left graph.
   *
   * @param searchInductive whether the caller looks for the right argument to be an
   *        inductive edge or a segment of the left one, rather than for the remainder
   */
  public PartialResult checkInclusionPartial(Set<Integer> instantiable, boolean searchInductive, boolean submem,
      HeapGraph left, Optional<Set<Integer>> hint, Set<Integer> segmentEnds, SatOracle leftSat,
      HeapGraph right, Map<Integer, Integer> initialMap) {
    var result = checkInclusionGeneric(instantiable, submem, false, left, hint, segmentEnds, leftSat, right,
        initialMap);
    if (result.isEmpty()) {
      return PartialResult.NotIncluded.instance();
    }
    var s = result.get();
    if (searchInductive) {
      var extraction = s.excluded().extractSingleInductive();
      if (extraction.node().isEmpty()) {
        if (extraction.others()) {
          throw new InclusionError("IsLe partial for local abstraction; a lot of stuff left");
        }
        return new PartialResult.IncludedAsInductive(s.left());
      }
      if (extraction.others()) {
        logger.debug("IsLe partial: several inductives?");
        return PartialResult.NotIncluded.instance();
      }
      return new PartialResult.IncludedAsSegment(s.left(), extraction.node().get(), extraction.edge().get(),
          s.embedding().image());
    }
    // Nodes not instantiated by a constraint keep the left node they stand for.
    var instantiations = new LinkedHashMap<>(s.instantiations());
    for (int i : s.instantiable()) {
      if (instantiations.containsKey(i)) {
        continue;
      }
      var il = s.embedding().lookup(i);
      if (il.isPresent() && left.contains(il.get())) {
        instantiations.put(i, NumExpr.var(il.get()));
      }
    }
    return new PartialResult.IncludedWithRemainder(s.left(), s.consumedLeft(), s.embedding().image(),
        instantiations);
  }

  /**
   * The inclusion check proper. Returns the final state when the inclusion holds.
   *
   * @param empBoth whether the left graph must be consumed too
   */
  public Optional<InclusionState> checkInclusionGeneric(Set<Integer> instantiable, boolean submem, boolean empBoth,
      HeapGraph left, Optional<Set<Integer>> hint, Set<Integer> segmentEnds, SatOracle leftSat, HeapGraph right,
      Map<Integer, Integer> initialMap) {
    var embedding = NodeEmbedding.of(initialMap);
    var s = new InclusionState(left.copy(), right.copy(), embedding, instantiable, submem, empBoth, hint,
        segmentEnds, leftSat, new GraphDisequality(left), flags);
    for (var entry : initialMap.entrySet()) {
      RuleClassifier.collect(s, entry.getValue(), entry.getKey());
    }
    if (hint.isPresent()) {
      logger.debug("IsLe: hint {}", hint.get());
    } else {
      logger.debug("IsLe: no hint");
    }
    logger.info("start is_le");
    var outcome = new InclusionSearch(materializer).start(s);
    logger.info("return is_le {}", outcome.isSuccess());
    if (!outcome.isSuccess()) {
      logger.debug("is_le fails: {}", outcome.reason());
      return Optional.empty();
    }
    return Optional.of(outcome.value());
  }
}
