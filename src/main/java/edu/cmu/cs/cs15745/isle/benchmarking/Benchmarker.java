package edu.cmu.cs.cs15745.isle.benchmarking;

import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.isle.InclusionChecker;
import edu.cmu.cs.cs15745.isle.InclusionFlags;
import edu.cmu.cs.cs15745.isle.graph.GraphFacts;
import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.num.SatOracle;
import edu.cmu.cs.cs15745.isle.unfold.DefinitionMaterializer;

/** Run some benchmarks. */
public final class Benchmarker {
  private static final Logger logger = LogManager.getLogger(Benchmarker.class);

  private final InclusionChecker checker;

  public Benchmarker(InclusionFlags flags) {
    checker = new InclusionChecker(new DefinitionMaterializer(), flags);
  }

  /** A concrete list of the given length is a list. */
  public void testList(int length, TestState state) {
    var left = Shapes.concreteList(length);
    var facts = GraphFacts.of(left).bind(length, 0);
    run("list " + length, left, facts, Shapes.abstractShape(Shapes.list()), state);
  }

  /** A complete tree of the given depth is a tree. */
  public void testTree(int depth, TestState state) {
    var left = Shapes.concreteTree(depth);
    var facts = GraphFacts.of(left).bind(1, 0);
    run("tree " + depth, left, facts, Shapes.abstractShape(Shapes.tree()), state);
  }

  /** A chain of list segments ending in a list is a list. */
  public void testSegments(int segments, TestState state) {
    var list = Shapes.list();
    var left = Shapes.segmentChain(list, segments);
    run("segments " + segments, left, GraphFacts.of(left), Shapes.abstractShape(list), state);
  }

  private void run(String name, HeapGraph left, SatOracle facts, HeapGraph right,
      TestState state) {
    long start = System.nanoTime();
    var result = checker.checkInclusion(false, left, Optional.empty(), facts, right, Map.of(0, 0));
    long time = System.nanoTime() - start;
    logger.debug("{}: {} in {}ms", name, result.isPresent(), time / 1_000_000D);

    state.totalChecks++;
    state.totalNodes += left.numNodes();
    if (result.isPresent()) {
      state.totalIncluded++;
      state.totalMapped += result.get().size();
    }
    state.totalTimeNS += time;
    state.minTimeNS = Math.min(state.minTimeNS, time);
    state.maxTimeNS = Math.max(state.maxTimeNS, time);
  }

  public static class TestState {
    int totalChecks = 0;
    int totalIncluded = 0;
    long totalNodes = 0;
    long totalMapped = 0;
    long totalTimeNS = 0;
    long maxTimeNS = 0;
    long minTimeNS = Long.MAX_VALUE;

    public int totalChecks() {
      return totalChecks;
    }

    public int totalIncluded() {
      return totalIncluded;
    }

    public long totalMapped() {
      return totalMapped;
    }
  }
}
