package edu.cmu.cs.cs15745.isle.benchmarking;

import java.util.List;
import java.util.function.BiConsumer;

import edu.cmu.cs.cs15745.isle.InclusionFlags;
import edu.cmu.cs.cs15745.isle.benchmarking.Benchmarker.TestState;

public final class Main {

  private static final List<Integer> LIST_SIZES = List.of(10, 50, 100, 200);
  private static final List<Integer> TREE_DEPTHS = List.of(2, 4, 6, 8);
  private static final List<Integer> SEGMENT_COUNTS = List.of(10, 50, 100, 200);

  public static void main(String[] args) {
    var benchmarker = new Benchmarker(InclusionFlags.fromEnvironment());
    benchmark("lists", LIST_SIZES, benchmarker::testList);
    benchmark("trees", TREE_DEPTHS, benchmarker::testTree);
    benchmark("segments", SEGMENT_COUNTS, benchmarker::testSegments);
  }

  private static void benchmark(String name, List<Integer> sizes, BiConsumer<Integer, TestState> test) {
    System.out.println("==============");
    System.out.println("Testing " + name);
    System.out.println("==============");
    var state = new TestState();
    sizes.forEach(size -> test.accept(size, state));
    System.out.printf("===== Total statistics (%s): =====\n", name);
    System.out.printf("  Total checks:  \t%d\n", state.totalChecks);
    System.out.printf("  Included:      \t%d\n", state.totalIncluded);
    System.out.printf("  Total nodes:   \t%d\n", state.totalNodes);
    System.out.printf("  Total mapped:  \t%d\n", state.totalMapped);
    System.out.printf("  Total time:    \t%.3fs\n", state.totalTimeNS / 1_000_000_000D);
    System.out.printf("  Mean time:     \t%.3fms\n", state.totalTimeNS / 1_000_000D / state.totalChecks);
    System.out.printf("  Min/max time:  \t%.3fms / %.3fms\n", state.minTimeNS / 1_000_000D,
        state.maxTimeNS / 1_000_000D);
  }
}
