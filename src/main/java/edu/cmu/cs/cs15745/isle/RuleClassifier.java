package edu.cmu.cs.cs15745.isle;

import java.util.Optional;

import edu.cmu.cs.cs15745.isle.graph.Edge;
import edu.cmu.cs.cs15745.isle.graph.EdgeKind;

/**
 * Decides which rule, if any, applies at a (left node, right node) pair.
 */
public final class RuleClassifier {
  private RuleClassifier() { }

  public static Optional<RuleKind> classify(InclusionState s, int il, int ir) {
    if (!s.left().contains(il) || !s.right().contains(ir)) {
      return Optional.empty();
    }
    var rightEdge = s.right().edge(ir);
    if (rightEdge.kind() == EdgeKind.EMPTY) {
      return Optional.empty();
    }
    if (s.isSegmentEnd(il)) {
      return Optional.empty();
    }
    if (s.isStopNode(il)) {
      return Optional.of(RuleKind.STOP);
    }
    var leftKind = s.left().kind(il);
    switch (rightEdge.kind()) {
    case POINTS_TO:
      // The left graph is never unfolded.
      return leftKind == EdgeKind.POINTS_TO ? Optional.of(RuleKind.PT_PT) : Optional.empty();
    case INDUCTIVE:
      switch (leftKind) {
      case INDUCTIVE: return Optional.of(RuleKind.IND_IND);
      case SEGMENT: return Optional.of(RuleKind.SEG_IND);
      case EMPTY: return Optional.of(RuleKind.UNFOLD_PREFER_EMPTY);
      case POINTS_TO: return Optional.of(RuleKind.UNFOLD_PREFER_NON_EMPTY);
      default: throw new AssertionError(leftKind);
      }
    case SEGMENT:
      switch (leftKind) {
      case SEGMENT: return Optional.of(RuleKind.SEG_SEG);
      case EMPTY:
        int hole = ((Edge.Segment) rightEdge).hole();
        return Optional.of(s.embedding().contains(hole) ? RuleKind.VOID_SEG : RuleKind.UNFOLD_PREFER_EMPTY);
      case POINTS_TO: return Optional.of(RuleKind.UNFOLD_PREFER_NON_EMPTY);
      case INDUCTIVE: return Optional.of(RuleKind.UNFOLD_PREFER_EMPTY);
      default: throw new AssertionError(leftKind);
      }
    default:
      throw new AssertionError(rightEdge.kind());
    }
  }

  /** Schedule the rule that applies at (il, ir), if any. */
  public static void collect(InclusionState s, int il, int ir) {
    classify(s, il, ir).ifPresent(kind -> s.rules().add(new Rule(kind, il, ir)));
  }

  /** Whether a pending rule still matches the current edges at its site. */
  static boolean isCurrent(InclusionState s, Rule rule) {
    return classify(s, rule.left(), rule.right()).filter(k -> k == rule.kind()).isPresent();
  }
}
