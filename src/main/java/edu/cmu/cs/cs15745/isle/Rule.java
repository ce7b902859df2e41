package edu.cmu.cs.cs15745.isle;

import java.util.Objects;

/**
 * An instance of a rule: its kind and the (left node, right node) site it applies at.
 */
public final class Rule {
  private final RuleKind kind;
  private final int left;
  private final int right;

  public Rule(RuleKind kind, int left, int right) {
    this.kind = Objects.requireNonNull(kind);
    this.left = left;
    this.right = right;
  }

  public RuleKind kind() {
    return kind;
  }

  public int left() {
    return left;
  }

  public int right() {
    return right;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Rule)) return false;
    Rule other = (Rule) o;
    return kind == other.kind && left == other.left && right == other.right;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, left, right);
  }

  @Override
  public String toString() {
    return String.format("%s(%d,%d)", kind, left, right);
  }
}
