package edu.cmu.cs.cs15745.isle;

/**
 * The rewrite rules of the inclusion check, in decreasing priority. Points-to matching
 * comes first so that graphs shrink early; unfolding comes last, once no structural
 * rule applies.
 */
public enum RuleKind {
  PT_PT(0, "pt-pt"),
  IND_IND(1, "ind-ind"),
  SEG_SEG(1, "seg-seg"),
  SEG_IND(1, "seg-ind"),
  VOID_SEG(1, "void-seg"),
  STOP(1, "stop"),
  UNFOLD_PREFER_EMPTY(2, "unfold[emp]"),
  UNFOLD_PREFER_NON_EMPTY(2, "unfold[non-emp]");

  static final int TIERS = 3;

  private final int tier;
  private final String label;

  RuleKind(int tier, String label) {
    this.tier = tier;
    this.label = label;
  }

  /** Lower tiers are applied first. */
  public int tier() {
    return tier;
  }

  public boolean isUnfolding() {
    return tier == 2;
  }

  @Override
  public String toString() {
    return label;
  }
}
