package edu.cmu.cs.cs15745.isle;

/**
 * Tuning switches of the inclusion check.
 * <ul>
 * <li>debug level: 0 is quiet, 1 logs the rules applied, 2 and more also dump the
 * pending rules at each step (read from the system property {@code isle.debug}, else
 * from the environment variable {@code ISLE_DEBUG})</li>
 * <li>quick ind-ind: skip argument matching between two inductive edges whose owner is
 * null, when the predicate allows it (system property {@code isle.quickIndInd})</li>
 * </ul>
 */
public final class InclusionFlags {
  private final int debugLevel;
  private final boolean quickIndInd;

  public InclusionFlags(int debugLevel, boolean quickIndInd) {
    this.debugLevel = debugLevel;
    this.quickIndInd = quickIndInd;
  }

  public static InclusionFlags defaults() {
    return new InclusionFlags(0, true);
  }

  public static InclusionFlags fromEnvironment() {
    var debug = System.getProperty("isle.debug", System.getenv("ISLE_DEBUG"));
    int debugLevel = 0;
    if (debug != null) {
      try {
        debugLevel = Integer.parseInt(debug.trim());
      } catch (NumberFormatException e) {
        debugLevel = 0;
      }
    }
    boolean quick = Boolean.parseBoolean(System.getProperty("isle.quickIndInd", "true"));
    return new InclusionFlags(debugLevel, quick);
  }

  public int debugLevel() {
    return debugLevel;
  }

  public boolean quickIndInd() {
    return quickIndInd;
  }

  @Override
  public String toString() {
    return String.format("InclusionFlags[debug=%d, quickIndInd=%b]", debugLevel, quickIndInd);
  }
}
