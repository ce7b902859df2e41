package edu.cmu.cs.cs15745.isle;

/**
 * A configuration the algorithm recognizes but does not handle yet.
 */
public class UnsupportedInclusionCase extends InclusionError {
  private static final long serialVersionUID = 1L;

  public UnsupportedInclusionCase(String message) {
    super("not implemented: " + message);
  }
}
