package edu.cmu.cs.cs15745.isle;

/**
 * Fatal error: a structural precondition of the inclusion algorithm does not hold,
 * which means ill-formed inputs or a bug in the rule selection. Never caught by the
 * search.
 */
public class InclusionError extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public InclusionError(String message) {
    super(message);
  }
}
