package edu.cmu.cs.cs15745.isle;

/**
 * Soft failure of an inclusion check: the two graphs, as compared along the current
 * branch, are not in the inclusion relation. Recovered from at the nearest
 * backtracking point or turned into a negative answer by the entry points.
 */
public class NotIncludedException extends Exception {
  private static final long serialVersionUID = 1L;

  public NotIncludedException(String message) {
    super(message);
  }
}
