package edu.cmu.cs.cs15745.isle.num;

/**
 * Satisfiability oracle of the left argument: whether a constraint, written over
 * left symbolic values, holds in every concretization of the left abstract state.
 */
@FunctionalInterface
public interface SatOracle {
	boolean sat(NumConstraint constraint);
}
