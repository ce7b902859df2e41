package edu.cmu.cs.cs15745.isle.num;

/** Whether two left symbolic values are provably distinct. */
@FunctionalInterface
public interface DisequalityOracle {
	boolean distinct(int x, int y);
}
