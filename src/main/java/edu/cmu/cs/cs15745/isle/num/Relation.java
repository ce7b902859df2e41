package edu.cmu.cs.cs15745.isle.num;

/** Comparison of a numeric constraint. */
public enum Relation {
	EQ("="), DISEQ("!="), SUP(">"), SUPEQ(">=");

	private final String symbol;

	Relation(String symbol) {
		this.symbol = symbol;
	}

	@Override
	public String toString() {
		return symbol;
	}
}
