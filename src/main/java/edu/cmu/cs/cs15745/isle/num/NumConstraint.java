package edu.cmu.cs.cs15745.isle.num;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Constraint {@code lhs op rhs} between two linear expressions.
 */
public final class NumConstraint {
	private final Relation relation;
	private final NumExpr lhs;
	private final NumExpr rhs;

	public NumConstraint(Relation relation, NumExpr lhs, NumExpr rhs) {
		this.relation = Objects.requireNonNull(relation);
		this.lhs = Objects.requireNonNull(lhs);
		this.rhs = Objects.requireNonNull(rhs);
	}

	public static NumConstraint eq(NumExpr lhs, NumExpr rhs) {
		return new NumConstraint(Relation.EQ, lhs, rhs);
	}

	public static NumConstraint diseq(NumExpr lhs, NumExpr rhs) {
		return new NumConstraint(Relation.DISEQ, lhs, rhs);
	}

	/** x = y over two symbolic values. */
	public static NumConstraint eqVars(int x, int y) {
		return eq(NumExpr.var(x), NumExpr.var(y));
	}

	public Relation relation() {
		return relation;
	}

	public NumExpr lhs() {
		return lhs;
	}

	public NumExpr rhs() {
		return rhs;
	}

	/** lhs - rhs; the constraint reads {@code difference() op 0}. */
	public NumExpr difference() {
		return lhs.minus(rhs);
	}

	public Set<Integer> variables() {
		var result = new LinkedHashSet<>(lhs.variables());
		result.addAll(rhs.variables());
		return result;
	}

	public Optional<NumConstraint> rename(Function<Integer, Optional<Integer>> renaming) {
		var l = lhs.rename(renaming);
		var r = rhs.rename(renaming);
		if (l.isEmpty() || r.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new NumConstraint(relation, l.get(), r.get()));
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof NumConstraint)) return false;
		NumConstraint other = (NumConstraint) o;
		return relation == other.relation && lhs.equals(other.lhs) && rhs.equals(other.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(relation, lhs, rhs);
	}

	@Override
	public String toString() {
		return String.format("%s %s %s", lhs, relation, rhs);
	}
}
