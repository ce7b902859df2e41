package edu.cmu.cs.cs15745.isle.num;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Linear expression {@code c + k1*x1 + ... + kn*xn} over symbolic values.
 * Variables are node ids of the graph the expression is written against.
 * Instances are immutable; terms with a zero coefficient are never stored.
 */
public final class NumExpr {
	private final long constant;
	private final SortedMap<Integer, Long> terms;

	private NumExpr(long constant, SortedMap<Integer, Long> terms) {
		this.constant = constant;
		this.terms = terms;
	}

	public static NumExpr constant(long value) {
		return new NumExpr(value, Collections.emptySortedMap());
	}

	public static NumExpr var(int id) {
		var terms = new TreeMap<Integer, Long>();
		terms.put(id, 1L);
		return new NumExpr(0, terms);
	}

	public long constant() {
		return constant;
	}

	/** Variable to coefficient, sorted by variable. */
	public Map<Integer, Long> terms() {
		return Collections.unmodifiableSortedMap(terms);
	}

	public Set<Integer> variables() {
		return Collections.unmodifiableSet(terms.keySet());
	}

	public boolean isConstant() {
		return terms.isEmpty();
	}

	/** The variable, if this expression is exactly one variable. */
	public Optional<Integer> asVariable() {
		if (constant == 0 && terms.size() == 1) {
			var entry = terms.entrySet().iterator().next();
			if (entry.getValue() == 1L) {
				return Optional.of(entry.getKey());
			}
		}
		return Optional.empty();
	}

	public NumExpr plus(NumExpr other) {
		var result = new TreeMap<>(terms);
		for (var entry : other.terms.entrySet()) {
			addTerm(result, entry.getKey(), entry.getValue());
		}
		return new NumExpr(constant + other.constant, result);
	}

	public NumExpr plus(long value) {
		return new NumExpr(constant + value, terms);
	}

	public NumExpr minus(NumExpr other) {
		return plus(other.scale(-1));
	}

	public NumExpr scale(long factor) {
		if (factor == 0) {
			return constant(0);
		}
		var result = new TreeMap<Integer, Long>();
		for (var entry : terms.entrySet()) {
			result.put(entry.getKey(), entry.getValue() * factor);
		}
		return new NumExpr(constant * factor, result);
	}

	/**
	 * Rename every variable; empty as soon as one variable has no image.
	 */
	public Optional<NumExpr> rename(Function<Integer, Optional<Integer>> renaming) {
		var result = new TreeMap<Integer, Long>();
		for (var entry : terms.entrySet()) {
			var image = renaming.apply(entry.getKey());
			if (image.isEmpty()) {
				return Optional.empty();
			}
			addTerm(result, image.get(), entry.getValue());
		}
		return Optional.of(new NumExpr(constant, result));
	}

	/** Replace every variable by an expression. */
	public NumExpr substitute(Function<Integer, NumExpr> substitution) {
		var result = constant(constant);
		for (var entry : terms.entrySet()) {
			result = result.plus(substitution.apply(entry.getKey()).scale(entry.getValue()));
		}
		return result;
	}

	private static void addTerm(SortedMap<Integer, Long> terms, int var, long coeff) {
		long sum = terms.getOrDefault(var, 0L) + coeff;
		if (sum == 0) {
			terms.remove(var);
		} else {
			terms.put(var, sum);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof NumExpr)) return false;
		NumExpr other = (NumExpr) o;
		return constant == other.constant && terms.equals(other.terms);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constant, terms);
	}

	@Override
	public String toString() {
		if (terms.isEmpty()) {
			return Long.toString(constant);
		}
		StringBuilder result = new StringBuilder();
		for (var entry : terms.entrySet()) {
			long coeff = entry.getValue();
			if (result.length() == 0) {
				result.append(coeff < 0 ? "-" : "");
			} else {
				result.append(coeff < 0 ? " - " : " + ");
			}
			if (Math.abs(coeff) != 1) {
				result.append(Math.abs(coeff)).append('*');
			}
			result.append('|').append(entry.getKey()).append('|');
		}
		if (constant != 0) {
			result.append(constant < 0 ? " - " : " + ").append(Math.abs(constant));
		}
		return result.toString();
	}
}
