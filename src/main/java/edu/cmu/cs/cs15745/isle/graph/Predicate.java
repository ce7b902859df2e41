package edu.cmu.cs.cs15745.isle.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A user-defined inductive predicate (list, tree, ...). The rules are supplied after
 * construction so that they may refer to the predicate itself; two predicates are the
 * same predicate iff they have the same name.
 */
public final class Predicate {
	private final String name;
	private final int ptrParams;
	private final int intParams;
	private final boolean emptyWhenNull;
	private List<PredicateRule> rules = List.of();
	private boolean defined = false;

	/**
	 * @param emptyWhenNull whether an instance whose owner is null is necessarily empty
	 */
	public Predicate(String name, int ptrParams, int intParams, boolean emptyWhenNull) {
		this.name = Objects.requireNonNull(name);
		this.ptrParams = ptrParams;
		this.intParams = intParams;
		this.emptyWhenNull = emptyWhenNull;
	}

	public Predicate define(List<PredicateRule> rules) {
		if (defined) {
			throw new IllegalStateException("Already defined: " + name);
		}
		defined = true;
		this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
		return this;
	}

	public String name() {
		return name;
	}

	public int ptrParams() {
		return ptrParams;
	}

	public int intParams() {
		return intParams;
	}

	public boolean emptyWhenNull() {
		return emptyWhenNull;
	}

	public List<PredicateRule> rules() {
		return rules;
	}

	/** No empty rule says anything about the parameters. */
	public boolean emptyRulesUseNoParameters() {
		for (var rule : rules) {
			if (rule.isEmpty()) {
				for (var c : rule.constraints()) {
					if (c.mentionsParameter()) {
						return false;
					}
				}
			}
		}
		return true;
	}

	void checkArity(Args args) {
		if (args.ptr().size() != ptrParams || args.ints().size() != intParams) {
			throw new IllegalArgumentException(String.format("%s expects (%d | %d) arguments, got %s",
				name, ptrParams, intParams, args));
		}
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Predicate && name.equals(((Predicate) o).name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return name;
	}
}
