package edu.cmu.cs.cs15745.isle.num;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import edu.cmu.cs.cs15745.isle.util.MultiMap;
import edu.cmu.cs.cs15745.isle.util.Pair;

/**
 * A conjunction of facts over symbolic values, answering satisfiability queries.
 * Equalities between values and bindings to constants are closed by union-find;
 * disequalities are kept per pair of values and per excluded constant. Any other
 * assumed constraint is only recognized literally. An inconsistent base satisfies
 * every constraint.
 */
public final class FactBase implements SatOracle {
	private final UnionFind classes;
	private final Map<Integer, Long> values; // representative -> bound constant
	private final Set<Pair<Integer, Integer>> distinct;
	private final MultiMap<Integer, Long> excluded;
	private final Set<NumConstraint> literals;
	private boolean bottom = false;

	public FactBase() {
		classes = new UnionFind();
		values = new HashMap<>();
		distinct = new LinkedHashSet<>();
		excluded = new MultiMap<>();
		literals = new LinkedHashSet<>();
	}

	private FactBase(FactBase other) {
		classes = new UnionFind(other.classes);
		values = new HashMap<>(other.values);
		distinct = new LinkedHashSet<>(other.distinct);
		excluded = new MultiMap<>(other.excluded);
		literals = new LinkedHashSet<>(other.literals);
		bottom = other.bottom;
	}

	public FactBase copy() {
		return new FactBase(this);
	}

	public boolean isBottom() {
		return bottom;
	}

	/** Add a fact; returns this for chaining. */
	public FactBase assume(NumConstraint c) {
		var lv = c.lhs().asVariable();
		var rv = c.rhs().asVariable();
		switch (c.relation()) {
		case EQ:
			if (lv.isPresent() && rv.isPresent()) {
				assumeEqual(lv.get(), rv.get());
			} else if (lv.isPresent() && c.rhs().isConstant()) {
				bind(lv.get(), c.rhs().constant());
			} else if (rv.isPresent() && c.lhs().isConstant()) {
				bind(rv.get(), c.lhs().constant());
			} else if (c.lhs().isConstant() && c.rhs().isConstant()) {
				bottom |= c.lhs().constant() != c.rhs().constant();
			} else {
				literals.add(c);
			}
			break;
		case DISEQ:
			if (lv.isPresent() && rv.isPresent()) {
				distinct.add(Pair.of(lv.get(), rv.get()));
			} else if (lv.isPresent() && c.rhs().isConstant()) {
				excluded.getSet(lv.get()).add(c.rhs().constant());
			} else if (rv.isPresent() && c.lhs().isConstant()) {
				excluded.getSet(rv.get()).add(c.lhs().constant());
			} else {
				literals.add(c);
			}
			break;
		default:
			literals.add(c);
		}
		return this;
	}

	public FactBase assumeEqual(int x, int y) {
		int rx = classes.find(x);
		int ry = classes.find(y);
		if (rx == ry) {
			return this;
		}
		Long vx = values.remove(rx);
		Long vy = values.remove(ry);
		int rep = classes.union(rx, ry);
		if (vx != null && vy != null && !vx.equals(vy)) {
			bottom = true;
		}
		Long v = vx != null ? vx : vy;
		if (v != null) {
			values.put(rep, v);
		}
		return this;
	}

	public FactBase bind(int x, long value) {
		int rx = classes.find(x);
		Long old = values.put(rx, value);
		if (old != null && old != value) {
			bottom = true;
		}
		return this;
	}

	@Override
	public boolean sat(NumConstraint c) {
		if (bottom || literals.contains(c)) {
			return true;
		}
		NumExpr d = normalize(c.difference());
		switch (c.relation()) {
		case EQ:
			return d.isConstant() && d.constant() == 0;
		case SUP:
			return d.isConstant() && d.constant() > 0;
		case SUPEQ:
			return d.isConstant() && d.constant() >= 0;
		case DISEQ:
			return provesDisequality(d);
		default:
			throw new IllegalArgumentException(c.relation().toString());
		}
	}

	// d != 0, with d in normal form
	private boolean provesDisequality(NumExpr d) {
		if (d.isConstant()) {
			return d.constant() != 0;
		}
		var terms = d.terms();
		if (terms.size() == 1) {
			var term = terms.entrySet().iterator().next();
			long coeff = term.getValue();
			if (Math.abs(coeff) != 1) {
				return false;
			}
			// coeff * x + k != 0  <=>  x != -k * coeff
			return excludes(term.getKey(), -d.constant() * coeff);
		}
		if (terms.size() == 2 && d.constant() == 0) {
			var it = terms.entrySet().iterator();
			var t1 = it.next();
			var t2 = it.next();
			if (t1.getValue() + t2.getValue() == 0 && Math.abs(t1.getValue()) == 1) {
				return areDistinct(t1.getKey(), t2.getKey());
			}
		}
		return false;
	}

	private boolean excludes(int rep, long value) {
		for (var entry : excluded.entrySet()) {
			if (classes.find(entry.getKey()) == rep && entry.getValue().contains(value)) {
				return true;
			}
		}
		return false;
	}

	private boolean areDistinct(int rx, int ry) {
		for (var pair : distinct) {
			int a = classes.find(pair.fst());
			int b = classes.find(pair.snd());
			if ((a == rx && b == ry) || (a == ry && b == rx)) {
				return true;
			}
		}
		return false;
	}

	// Rewrite each variable into its class representative, or its bound constant.
	private NumExpr normalize(NumExpr e) {
		return e.substitute(x -> {
			int rep = classes.find(x);
			Long value = values.get(rep);
			return value != null ? NumExpr.constant(value) : NumExpr.var(rep);
		});
	}

	@Override
	public String toString() {
		return String.format("Facts[values=%s, distinct=%s, excluded=%s, literals=%s%s]",
			values, distinct, excluded, literals, bottom ? ", bottom" : "");
	}
}
