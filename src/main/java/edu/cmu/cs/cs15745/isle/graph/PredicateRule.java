package edu.cmu.cs.cs15745.isle.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.isle.num.Relation;
import edu.cmu.cs.cs15745.isle.util.Util;

/**
 * One case of an inductive definition. An empty rule only asserts pure constraints;
 * a non-empty rule makes the owner point to a block whose cells lead to fresh
 * variables, which in turn may satisfy inductive predicates (calls).
 */
public final class PredicateRule {
	public enum Kind { EMPTY, NON_EMPTY }

	/** this@offset[size] -> destination */
	public static final class RuleCell {
		private final long offset;
		private final int size;
		private final Ref destination;

		RuleCell(long offset, int size, Ref destination) {
			this.offset = offset;
			this.size = size;
			this.destination = Objects.requireNonNull(destination);
		}

		public long offset() {
			return offset;
		}

		public int size() {
			return size;
		}

		public Ref destination() {
			return destination;
		}

		@Override
		public String toString() {
			return String.format("@%d[%d] -> %s", offset, size, destination);
		}
	}

	/** target.predicate(ptrArgs | intArgs) */
	public static final class RuleCall {
		private final Ref target;
		private final Predicate predicate;
		private final List<Ref> ptrArgs;
		private final List<Ref> intArgs;

		RuleCall(Ref target, Predicate predicate, List<Ref> ptrArgs, List<Ref> intArgs) {
			this.target = Objects.requireNonNull(target);
			this.predicate = Objects.requireNonNull(predicate);
			this.ptrArgs = Collections.unmodifiableList(new ArrayList<>(ptrArgs));
			this.intArgs = Collections.unmodifiableList(new ArrayList<>(intArgs));
			if (ptrArgs.size() != predicate.ptrParams() || intArgs.size() != predicate.intParams()) {
				throw new IllegalArgumentException("Arity mismatch in call to " + predicate);
			}
		}

		public Ref target() {
			return target;
		}

		public Predicate predicate() {
			return predicate;
		}

		public List<Ref> ptrArgs() {
			return ptrArgs;
		}

		public List<Ref> intArgs() {
			return intArgs;
		}

		@Override
		public String toString() {
			return String.format("%s.%s(%s | %s)", target, predicate, Util.join(", ", ptrArgs), Util.join(", ", intArgs));
		}
	}

	/** lhs op rhs */
	public static final class RuleConstraint {
		private final Relation relation;
		private final Ref lhs;
		private final Ref rhs;

		RuleConstraint(Relation relation, Ref lhs, Ref rhs) {
			this.relation = Objects.requireNonNull(relation);
			this.lhs = Objects.requireNonNull(lhs);
			this.rhs = Objects.requireNonNull(rhs);
		}

		public Relation relation() {
			return relation;
		}

		public Ref lhs() {
			return lhs;
		}

		public Ref rhs() {
			return rhs;
		}

		public boolean mentionsParameter() {
			return lhs.isParameter() || rhs.isParameter();
		}

		@Override
		public String toString() {
			return String.format("%s %s %s", lhs, relation, rhs);
		}
	}

	private final Kind kind;
	private final List<NodeType> fresh;
	private final List<RuleCell> cells;
	private final List<RuleCall> calls;
	private final List<RuleConstraint> constraints;

	private PredicateRule(Builder b) {
		this.kind = b.kind;
		this.fresh = Collections.unmodifiableList(new ArrayList<>(b.fresh));
		this.cells = Collections.unmodifiableList(new ArrayList<>(b.cells));
		this.calls = Collections.unmodifiableList(new ArrayList<>(b.calls));
		this.constraints = Collections.unmodifiableList(new ArrayList<>(b.constraints));
	}

	public static Builder empty() {
		return new Builder(Kind.EMPTY);
	}

	public static Builder nonEmpty() {
		return new Builder(Kind.NON_EMPTY);
	}

	public Kind kind() {
		return kind;
	}

	public boolean isEmpty() {
		return kind == Kind.EMPTY;
	}

	/** Types of the fresh variables, by index. */
	public List<NodeType> fresh() {
		return fresh;
	}

	public List<RuleCell> cells() {
		return cells;
	}

	public List<RuleCall> calls() {
		return calls;
	}

	public List<RuleConstraint> constraints() {
		return constraints;
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return String.format("emp & %s", Util.join(" & ", constraints));
		}
		return String.format("this -> { %s } * %s & %s",
			Util.join("; ", cells), Util.join(" * ", calls), Util.join(" & ", constraints));
	}

	public static final class Builder {
		private final Kind kind;
		private final List<NodeType> fresh = new ArrayList<>();
		private final List<RuleCell> cells = new ArrayList<>();
		private final List<RuleCall> calls = new ArrayList<>();
		private final List<RuleConstraint> constraints = new ArrayList<>();

		private Builder(Kind kind) {
			this.kind = kind;
		}

		/** Declare the next fresh variable. */
		public Builder fresh(NodeType type) {
			fresh.add(Objects.requireNonNull(type));
			return this;
		}

		public Builder cell(long offset, int size, Ref destination) {
			if (kind == Kind.EMPTY) {
				throw new IllegalStateException("Empty rules own no memory");
			}
			cells.add(new RuleCell(offset, size, destination));
			return this;
		}

		public Builder call(Ref target, Predicate predicate, List<Ref> ptrArgs, List<Ref> intArgs) {
			if (kind == Kind.EMPTY) {
				throw new IllegalStateException("Empty rules own no memory");
			}
			if (target.kind() != Ref.Kind.FRESH) {
				throw new IllegalArgumentException("Calls must target fresh variables: " + target);
			}
			calls.add(new RuleCall(target, predicate, ptrArgs, intArgs));
			return this;
		}

		public Builder call(Ref target, Predicate predicate) {
			return call(target, predicate, List.of(), List.of());
		}

		public Builder constraint(Relation relation, Ref lhs, Ref rhs) {
			constraints.add(new RuleConstraint(relation, lhs, rhs));
			return this;
		}

		public PredicateRule build() {
			return new PredicateRule(this);
		}
	}
}
