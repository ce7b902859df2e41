package edu.cmu.cs.cs15745.isle.graph;

import java.util.Objects;

/**
 * A value mentioned in the body of a predicate rule.
 */
public final class Ref {
	public enum Kind { OWNER, PTR_PARAM, INT_PARAM, FRESH, CONSTANT }

	private static final Ref OWNER = new Ref(Kind.OWNER, 0);

	private final Kind kind;
	private final long index; // parameter / fresh variable index, or constant value

	private Ref(Kind kind, long index) {
		this.kind = kind;
		this.index = index;
	}

	/** The node that owns the predicate instance. */
	public static Ref owner() {
		return OWNER;
	}

	public static Ref ptrParam(int i) {
		return new Ref(Kind.PTR_PARAM, i);
	}

	public static Ref intParam(int i) {
		return new Ref(Kind.INT_PARAM, i);
	}

	/** A variable existentially introduced by the rule. */
	public static Ref fresh(int i) {
		return new Ref(Kind.FRESH, i);
	}

	public static Ref constant(long value) {
		return new Ref(Kind.CONSTANT, value);
	}

	public static Ref nil() {
		return constant(0);
	}

	public Kind kind() {
		return kind;
	}

	public int index() {
		if (kind == Kind.CONSTANT || kind == Kind.OWNER) {
			throw new IllegalStateException("No index for " + this);
		}
		return (int) index;
	}

	public long value() {
		if (kind != Kind.CONSTANT) {
			throw new IllegalStateException("Not a constant: " + this);
		}
		return index;
	}

	public boolean isParameter() {
		return kind == Kind.PTR_PARAM || kind == Kind.INT_PARAM;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Ref)) return false;
		Ref other = (Ref) o;
		return kind == other.kind && index == other.index;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, index);
	}

	@Override
	public String toString() {
		switch (kind) {
		case OWNER:
			return "this";
		case PTR_PARAM:
			return "@p" + index;
		case INT_PARAM:
			return "@i" + index;
		case FRESH:
			return "$" + index;
		default:
			return Long.toString(index);
		}
	}
}
