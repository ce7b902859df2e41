package edu.cmu.cs.cs15745.isle.graph;

import java.util.Objects;

/**
 * Where the block of a node was allocated: on the stack, in a heap region
 * (identified by its allocation site), or unknown.
 */
public final class Allocation {
	public enum Kind { STACK, HEAP, NONE }

	private static final Allocation STACK = new Allocation(Kind.STACK, "");
	private static final Allocation NONE = new Allocation(Kind.NONE, "");

	private final Kind kind;
	private final String region;

	private Allocation(Kind kind, String region) {
		this.kind = kind;
		this.region = Objects.requireNonNull(region);
	}

	public static Allocation stack() {
		return STACK;
	}

	public static Allocation none() {
		return NONE;
	}

	public static Allocation heap(String region) {
		return new Allocation(Kind.HEAP, region);
	}

	public Kind kind() {
		return kind;
	}

	public String region() {
		return region;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Allocation)) return false;
		Allocation other = (Allocation) o;
		return kind == other.kind && region.equals(other.region);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, region);
	}

	@Override
	public String toString() {
		switch (kind) {
		case STACK:
			return "stack";
		case HEAP:
			return "heap[" + region + "]";
		default:
			return "none";
		}
	}
}
