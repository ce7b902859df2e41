package edu.cmu.cs.cs15745.isle.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

import edu.cmu.cs.cs15745.isle.util.Util;

/**
 * Arguments of a predicate instance: pointer arguments then integer arguments,
 * both given as node ids.
 */
public final class Args {
	private static final Args NONE = new Args(List.of(), List.of());

	private final List<Integer> ptr;
	private final List<Integer> ints;

	public Args(List<Integer> ptr, List<Integer> ints) {
		this.ptr = Collections.unmodifiableList(new ArrayList<>(ptr));
		this.ints = Collections.unmodifiableList(new ArrayList<>(ints));
	}

	public static Args none() {
		return NONE;
	}

	public static Args ptr(Integer... ptr) {
		return new Args(List.of(ptr), List.of());
	}

	public List<Integer> ptr() {
		return ptr;
	}

	public List<Integer> ints() {
		return ints;
	}

	public boolean isEmpty() {
		return ptr.isEmpty() && ints.isEmpty();
	}

	public Args rename(IntUnaryOperator renaming) {
		List<Integer> p = new ArrayList<>();
		for (int i : ptr) {
			p.add(renaming.applyAsInt(i));
		}
		List<Integer> n = new ArrayList<>();
		for (int i : ints) {
			n.add(renaming.applyAsInt(i));
		}
		return new Args(p, n);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Args)) return false;
		Args other = (Args) o;
		return ptr.equals(other.ptr) && ints.equals(other.ints);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ptr, ints);
	}

	@Override
	public String toString() {
		return String.format("(%s | %s)", Util.join(", ", ptr), Util.join(", ", ints));
	}
}
