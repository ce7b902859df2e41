package edu.cmu.cs.cs15745.isle.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.IntUnaryOperator;

import edu.cmu.cs.cs15745.isle.num.NumExpr;
import edu.cmu.cs.cs15745.isle.util.Util;

/**
 * Contents of a points-to edge: the occupied fragments of a memory block, in
 * increasing offset order. Offsets are unique within a block.
 */
public final class Block {
	private final List<Cell> cells;

	public Block(List<Cell> cells) {
		var sorted = new ArrayList<>(cells);
		sorted.sort((a, b) -> {
			// Constant offsets first, by value; symbolic ones keep their relative order.
			if (a.offset().isConstant() && b.offset().isConstant()) {
				return Long.compare(a.offset().constant(), b.offset().constant());
			}
			return Boolean.compare(!a.offset().isConstant(), !b.offset().isConstant());
		});
		var seen = new HashSet<NumExpr>();
		for (var cell : sorted) {
			if (!seen.add(cell.offset())) {
				throw new IllegalArgumentException("Duplicate offset " + cell.offset());
			}
		}
		this.cells = Collections.unmodifiableList(sorted);
	}

	public static Block of(Cell... cells) {
		return new Block(List.of(cells));
	}

	public List<Cell> cells() {
		return cells;
	}

	/** Number of occupied fragments. */
	public int cardinal() {
		return cells.size();
	}

	public Block rename(IntUnaryOperator renaming) {
		List<Cell> result = new ArrayList<>();
		for (var cell : cells) {
			result.add(cell.rename(renaming));
		}
		return new Block(result);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Block && cells.equals(((Block) o).cells);
	}

	@Override
	public int hashCode() {
		return Objects.hash(cells);
	}

	@Override
	public String toString() {
		return "{ " + Util.join("; ", cells) + " }";
	}
}
