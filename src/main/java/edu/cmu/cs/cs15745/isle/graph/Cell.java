package edu.cmu.cs.cs15745.isle.graph;

import java.util.Objects;
import java.util.Optional;
import java.util.function.IntUnaryOperator;

import edu.cmu.cs.cs15745.isle.num.NumExpr;

/**
 * One occupied fragment of a block: {@code offset} holds {@code size} bytes that
 * point to {@code destination + destinationOffset}.
 */
public final class Cell {
	private final NumExpr offset;
	private final int size;
	private final int destination;
	private final NumExpr destinationOffset;

	public Cell(NumExpr offset, int size, int destination, NumExpr destinationOffset) {
		this.offset = Objects.requireNonNull(offset);
		this.size = size;
		this.destination = destination;
		this.destinationOffset = Objects.requireNonNull(destinationOffset);
	}

	/** Cell at a constant offset, pointing to the base of its destination. */
	public static Cell of(long offset, int size, int destination) {
		return new Cell(NumExpr.constant(offset), size, destination, NumExpr.constant(0));
	}

	public NumExpr offset() {
		return offset;
	}

	public int size() {
		return size;
	}

	public int destination() {
		return destination;
	}

	public NumExpr destinationOffset() {
		return destinationOffset;
	}

	public Cell rename(IntUnaryOperator renaming) {
		return new Cell(
			renameExpr(offset, renaming),
			size,
			renaming.applyAsInt(destination),
			renameExpr(destinationOffset, renaming));
	}

	private static NumExpr renameExpr(NumExpr e, IntUnaryOperator renaming) {
		return e.rename(i -> Optional.of(renaming.applyAsInt(i))).orElseThrow();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Cell)) return false;
		Cell other = (Cell) o;
		return offset.equals(other.offset) && size == other.size
			&& destination == other.destination && destinationOffset.equals(other.destinationOffset);
	}

	@Override
	public int hashCode() {
		return Objects.hash(offset, size, destination, destinationOffset);
	}

	@Override
	public String toString() {
		String dest = destinationOffset.isConstant() && destinationOffset.constant() == 0
			? Integer.toString(destination)
			: String.format("%d@%s", destination, destinationOffset);
		return String.format("@%s[%d] -> %s", offset, size, dest);
	}
}
