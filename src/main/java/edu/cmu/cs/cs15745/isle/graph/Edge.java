package edu.cmu.cs.cs15745.isle.graph;

import java.util.Objects;
import java.util.function.IntUnaryOperator;

/**
 * The shape fact carried by a node. An Edge is one of the following:
 * <ul>
 * <li>emp (no fact)</li>
 * <li>a points-to block</li>
 * <li>an inductive predicate instance, {@code x.P(args)}</li>
 * <li>a segment {@code x.P(srcArgs) *= hole.P(dstArgs)}</li>
 * </ul>
 */
public abstract class Edge {
	// Disallow external subclassing.
	private Edge() {
	}

	/**
	 * Visitor for Edge's fixed set of subclasses.
	 */
	public interface Visitor<T> {
		T visitEmpty(Empty e);
		T visitPointsTo(PointsTo pt);
		T visitInductive(Inductive ind);
		T visitSegment(Segment seg);
	}

	public abstract <T> T accept(Visitor<T> visitor);

	public abstract EdgeKind kind();

	/** The same edge with every referenced node renamed. */
	public abstract Edge rename(IntUnaryOperator renaming);

	public static Empty empty() {
		return Empty.INSTANCE;
	}

	public static final class Empty extends Edge {
		private static final Empty INSTANCE = new Empty();

		private Empty() {
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitEmpty(this);
		}

		@Override
		public EdgeKind kind() {
			return EdgeKind.EMPTY;
		}

		@Override
		public Edge rename(IntUnaryOperator renaming) {
			return this;
		}

		@Override
		public String toString() {
			return "emp";
		}
	}

	public static final class PointsTo extends Edge {
		private final Block block;

		public PointsTo(Block block) {
			this.block = Objects.requireNonNull(block);
		}

		public Block block() {
			return block;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitPointsTo(this);
		}

		@Override
		public EdgeKind kind() {
			return EdgeKind.POINTS_TO;
		}

		@Override
		public Edge rename(IntUnaryOperator renaming) {
			return new PointsTo(block.rename(renaming));
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof PointsTo && block.equals(((PointsTo) o).block);
		}

		@Override
		public int hashCode() {
			return block.hashCode();
		}

		@Override
		public String toString() {
			return block.toString();
		}
	}

	public static final class Inductive extends Edge {
		private final Predicate predicate;
		private final Args args;

		public Inductive(Predicate predicate, Args args) {
			this.predicate = Objects.requireNonNull(predicate);
			this.args = Objects.requireNonNull(args);
			predicate.checkArity(args);
		}

		public Predicate predicate() {
			return predicate;
		}

		public Args args() {
			return args;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitInductive(this);
		}

		@Override
		public EdgeKind kind() {
			return EdgeKind.INDUCTIVE;
		}

		@Override
		public Inductive rename(IntUnaryOperator renaming) {
			return new Inductive(predicate, args.rename(renaming));
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Inductive)) return false;
			Inductive other = (Inductive) o;
			return predicate.equals(other.predicate) && args.equals(other.args);
		}

		@Override
		public int hashCode() {
			return Objects.hash(predicate, args);
		}

		@Override
		public String toString() {
			return String.format("%s%s", predicate, args);
		}
	}

	public static final class Segment extends Edge {
		private final Predicate predicate;
		private final Args sourceArgs;
		private final Args destinationArgs;
		private final int hole;

		public Segment(Predicate predicate, Args sourceArgs, Args destinationArgs, int hole) {
			this.predicate = Objects.requireNonNull(predicate);
			this.sourceArgs = Objects.requireNonNull(sourceArgs);
			this.destinationArgs = Objects.requireNonNull(destinationArgs);
			this.hole = hole;
			predicate.checkArity(sourceArgs);
			predicate.checkArity(destinationArgs);
		}

		public Predicate predicate() {
			return predicate;
		}

		public Args sourceArgs() {
			return sourceArgs;
		}

		public Args destinationArgs() {
			return destinationArgs;
		}

		/** The node where the segment ends. */
		public int hole() {
			return hole;
		}

		@Override
		public <T> T accept(Visitor<T> visitor) {
			return visitor.visitSegment(this);
		}

		@Override
		public EdgeKind kind() {
			return EdgeKind.SEGMENT;
		}

		@Override
		public Segment rename(IntUnaryOperator renaming) {
			return new Segment(predicate, sourceArgs.rename(renaming), destinationArgs.rename(renaming),
				renaming.applyAsInt(hole));
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Segment)) return false;
			Segment other = (Segment) o;
			return predicate.equals(other.predicate) && sourceArgs.equals(other.sourceArgs)
				&& destinationArgs.equals(other.destinationArgs) && hole == other.hole;
		}

		@Override
		public int hashCode() {
			return Objects.hash(predicate, sourceArgs, destinationArgs, hole);
		}

		@Override
		public String toString() {
			return String.format("%s%s *= %d.%s%s", predicate, sourceArgs, hole, predicate, destinationArgs);
		}
	}
}
