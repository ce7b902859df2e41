package edu.cmu.cs.cs15745.isle.graph;

import java.util.Objects;
import java.util.Optional;

/**
 * A node of a heap graph: a symbolic value, with the shape fact it owns.
 * Nodes are immutable; the graph replaces them on update.
 */
public final class HeapNode {
	private final int id;
	private final NodeType type;
	private final Allocation allocation;
	private final String attribute; // null when none
	private final Edge edge;

	HeapNode(int id, NodeType type, Allocation allocation, String attribute, Edge edge) {
		this.id = id;
		this.type = Objects.requireNonNull(type);
		this.allocation = Objects.requireNonNull(allocation);
		this.attribute = attribute;
		this.edge = Objects.requireNonNull(edge);
	}

	public int id() {
		return id;
	}

	public NodeType type() {
		return type;
	}

	public Allocation allocation() {
		return allocation;
	}

	/** Extra information attached by the analysis, e.g. the role of a predicate parameter. */
	public Optional<String> attribute() {
		return Optional.ofNullable(attribute);
	}

	public Edge edge() {
		return edge;
	}

	HeapNode withEdge(Edge edge) {
		return new HeapNode(id, type, allocation, attribute, edge);
	}

	HeapNode withAttribute(String attribute) {
		return new HeapNode(id, type, allocation, attribute, edge);
	}

	@Override
	public String toString() {
		return String.format("%d<%s,%s%s>: %s", id, type, allocation,
			attribute == null ? "" : "," + attribute, edge);
	}
}
