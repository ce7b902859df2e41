package edu.cmu.cs.cs15745.isle.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import edu.cmu.cs.cs15745.isle.util.Util;

/**
 * Heap graph: an arena of nodes indexed by id. Edges refer to other nodes by id only.
 * Copies are cheap, since nodes are immutable values.
 */
public final class HeapGraph {

	private final Map<Integer, HeapNode> nodes;
	private int nextId;

	public HeapGraph() {
		this(new LinkedHashMap<>(), 0);
	}

	private HeapGraph(Map<Integer, HeapNode> nodes, int nextId) {
		this.nodes = nodes;
		this.nextId = nextId;
	}

	/**
	 * Clone. Don't care about Cloneable.
	 */
	public HeapGraph copy() {
		return new HeapGraph(new LinkedHashMap<>(nodes), nextId);
	}

	public HeapGraph addNode(int id, NodeType type, Allocation allocation) {
		if (nodes.containsKey(id)) {
			throw new IllegalArgumentException("Node already present: " + id);
		}
		nodes.put(id, new HeapNode(id, type, allocation, null, Edge.empty()));
		nextId = Math.max(nextId, id + 1);
		return this;
	}

	public HeapGraph addNode(int id, NodeType type) {
		return addNode(id, type, Allocation.none());
	}

	/** Add a node with an id not used so far in this graph. */
	public int addFresh(NodeType type, Allocation allocation) {
		int id = nextId;
		addNode(id, type, allocation);
		return id;
	}

	public boolean contains(int id) {
		return nodes.containsKey(id);
	}

	public HeapNode node(int id) {
		var node = nodes.get(id);
		if (node == null) {
			throw new NoSuchElementException("No node " + id);
		}
		return node;
	}

	public Edge edge(int id) {
		return node(id).edge();
	}

	public EdgeKind kind(int id) {
		return edge(id).kind();
	}

	/** Install an edge on a node that has none. */
	public HeapGraph setEdge(int id, Edge edge) {
		var node = node(id);
		if (node.edge().kind() != EdgeKind.EMPTY) {
			throw new IllegalStateException(String.format("Node %d already has an edge: %s", id, node.edge()));
		}
		nodes.put(id, node.withEdge(Objects.requireNonNull(edge)));
		return this;
	}

	/** Remove the edge of a node, returning it. */
	public Edge removeEdge(int id) {
		var node = node(id);
		nodes.put(id, node.withEdge(Edge.empty()));
		return node.edge();
	}

	public HeapGraph setAttribute(int id, String attribute) {
		nodes.put(id, node(id).withAttribute(Objects.requireNonNull(attribute)));
		return this;
	}

	public int numNodes() {
		return nodes.size();
	}

	public int numEdges() {
		int result = 0;
		for (var node : nodes.values()) {
			if (node.edge().kind() != EdgeKind.EMPTY) {
				result++;
			}
		}
		return result;
	}

	/** Returns unmodifiable set. */
	public Set<Integer> nodeIds() {
		return Collections.unmodifiableSet(nodes.keySet());
	}

	/**
	 * Identify node "from" with node "into": every reference to "from" is redirected
	 * and "from" disappears. The edge of "from", if any, moves onto "into", which must
	 * then have none.
	 */
	public HeapGraph mergeInto(int from, int into) {
		if (from == into) {
			return this;
		}
		var source = node(from);
		var target = node(into);
		if (source.edge().kind() != EdgeKind.EMPTY) {
			if (target.edge().kind() != EdgeKind.EMPTY) {
				throw new IllegalStateException(String.format("Cannot merge %d into %d: both own an edge", from, into));
			}
			target = target.withEdge(source.edge());
		}
		nodes.remove(from);
		nodes.put(into, target);
		for (var entry : nodes.entrySet()) {
			var renamed = entry.getValue().edge().rename(i -> i == from ? into : i);
			entry.setValue(entry.getValue().withEdge(renamed));
		}
		return this;
	}

	/**
	 * Result of looking for a single inductive edge in a graph.
	 */
	public static final class Extraction {
		private final boolean others;
		private final Integer node;
		private final Edge.Inductive edge;

		private Extraction(boolean others, Integer node, Edge.Inductive edge) {
			this.others = others;
			this.node = node;
			this.edge = edge;
		}

		/** Whether edges remain besides the extracted one. */
		public boolean others() {
			return others;
		}

		public Optional<Integer> node() {
			return Optional.ofNullable(node);
		}

		public Optional<Edge.Inductive> edge() {
			return Optional.ofNullable(edge);
		}
	}

	public Extraction extractSingleInductive() {
		Integer found = null;
		for (var node : nodes.values()) {
			if (node.edge().kind() == EdgeKind.INDUCTIVE) {
				found = node.id();
				break;
			}
		}
		if (found == null) {
			return new Extraction(numEdges() > 0, null, null);
		}
		return new Extraction(numEdges() > 1, found, (Edge.Inductive) edge(found));
	}

	@Override
	public String toString() {
		return "Graph:\n\t" + Util.join("\n\t", nodes.values());
	}
}
