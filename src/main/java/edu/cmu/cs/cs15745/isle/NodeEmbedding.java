package edu.cmu.cs.cs15745.isle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import edu.cmu.cs.cs15745.isle.util.MultiMap;
import edu.cmu.cs.cs15745.isle.util.Util;

/**
 * Partial map from right nodes to left nodes, witnessing the inclusion.
 * Entries are only ever added: a right node is never re-bound to another left node.
 */
public final class NodeEmbedding {
  private final Map<Integer, Integer> image;
  private final MultiMap<Integer, Integer> preimages; // left -> rights

  public NodeEmbedding() {
    this(new LinkedHashMap<>(), new MultiMap<>());
  }

  private NodeEmbedding(Map<Integer, Integer> image, MultiMap<Integer, Integer> preimages) {
    this.image = image;
    this.preimages = preimages;
  }

  /** Embedding made of the given right -> left pairs. */
  public static NodeEmbedding of(Map<Integer, Integer> initial) {
    var result = new NodeEmbedding();
    for (var entry : initial.entrySet()) {
      result.add(entry.getKey(), entry.getValue());
    }
    return result;
  }

  public NodeEmbedding copy() {
    return new NodeEmbedding(new LinkedHashMap<>(image), new MultiMap<>(preimages));
  }

  public boolean contains(int right) {
    return image.containsKey(right);
  }

  public int find(int right) throws NotIncludedException {
    Integer left = image.get(right);
    if (left == null) {
      throw new NotIncludedException("not mapped: " + right);
    }
    return left;
  }

  public Optional<Integer> lookup(int right) {
    return Optional.ofNullable(image.get(right));
  }

  /**
   * Bind right to left. Returns whether the binding is new; binding a right node
   * again to the same left node does nothing.
   *
   * @throws IllegalStateException if right is already bound to another left node
   */
  public boolean add(int right, int left) {
    Integer old = image.get(right);
    if (old != null) {
      if (old != left) {
        throw new IllegalStateException(String.format("%d already mapped to %d, not %d", right, old, left));
      }
      return false;
    }
    image.put(right, left);
    preimages.getSet(left).add(right);
    return true;
  }

  public boolean hasPreimage(int left) {
    return !preimages.values(left).isEmpty();
  }

  public int size() {
    return image.size();
  }

  /** Snapshot of the right -> left map. */
  public Map<Integer, Integer> image() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(image));
  }

  @Override
  public String toString() {
    return Util.joinMap("  ", image);
  }
}
