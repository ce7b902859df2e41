package edu.cmu.cs.cs15745.isle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import edu.cmu.cs.cs15745.isle.graph.Edge;
import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.num.NumExpr;

/**
 * Answer of a partial inclusion check. A PartialResult is one of:
 * <ul>
 * <li>not included</li>
 * <li>included, the right argument being one inductive edge of the left remainder</li>
 * <li>included up to one inductive edge of the right argument, set aside at a stop
 * node, which makes the left remainder a segment</li>
 * <li>included with a left remainder</li>
 * </ul>
 */
public abstract class PartialResult {
  // Disallow external subclassing.
  private PartialResult() {
  }

  /**
   * Visitor for PartialResult's fixed set of subclasses.
   */
  public interface Visitor<T> {
    T visitNotIncluded(NotIncluded r);
    T visitIncludedAsInductive(IncludedAsInductive r);
    T visitIncludedAsSegment(IncludedAsSegment r);
    T visitIncludedWithRemainder(IncludedWithRemainder r);
  }

  public abstract <T> T accept(Visitor<T> visitor);

  public boolean isIncluded() {
    return true;
  }

  public static final class NotIncluded extends PartialResult {
    private static final NotIncluded INSTANCE = new NotIncluded();

    private NotIncluded() {
    }

    static NotIncluded instance() {
      return INSTANCE;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNotIncluded(this);
    }

    @Override
    public boolean isIncluded() {
      return false;
    }

    @Override
    public String toString() {
      return "not included";
    }
  }

  public static final class IncludedAsInductive extends PartialResult {
    private final HeapGraph left;

    IncludedAsInductive(HeapGraph left) {
      this.left = Objects.requireNonNull(left);
    }

    /** What remains of the left argument. */
    public HeapGraph left() {
      return left;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIncludedAsInductive(this);
    }

    @Override
    public String toString() {
      return "included as inductive";
    }
  }

  public static final class IncludedAsSegment extends PartialResult {
    private final HeapGraph left;
    private final int hole;
    private final Edge.Inductive edge;
    private final Map<Integer, Integer> nodeMap;

    IncludedAsSegment(HeapGraph left, int hole, Edge.Inductive edge, Map<Integer, Integer> nodeMap) {
      this.left = Objects.requireNonNull(left);
      this.hole = hole;
      this.edge = Objects.requireNonNull(edge);
      this.nodeMap = Collections.unmodifiableMap(new LinkedHashMap<>(nodeMap));
    }

    public HeapGraph left() {
      return left;
    }

    /** Left node where the segment stops. */
    public int hole() {
      return hole;
    }

    /** The inductive edge left over at the hole, over left nodes. */
    public Edge.Inductive edge() {
      return edge;
    }

    /** Right node -> left node. */
    public Map<Integer, Integer> nodeMap() {
      return nodeMap;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIncludedAsSegment(this);
    }

    @Override
    public String toString() {
      return String.format("included as segment to %d.%s", hole, edge);
    }
  }

  public static final class IncludedWithRemainder extends PartialResult {
    private final HeapGraph left;
    private final Set<Integer> consumedLeft;
    private final Map<Integer, Integer> nodeMap;
    private final Map<Integer, NumExpr> instantiations;

    IncludedWithRemainder(HeapGraph left, Set<Integer> consumedLeft, Map<Integer, Integer> nodeMap,
        Map<Integer, NumExpr> instantiations) {
      this.left = Objects.requireNonNull(left);
      this.consumedLeft = Collections.unmodifiableSet(new LinkedHashSet<>(consumedLeft));
      this.nodeMap = Collections.unmodifiableMap(new LinkedHashMap<>(nodeMap));
      this.instantiations = Collections.unmodifiableMap(new LinkedHashMap<>(instantiations));
    }

    public HeapGraph left() {
      return left;
    }

    public Set<Integer> consumedLeft() {
      return consumedLeft;
    }

    public Map<Integer, Integer> nodeMap() {
      return nodeMap;
    }

    /** Right node -> expression over left nodes. */
    public Map<Integer, NumExpr> instantiations() {
      return instantiations;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIncludedWithRemainder(this);
    }

    @Override
    public String toString() {
      return String.format("included, remainder:\n%s", left);
    }
  }
}
