package edu.cmu.cs.cs15745.isle.unfold;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.isle.graph.Allocation;
import edu.cmu.cs.cs15745.isle.graph.Args;
import edu.cmu.cs.cs15745.isle.graph.Block;
import edu.cmu.cs.cs15745.isle.graph.Cell;
import edu.cmu.cs.cs15745.isle.graph.Edge;
import edu.cmu.cs.cs15745.isle.graph.HeapGraph;
import edu.cmu.cs.cs15745.isle.graph.PredicateRule;
import edu.cmu.cs.cs15745.isle.graph.Ref;
import edu.cmu.cs.cs15745.isle.num.NumConstraint;
import edu.cmu.cs.cs15745.isle.num.NumExpr;

/**
 * Materializer following the rules of the predicates found on the edges.
 * <ul>
 * <li>{@code x.P(a)}: one alternative per rule of P.</li>
 * <li>{@code x.P(a) *= h.P(b)}: an empty alternative where h is merged into x, with
 * {@code x = h} and {@code a = b}; and for each non-empty rule, and each call of that
 * rule to P, an alternative where that call goes on as a segment to h.</li>
 * </ul>
 */
public final class DefinitionMaterializer implements Materializer {

  private static final Logger logger = LogManager.getLogger(DefinitionMaterializer.class);

  @Override
  public List<Unfolding> materialize(boolean submem, boolean preferEmpty, int node, HeapGraph graph) {
    var edge = graph.edge(node);
    var result = edge.accept(new Edge.Visitor<List<Unfolding>>() {
      @Override
      public List<Unfolding> visitEmpty(Edge.Empty e) {
        throw new IllegalArgumentException("Nothing to unfold at " + node);
      }

      @Override
      public List<Unfolding> visitPointsTo(Edge.PointsTo pt) {
        throw new IllegalArgumentException("Nothing to unfold at " + node + ": " + pt);
      }

      @Override
      public List<Unfolding> visitInductive(Edge.Inductive ind) {
        return unfoldInductive(preferEmpty, node, ind, graph);
      }

      @Override
      public List<Unfolding> visitSegment(Edge.Segment seg) {
        return unfoldSegment(preferEmpty, node, seg, graph);
      }
    });
    logger.debug("Unfolded {} at {} (submem: {}) into {} alternatives", edge, node, submem, result.size());
    return result;
  }

  private List<Unfolding> unfoldInductive(boolean preferEmpty, int node, Edge.Inductive ind, HeapGraph graph) {
    List<Unfolding> empties = new ArrayList<>();
    List<Unfolding> others = new ArrayList<>();
    for (var rule : ind.predicate().rules()) {
      var instance = new Instance(graph, node, ind.args(), rule);
      if (rule.isEmpty()) {
        empties.add(instance.finish());
      } else {
        instance.writeBlock();
        for (var call : rule.calls()) {
          instance.addInductive(call);
        }
        others.add(instance.finish());
      }
    }
    return order(preferEmpty, empties, others);
  }

  private List<Unfolding> unfoldSegment(boolean preferEmpty, int node, Edge.Segment seg, HeapGraph graph) {
    List<Unfolding> empties = new ArrayList<>();
    List<Unfolding> others = new ArrayList<>();

    // Empty segment: the hole is the source itself.
    var g = graph.copy();
    g.removeEdge(node);
    List<NumConstraint> eqs = new ArrayList<>();
    eqs.add(NumConstraint.eqVars(node, seg.hole()));
    addArgEqualities(eqs, seg.sourceArgs().ptr(), seg.destinationArgs().ptr());
    addArgEqualities(eqs, seg.sourceArgs().ints(), seg.destinationArgs().ints());
    g.mergeInto(seg.hole(), node);
    empties.add(new Unfolding(g, eqs));

    for (var rule : seg.predicate().rules()) {
      if (rule.isEmpty()) {
        continue;
      }
      for (int k = 0; k < rule.calls().size(); k++) {
        if (!rule.calls().get(k).predicate().equals(seg.predicate())) {
          continue;
        }
        var instance = new Instance(graph, node, seg.sourceArgs(), rule);
        instance.writeBlock();
        for (int i = 0; i < rule.calls().size(); i++) {
          if (i == k) {
            instance.addSegment(rule.calls().get(i), seg);
          } else {
            instance.addInductive(rule.calls().get(i));
          }
        }
        others.add(instance.finish());
      }
    }
    return order(preferEmpty, empties, others);
  }

  private static void addArgEqualities(List<NumConstraint> eqs, List<Integer> src, List<Integer> dst) {
    for (int i = 0; i < src.size(); i++) {
      if (!src.get(i).equals(dst.get(i))) {
        eqs.add(NumConstraint.eqVars(src.get(i), dst.get(i)));
      }
    }
  }

  private static List<Unfolding> order(boolean preferEmpty, List<Unfolding> empties, List<Unfolding> others) {
    List<Unfolding> result = new ArrayList<>(preferEmpty ? empties : others);
    result.addAll(preferEmpty ? others : empties);
    return result;
  }

  // One rule applied at one node: fresh variables get fresh nodes of the copied graph.
  private static final class Instance {
    private final HeapGraph graph;
    private final int owner;
    private final Args args;
    private final PredicateRule rule;
    private final List<Integer> fresh = new ArrayList<>();

    Instance(HeapGraph original, int owner, Args args, PredicateRule rule) {
      this.graph = original.copy();
      this.owner = owner;
      this.args = args;
      this.rule = rule;
      graph.removeEdge(owner);
      for (var type : rule.fresh()) {
        fresh.add(graph.addFresh(type, Allocation.none()));
      }
    }

    int node(Ref ref) {
      switch (ref.kind()) {
      case OWNER:
        return owner;
      case PTR_PARAM:
        return args.ptr().get(ref.index());
      case INT_PARAM:
        return args.ints().get(ref.index());
      case FRESH:
        return fresh.get(ref.index());
      default:
        throw new IllegalArgumentException("Not a node: " + ref);
      }
    }

    NumExpr expr(Ref ref) {
      return ref.kind() == Ref.Kind.CONSTANT ? NumExpr.constant(ref.value()) : NumExpr.var(node(ref));
    }

    // The owner keeps its allocation tag: sub-memories and main memories unfold alike.
    void writeBlock() {
      List<Cell> cells = new ArrayList<>();
      for (var cell : rule.cells()) {
        cells.add(Cell.of(cell.offset(), cell.size(), node(cell.destination())));
      }
      graph.setEdge(owner, new Edge.PointsTo(new Block(cells)));
    }

    Args callArgs(PredicateRule.RuleCall call) {
      List<Integer> ptr = new ArrayList<>();
      for (var ref : call.ptrArgs()) {
        ptr.add(node(ref));
      }
      List<Integer> ints = new ArrayList<>();
      for (var ref : call.intArgs()) {
        ints.add(node(ref));
      }
      return new Args(ptr, ints);
    }

    void addInductive(PredicateRule.RuleCall call) {
      graph.setEdge(node(call.target()), new Edge.Inductive(call.predicate(), callArgs(call)));
    }

    void addSegment(PredicateRule.RuleCall call, Edge.Segment original) {
      graph.setEdge(node(call.target()),
        new Edge.Segment(call.predicate(), callArgs(call), original.destinationArgs(), original.hole()));
    }

    Unfolding finish() {
      List<NumConstraint> constraints = new ArrayList<>();
      for (var c : rule.constraints()) {
        constraints.add(new NumConstraint(c.relation(), expr(c.lhs()), expr(c.rhs())));
      }
      return new Unfolding(graph, constraints);
    }
  }
}
