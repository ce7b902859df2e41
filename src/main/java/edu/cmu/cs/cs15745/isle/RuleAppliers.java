package edu.cmu.cs.cs15745.isle;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.isle.graph.Allocation;
import edu.cmu.cs.cs15745.isle.graph.Args;
import edu.cmu.cs.cs15745.isle.graph.Cell;
import edu.cmu.cs.cs15745.isle.graph.Edge;
import edu.cmu.cs.cs15745.isle.graph.NodeType;
import edu.cmu.cs.cs15745.isle.num.NumConstraint;
import edu.cmu.cs.cs15745.isle.num.NumExpr;
import edu.cmu.cs.cs15745.isle.num.Unifier;

/**
 * The structural rules. Each one consumes the edges at its site, extends the
 * embedding and schedules the pairs it discovers. A soft failure is reported with
 * {@link NotIncludedException}; a site whose edges do not fit the rule is an
 * {@link InclusionError}.
 */
final class RuleAppliers {
  private static final Logger logger = LogManager.getLogger(RuleAppliers.class);

  private RuleAppliers() { }

  static void apply(InclusionState s, Rule rule) throws NotIncludedException {
    int il = rule.left();
    int ir = rule.right();
    switch (rule.kind()) {
    case PT_PT:
      applyPtPt(s, il, ir);
      break;
    case IND_IND:
      applyIndInd(s, il, ir);
      break;
    case SEG_SEG:
      applySegSeg(s, il, ir);
      break;
    case SEG_IND:
      applySegInd(s, il, ir);
      break;
    case VOID_SEG:
      applyVoidSeg(s, il, ir);
      break;
    case STOP:
      applyStop(s, il, ir);
      break;
    default:
      throw new InclusionError("not a structural rule: " + rule);
    }
  }

  /**
   * Make ir stand for il. If ir already stands for another left node, both must be
   * equal in the left argument.
   */
  static void fixMapId(InclusionState s, String msg, int il, int ir) throws NotIncludedException {
    var old = s.embedding().lookup(ir);
    if (old.isPresent()) {
      int oil = old.get();
      if (oil == il || s.leftSat().sat(NumConstraint.eqVars(il, oil))) {
        return;
      }
      throw new NotIncludedException(String.format("fix_map[%s] (%d,%d->%d)", msg, ir, il, oil));
    }
    s.embedding().add(ir, il);
    RuleClassifier.collect(s, il, ir);
  }

  static void fixMapArgs(InclusionState s, String msg, List<Integer> left, List<Integer> right)
      throws NotIncludedException {
    if (left.size() != right.size()) {
      throw new InclusionError(String.format("fix_map_args[%s], lengths differ: %s vs %s", msg, left, right));
    }
    for (int i = 0; i < left.size(); i++) {
      fixMapId(s, msg, left.get(i), right.get(i));
    }
  }

  static void fixMapAllArgs(InclusionState s, String msg, Args left, Args right) throws NotIncludedException {
    fixMapArgs(s, msg + ",ptr", left.ptr(), right.ptr());
    fixMapArgs(s, msg + ",int", left.ints(), right.ints());
  }

  /** New right node standing for il. */
  static int freshMapId(InclusionState s, NodeType type, int il) {
    int ir = s.right().addFresh(type, Allocation.none());
    s.embedding().add(ir, il);
    return ir;
  }

  /** New right arguments standing for the given left ones. */
  static Args freshMapArgs(InclusionState s, Args left) {
    List<Integer> ptr = new ArrayList<>();
    for (int il : left.ptr()) {
      ptr.add(freshMapId(s, NodeType.ADDR, il));
    }
    List<Integer> ints = new ArrayList<>();
    for (int il : left.ints()) {
      ints.add(freshMapId(s, NodeType.INT, il));
    }
    return new Args(ptr, ints);
  }

  private static void enrich(InclusionState s, String msg, NumExpr left, NumExpr right, String failure)
      throws NotIncludedException {
    var pairs = Unifier.unify(left, right);
    if (pairs.isEmpty()) {
      throw new NotIncludedException(failure);
    }
    for (var pair : pairs.get()) {
      fixMapId(s, msg, pair.fst(), pair.snd());
    }
  }

  static void applyPtPt(InclusionState s, int il, int ir) throws NotIncludedException {
    var ln = s.left().node(il);
    var rn = s.right().node(ir);
    if (!(ln.edge() instanceof Edge.PointsTo) || !(rn.edge() instanceof Edge.PointsTo)) {
      throw new InclusionError("pt-pt; improper config at " + il + ", " + ir);
    }
    if (!s.submem() && !ln.allocation().equals(rn.allocation())) {
      throw new InclusionError(String.format("alloc constraint fails: %s-%s", ln.allocation(), rn.allocation()));
    }
    var lb = ((Edge.PointsTo) ln.edge()).block();
    var rb = ((Edge.PointsTo) rn.edge()).block();
    if (lb.cardinal() != rb.cardinal()) {
      throw new NotIncludedException("sizes do not match");
    }
    // Both blocks list constant offsets first, in increasing order.
    for (int i = 0; i < lb.cardinal(); i++) {
      enrich(s, "bounds", lb.cells().get(i).offset(), rb.cells().get(i).offset(), "blocks not compatible");
    }
    for (int i = 0; i < lb.cardinal(); i++) {
      Cell lc = lb.cells().get(i);
      Cell rc = rb.cells().get(i);
      if (lc.size() != rc.size()) {
        logger.warn("is_le, pt-pt, sizes: {} vs {} at {}, {}", lc.size(), rc.size(), il, ir);
      }
      var lOff = lc.destinationOffset();
      var rOff = rc.destinationOffset();
      if (!(lOff.isConstant() && rOff.isConstant() && lOff.equals(rOff))) {
        enrich(s, "offsets", lOff, rOff, "incompatible destination offsets");
      }
      int idl = lc.destination();
      int idr = rc.destination();
      var old = s.embedding().lookup(idr);
      if (old.isPresent()) {
        int midl = old.get();
        if (midl != idl && !s.leftSat().sat(NumConstraint.eqVars(idl, midl))) {
          throw new NotIncludedException("pt-pt creates incompatible mapping");
        }
      } else {
        s.embedding().add(idr, idl);
      }
      RuleClassifier.collect(s, idl, idr);
    }
    s.left().removeEdge(il);
    s.right().removeEdge(ir);
    s.consume(il);
  }

  static void applyIndInd(InclusionState s, int il, int ir) throws NotIncludedException {
    var le = s.left().edge(il);
    var re = s.right().edge(ir);
    if (!(le instanceof Edge.Inductive) || !(re instanceof Edge.Inductive)) {
      throw new InclusionError("ind-ind; improper config at " + il + ", " + ir);
    }
    var li = (Edge.Inductive) le;
    var ri = (Edge.Inductive) re;
    if (!li.predicate().equals(ri.predicate())) {
      throw new InclusionError(String.format("inductives do not match: %s, %s", li.predicate(), ri.predicate()));
    }
    if (!quickIndInd(s, il, li)) {
      fixMapAllArgs(s, "ind-ind", li.args(), ri.args());
    }
    s.left().removeEdge(il);
    s.right().removeEdge(ir);
    s.consume(il);
  }

  /**
   * An empty region on the left, whose predicate says nothing about its parameters
   * when empty, needs no argument matching. Arguments with an attribute or already
   * matched are matched anyway.
   */
  private static boolean quickIndInd(InclusionState s, int il, Edge.Inductive li) {
    var pred = li.predicate();
    return s.flags().quickIndInd()
        && pred.emptyWhenNull()
        && s.leftSat().sat(NumConstraint.eq(NumExpr.var(il), NumExpr.constant(0)))
        && pred.emptyRulesUseNoParameters()
        && li.args().ptr().stream().noneMatch(
            a -> s.left().node(a).attribute().isPresent() || s.embedding().hasPreimage(a));
  }

  static void applySegSeg(InclusionState s, int il, int ir) throws NotIncludedException {
    var le = s.left().edge(il);
    var re = s.right().edge(ir);
    if (!(le instanceof Edge.Segment) || !(re instanceof Edge.Segment)) {
      throw new InclusionError("rule seg-seg, not applied to seg-seg at " + il + ", " + ir);
    }
    var ls = (Edge.Segment) le;
    var rs = (Edge.Segment) re;
    if (!ls.predicate().equals(rs.predicate())) {
      throw new InclusionError("rule seg-seg, applied to distinct inductives");
    }
    fixMapAllArgs(s, "seg_seg,src", ls.sourceArgs(), rs.sourceArgs());
    var hole = s.embedding().lookup(rs.hole());
    if (hole.isPresent()) {
      if (hole.get() == ls.hole()) {
        // a *= b * G  <=  a *= b * H  when  G <= H
        fixMapAllArgs(s, "seg_seg,dst", ls.destinationArgs(), rs.destinationArgs());
        s.left().removeEdge(il);
        s.right().removeEdge(ir);
        s.consume(il);
        return;
      }
    } else if (s.left().numNodes() == s.right().numNodes()) {
      // Same number of nodes on both sides: assume both segments end together.
      s.left().removeEdge(il);
      s.right().removeEdge(ir);
      s.consume(il);
      s.embedding().add(rs.hole(), ls.hole());
      RuleClassifier.collect(s, ls.hole(), rs.hole());
      return;
    }
    // a *= b * G  <=  a *= d * H  when  G  <=  b *= d * H
    s.right().removeEdge(ir);
    int middle = freshMapId(s, NodeType.ADDR, ls.hole());
    var middleArgs = freshMapArgs(s, ls.destinationArgs());
    s.right().setEdge(middle, new Edge.Segment(rs.predicate(), middleArgs, rs.destinationArgs(), rs.hole()));
    s.left().removeEdge(il);
    s.consume(il);
    RuleClassifier.collect(s, ls.hole(), middle);
  }

  static void applySegInd(InclusionState s, int il, int ir) throws NotIncludedException {
    var le = s.left().edge(il);
    var re = s.right().edge(ir);
    if (!(le instanceof Edge.Segment) || !(re instanceof Edge.Inductive)) {
      throw new InclusionError("seg-ind; improper config at " + il + ", " + ir);
    }
    var ls = (Edge.Segment) le;
    var ri = (Edge.Inductive) re;
    if (!ls.predicate().equals(ri.predicate())) {
      throw new UnsupportedInclusionCase(
          String.format("seg-ind with distinct predicates %s, %s", ls.predicate(), ri.predicate()));
    }
    // a *= b * G  <=  a.P() * H  when  G  <=  b.P() * H
    fixMapAllArgs(s, "seg-ind,src", ls.sourceArgs(), ri.args());
    s.right().removeEdge(ir);
    int middle = freshMapId(s, NodeType.ADDR, ls.hole());
    var middleArgs = freshMapArgs(s, ls.destinationArgs());
    s.right().setEdge(middle, new Edge.Inductive(ri.predicate(), middleArgs));
    s.left().removeEdge(il);
    s.consume(il);
    RuleClassifier.collect(s, ls.hole(), middle);
  }

  static void applyVoidSeg(InclusionState s, int il, int ir) throws NotIncludedException {
    var re = s.right().edge(ir);
    if (!(re instanceof Edge.Segment)) {
      throw new InclusionError("void-seg; improper config at " + il + ", " + ir);
    }
    var rs = (Edge.Segment) re;
    var end = s.embedding().lookup(rs.hole());
    if (end.isEmpty()) {
      throw new UnsupportedInclusionCase("emp-seg: end of segment " + rs.hole() + " not mapped");
    }
    if (end.get() != il) {
      throw new UnsupportedInclusionCase(
          String.format("segment to non empty: %s=%s> %d", rs.predicate(), rs.predicate(), rs.hole()));
    }
    // The segment is empty: its source and destination arguments are the same.
    matchEmptySegmentArgs(s, il, rs.sourceArgs().ptr(), rs.destinationArgs().ptr());
    matchEmptySegmentArgs(s, il, rs.sourceArgs().ints(), rs.destinationArgs().ints());
    s.right().removeEdge(ir);
  }

  private static void matchEmptySegmentArgs(InclusionState s, int il, List<Integer> src, List<Integer> dst)
      throws NotIncludedException {
    for (int i = 0; i < src.size(); i++) {
      int rs = src.get(i);
      int rd = dst.get(i);
      var ls = s.embedding().lookup(rs);
      var ld = s.embedding().lookup(rd);
      if (ls.isEmpty() && ld.isEmpty()) {
        throw new NotIncludedException("emp-seg, no ptr par info");
      } else if (ld.isEmpty()) {
        s.embedding().add(rd, ls.get());
        RuleClassifier.collect(s, ls.get(), rd);
      } else if (ls.isEmpty()) {
        s.embedding().add(rs, ld.get());
        RuleClassifier.collect(s, ld.get(), rs);
      } else if (!ls.get().equals(ld.get())) {
        throw new NotIncludedException("emp-seg, conflicting ptr par info");
      }
    }
  }

  /**
   * At a stop node, the right inductive edge is set aside, in terms of left nodes, for
   * the caller to inspect.
   */
  static void applyStop(InclusionState s, int il, int ir) {
    var rn = s.right().node(ir);
    rn.edge().accept(new Edge.Visitor<Void>() {
      @Override
      public Void visitEmpty(Edge.Empty e) {
        return null;
      }

      @Override
      public Void visitPointsTo(Edge.PointsTo pt) {
        return null;
      }

      @Override
      public Void visitInductive(Edge.Inductive ind) {
        var args = ind.args().rename(i -> s.embedding().lookup(i)
            .orElseThrow(() -> new InclusionError("stop-node: par not mapped: " + i)));
        var excluded = s.excluded();
        if (!excluded.contains(il)) {
          excluded.addNode(il, rn.type());
        }
        for (int a : args.ptr()) {
          if (!excluded.contains(a)) {
            excluded.addNode(a, NodeType.ADDR);
          }
        }
        for (int a : args.ints()) {
          if (!excluded.contains(a)) {
            excluded.addNode(a, NodeType.INT);
          }
        }
        excluded.setEdge(il, new Edge.Inductive(ind.predicate(), args));
        s.right().removeEdge(ir);
        return null;
      }

      @Override
      public Void visitSegment(Edge.Segment seg) {
        throw new UnsupportedInclusionCase("stop node on segment " + seg);
      }
    });
  }
}
