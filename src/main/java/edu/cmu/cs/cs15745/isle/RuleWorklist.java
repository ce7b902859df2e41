package edu.cmu.cs.cs15745.isle;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import edu.cmu.cs.cs15745.isle.util.Util;

/**
 * Pending rule instances, without duplicates. {@link #next()} returns a rule of the
 * best tier (see {@link RuleKind#tier()}), first-in first-out within a tier.
 */
public final class RuleWorklist {
  private final List<LinkedHashSet<Rule>> tiers = new ArrayList<>();

  public RuleWorklist() {
    for (int i = 0; i < RuleKind.TIERS; i++) {
      tiers.add(new LinkedHashSet<>());
    }
  }

  public RuleWorklist copy() {
    var result = new RuleWorklist();
    for (int i = 0; i < RuleKind.TIERS; i++) {
      result.tiers.get(i).addAll(tiers.get(i));
    }
    return result;
  }

  /** Returns whether the rule was not pending yet. */
  public boolean add(Rule rule) {
    return tiers.get(rule.kind().tier()).add(rule);
  }

  /** Remove and return the next rule to apply. */
  public Optional<Rule> next() {
    for (var tier : tiers) {
      Iterator<Rule> it = tier.iterator();
      if (it.hasNext()) {
        var rule = it.next();
        it.remove();
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int size() {
    int result = 0;
    for (var tier : tiers) {
      result += tier.size();
    }
    return result;
  }

  @Override
  public String toString() {
    List<Rule> all = new ArrayList<>();
    tiers.forEach(all::addAll);
    return "[" + Util.join(", ", all) + "]";
  }
}
