package edu.cmu.cs.cs15745.isle.num;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import edu.cmu.cs.cs15745.isle.util.Pair;

/**
 * Syntactic unification of a left and a right linear expression, as used for block
 * bounds and destination offsets. The expressions unify when their constants agree and
 * their terms pair up, in variable order, with equal coefficients; the result lists the
 * (left variable, right variable) pairs that must be identified.
 */
public final class Unifier {
	private Unifier() { }

	public static Optional<List<Pair<Integer, Integer>>> unify(NumExpr left, NumExpr right) {
		if (left.constant() != right.constant() || left.terms().size() != right.terms().size()) {
			return Optional.empty();
		}
		List<Pair<Integer, Integer>> result = new ArrayList<>();
		var l = left.terms().entrySet().iterator();
		var r = right.terms().entrySet().iterator();
		while (l.hasNext()) {
			var lt = l.next();
			var rt = r.next();
			if (!lt.getValue().equals(rt.getValue())) {
				return Optional.empty();
			}
			result.add(Pair.of(lt.getKey(), rt.getKey()));
		}
		return Optional.of(result);
	}
}
