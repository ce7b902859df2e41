package edu.cmu.cs.cs15745.isle.num;

import java.util.HashMap;
import java.util.Map;

/** Plain union-find over symbolic values, with path compression. */
final class UnionFind {
	private final Map<Integer, Integer> fatherMap;

	UnionFind() {
		fatherMap = new HashMap<>();
	}

	UnionFind(UnionFind other) {
		fatherMap = new HashMap<>(other.fatherMap);
	}

	int find(int e) {
		Integer father = fatherMap.get(e);
		if (father == null) {
			return e;
		}
		int ancestor = find(father);
		fatherMap.put(e, ancestor);
		return ancestor;
	}

	/** Returns the representative of the merged class. */
	int union(int e, int f) {
		int ancestorE = find(e);
		int ancestorF = find(f);
		if (ancestorE != ancestorF) {
			fatherMap.put(ancestorE, ancestorF);
		}
		return ancestorF;
	}
}
