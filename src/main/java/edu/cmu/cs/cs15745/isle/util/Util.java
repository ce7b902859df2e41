package edu.cmu.cs.cs15745.isle.util;

import java.util.Iterator;
import java.util.Map;

public final class Util {
	private Util() { }

	// String.join calling "toString" on each constituent element of the iterable.
	public static String join(CharSequence delimiter, Iterable<?> iter) {
		StringBuilder result = new StringBuilder();
		for (Iterator<?> it = iter.iterator(); it.hasNext();) {
			result.append(it.next());
			if (it.hasNext()) {
				result.append(delimiter);
			}
		}
		return result.toString();
	}

	// Renders a map as "k -> v" lines, each prefixed by indent.
	public static String joinMap(String indent, Map<?, ?> map) {
		StringBuilder result = new StringBuilder();
		for (var entry : map.entrySet()) {
			result.append(indent).append(entry.getKey()).append(" -> ").append(entry.getValue()).append('\n');
		}
		return result.toString();
	}
}
