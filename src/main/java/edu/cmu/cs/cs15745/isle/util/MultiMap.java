package edu.cmu.cs.cs15745.isle.util;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Map from keys to insertion-ordered sets of values. */
public class MultiMap<K, V> extends AbstractMap<K, Set<V>> {
	private final Map<K, Set<V>> map = new LinkedHashMap<>();
	
	public MultiMap() { }
	
	/** Make a deep copy: the value sets are not shared. */
	public MultiMap(Map<K, Set<V>> other) {
		for (var entry : other.entrySet()) {
			map.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
		}
	}
	
	@Override
	public Set<Entry<K, Set<V>>> entrySet() {
		return map.entrySet();
	}
	
	@Override
	public Set<V> put(K key, Set<V> value) {
		return map.put(key, value);
	}
	
	/**
	 * Return set that, adding to which, adds to the map.
	 */
	public Set<V> getSet(K key) {
		return map.computeIfAbsent(key, unused -> new LinkedHashSet<>());
	}

	/** Read-only view of the values of key; empty if the key is absent. */
	public Set<V> values(K key) {
		return Collections.unmodifiableSet(map.getOrDefault(key, Collections.emptySet()));
	}
}
