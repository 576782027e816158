package io.github.tombstonemap;

import java.util.Map;
import java.util.Objects;

/**
 * One link of the insertion-order chain.
 *
 * <p>While live, {@code next}/{@code previous} are ordinary chain links. Once removed the entry
 * becomes a tombstone: {@code previous} is null, {@code skipNext} is set and {@code next} points
 * back to the entry that preceded it at removal time (or to the head after a clear). A cursor
 * resting on a tombstone follows that link and skips past it.
 */
final class ChainEntry<V> implements Map.Entry<String, V> {

	/** Null only for the sentinel head. */
	final String key;
	V value;

	ChainEntry<V> next;
	ChainEntry<V> previous;
	boolean skipNext;

	ChainEntry(String key, V value) {
		this.key = key;
		this.value = value;
	}

	static <V> ChainEntry<V> sentinel() {
		return new ChainEntry<>(null, null);
	}

	boolean isTombstone() {
		return skipNext;
	}

	void tombstone(ChainEntry<V> redirect) {
		previous = null;
		next = redirect;
		skipNext = true;
	}

	@Override
	public String getKey() {
		return key;
	}

	@Override
	public V getValue() {
		return value;
	}

	@Override
	public V setValue(V newValue) {
		if (skipNext) throw new IllegalStateException("Entry was removed: " + key);
		V old = value;
		value = newValue;
		return old;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Map.Entry<?, ?> e)) return false;
		return Objects.equals(key, e.getKey()) && Objects.equals(value, e.getValue());
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(key) ^ Objects.hashCode(value);
	}

	@Override
	public String toString() {
		return key + "=" + value;
	}
}
