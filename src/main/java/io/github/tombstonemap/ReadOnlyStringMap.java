package io.github.tombstonemap;

import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Read side of an insertion-ordered, string-keyed map.
 */
public interface ReadOnlyStringMap<V> {

	/** Returns the value for {@code key}, or null when absent. Use {@link #has} to tell a null value apart. */
	V get(Object key);

	boolean has(String key);

	int size();

	default boolean isEmpty() {
		return size() == 0;
	}

	/** Visits live entries in insertion order; see {@link MapCursor} for mutation during the walk. */
	void forEach(BiConsumer<? super String, ? super V> action);

	MapCursor<String> keyCursor();

	MapCursor<V> valueCursor();

	MapCursor<Map.Entry<String, V>> entryCursor();
}
