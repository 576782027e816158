package io.github.tombstonemap;

import java.util.AbstractMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Factories for {@link OrderedStringMap}.
 */
public final class StringMaps {

	private StringMaps() {}

	public static <V> OrderedStringMap<V> newMap() {
		return new OrderedStringMap<>();
	}

	/**
	 * Copies {@code template} into a new map, preserving the template's iteration order.
	 * A null template yields an empty map.
	 */
	public static <V> OrderedStringMap<V> fromTemplate(Map<String, ? extends V> template) {
		if (template == null) return new OrderedStringMap<>();
		return new OrderedStringMap<>(template);
	}

	/**
	 * Read-only view of {@code map}. Later changes to {@code map} show through; the view's
	 * cursors reject {@code remove()} and its entries are immutable snapshots.
	 */
	public static <V> ReadOnlyStringMap<V> readOnly(ReadOnlyStringMap<V> map) {
		Objects.requireNonNull(map, "map");
		if (map instanceof ReadOnlyView<?>) return map;
		return new ReadOnlyView<>(map);
	}

	private static final class ReadOnlyView<V> implements ReadOnlyStringMap<V> {
		private final ReadOnlyStringMap<V> delegate;

		ReadOnlyView(ReadOnlyStringMap<V> delegate) {
			this.delegate = delegate;
		}

		@Override
		public V get(Object key) {
			return delegate.get(key);
		}

		@Override
		public boolean has(String key) {
			return delegate.has(key);
		}

		@Override
		public int size() {
			return delegate.size();
		}

		@Override
		public void forEach(BiConsumer<? super String, ? super V> action) {
			delegate.forEach(action);
		}

		@Override
		public MapCursor<String> keyCursor() {
			return new ReadOnlyCursor<>(delegate.keyCursor());
		}

		@Override
		public MapCursor<V> valueCursor() {
			return new ReadOnlyCursor<>(delegate.valueCursor());
		}

		@Override
		public MapCursor<Map.Entry<String, V>> entryCursor() {
			MapCursor<Map.Entry<String, V>> entries = delegate.entryCursor();
			return new ReadOnlyCursor<>(new MapCursor<Map.Entry<String, V>>() {
				@Override
				public boolean hasNext() {
					return entries.hasNext();
				}

				@Override
				public Map.Entry<String, V> next() {
					Map.Entry<String, V> e = entries.next();
					return new AbstractMap.SimpleImmutableEntry<>(e.getKey(), e.getValue());
				}
			});
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder("{");
			MapCursor<Map.Entry<String, V>> it = entryCursor();
			while (it.hasNext()) {
				sb.append(it.next());
				if (it.hasNext()) sb.append(", ");
			}
			return sb.append('}').toString();
		}
	}

	private static final class ReadOnlyCursor<T> implements MapCursor<T> {
		private final MapCursor<T> delegate;

		ReadOnlyCursor(MapCursor<T> delegate) {
			this.delegate = delegate;
		}

		@Override
		public boolean hasNext() {
			return delegate.hasNext();
		}

		@Override
		public T next() {
			return delegate.next();
		}

		@Override
		public void remove() {
			throw new UnsupportedOperationException("read-only cursor");
		}
	}
}
