package io.github.tombstonemap;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * String-keyed map with insertion-order iteration (null keys NOT allowed, null values allowed).
 *
 * <p>Entries live in a {@link KeyIndex} for lookup and in a doubly linked chain for order.
 * Iteration never fails on concurrent modification from the same thread: cursors survive
 * {@link #delete}, {@link #clear} and {@link #set} calls made between their steps, including
 * calls made from inside {@link #forEach}. Setting an existing key keeps its position; deleting a
 * key and setting it again appends it at the end.
 *
 * <p>Not thread-safe.
 */
public class OrderedStringMap<V> extends AbstractMap<String, V> implements ReadOnlyStringMap<V> {

	private static final int DEFAULT_INITIAL_CAPACITY = 16;

	private final KeyIndex<ChainEntry<V>> index;
	private final ChainEntry<V> head = ChainEntry.sentinel();
	private ChainEntry<V> tail = head;

	public OrderedStringMap() {
		this(DEFAULT_INITIAL_CAPACITY, KeyIndex.DEFAULT_LOAD_FACTOR);
	}

	public OrderedStringMap(int initialCapacity) {
		this(initialCapacity, KeyIndex.DEFAULT_LOAD_FACTOR);
	}

	public OrderedStringMap(int initialCapacity, double loadFactor) {
		this.index = new KeyIndex<>(initialCapacity, loadFactor);
	}

	/** Copies {@code template} in its iteration order. */
	public OrderedStringMap(Map<String, ? extends V> template) {
		this(Math.max(DEFAULT_INITIAL_CAPACITY, (int) (template.size() / KeyIndex.DEFAULT_LOAD_FACTOR) + 1));
		putAll(template);
	}

	/* ------------ Core API ------------ */

	@Override
	public int size() {
		return index.size();
	}

	@Override
	public boolean isEmpty() {
		return index.size() == 0;
	}

	@Override
	public boolean has(String key) {
		return index.contains(key);
	}

	@Override
	public V get(Object key) {
		ChainEntry<V> e = lookup(key);
		return (e == null) ? null : e.value;
	}

	/** Sets {@code key} to {@code value}; a new key goes to the end, an existing key stays put. */
	public OrderedStringMap<V> set(String key, V value) {
		put(key, value);
		return this;
	}

	/** Removes {@code key}; returns false if it was absent. */
	public boolean delete(String key) {
		ChainEntry<V> e = index.remove(key);
		if (e == null) return false;
		unlink(e);
		return true;
	}

	@Override
	public void clear() {
		index.clear();
		ChainEntry<V> e = head.next;
		while (e != null) {
			ChainEntry<V> next = e.next;
			e.tombstone(head);
			e = next;
		}
		head.next = null;
		tail = head;
	}

	@Override
	public MapCursor<String> keyCursor() {
		return new ChainCursor<>(this, head, e -> e.key);
	}

	@Override
	public MapCursor<V> valueCursor() {
		return new ChainCursor<>(this, head, e -> e.value);
	}

	@Override
	public MapCursor<Map.Entry<String, V>> entryCursor() {
		return new ChainCursor<>(this, head, e -> e);
	}

	/**
	 * Calls {@code action} for each entry in insertion order. The action may set, delete or clear
	 * on this map; keys added during the walk are visited, keys deleted before being reached are not.
	 */
	@Override
	public void forEach(BiConsumer<? super String, ? super V> action) {
		Objects.requireNonNull(action, "action");
		MapCursor<Map.Entry<String, V>> it = entryCursor();
		while (it.hasNext()) {
			Map.Entry<String, V> e = it.next();
			action.accept(e.getKey(), e.getValue());
		}
	}

	/* ------------ Map API ------------ */

	@Override
	public boolean containsKey(Object key) {
		return lookup(key) != null;
	}

	@Override
	public V put(String key, V value) {
		ChainEntry<V> e = index.get(key);
		if (e != null) {
			V old = e.value;
			e.value = value;
			return old;
		}
		e = new ChainEntry<>(key, value);
		index.put(key, e);
		linkLast(e);
		return null;
	}

	@Override
	public V remove(Object key) {
		if (!(key instanceof String k)) {
			if (key == null) throw new NullPointerException("Null keys not supported");
			return null;
		}
		ChainEntry<V> e = index.remove(k);
		if (e == null) return null;
		unlink(e);
		return e.value;
	}

	@Override
	public Set<String> keySet() {
		return new AbstractSet<>() {
			@Override
			public int size() {
				return OrderedStringMap.this.size();
			}

			@Override
			public Iterator<String> iterator() {
				return keyCursor();
			}

			@Override
			public boolean contains(Object o) {
				return containsKey(o);
			}

			@Override
			public boolean remove(Object o) {
				return (o instanceof String k) && delete(k);
			}

			@Override
			public void clear() {
				OrderedStringMap.this.clear();
			}
		};
	}

	@Override
	public Collection<V> values() {
		return new AbstractCollection<>() {
			@Override
			public int size() {
				return OrderedStringMap.this.size();
			}

			@Override
			public Iterator<V> iterator() {
				return valueCursor();
			}

			@Override
			public void clear() {
				OrderedStringMap.this.clear();
			}
		};
	}

	@Override
	public Set<Map.Entry<String, V>> entrySet() {
		return new AbstractSet<>() {
			@Override
			public int size() {
				return OrderedStringMap.this.size();
			}

			@Override
			public Iterator<Map.Entry<String, V>> iterator() {
				return entryCursor();
			}

			@Override
			public boolean contains(Object o) {
				if (!(o instanceof Map.Entry<?, ?> e) || !(e.getKey() instanceof String k)) return false;
				ChainEntry<V> live = index.get(k);
				return live != null && Objects.equals(live.value, e.getValue());
			}

			@Override
			public boolean remove(Object o) {
				if (!contains(o)) return false;
				return delete((String) ((Map.Entry<?, ?>) o).getKey());
			}

			@Override
			public void clear() {
				OrderedStringMap.this.clear();
			}
		};
	}

	/* ------------ Chain helpers ------------ */

	private ChainEntry<V> lookup(Object key) {
		if (key instanceof String k) return index.get(k);
		if (key == null) throw new NullPointerException("Null keys not supported");
		return null;
	}

	private void linkLast(ChainEntry<V> e) {
		ChainEntry<V> last = tail;
		last.next = e;
		e.previous = last;
		tail = e;
	}

	private void unlink(ChainEntry<V> e) {
		ChainEntry<V> prev = e.previous;
		ChainEntry<V> succ = e.next;
		prev.next = succ;
		if (succ != null) {
			succ.previous = prev;
		}
		if (tail == e) {
			tail = prev;
		}
		// A cursor parked on e steps back to prev and continues from prev's updated link.
		e.tombstone(prev);
	}
}
