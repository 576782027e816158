package io.github.tombstonemap;

import java.util.NoSuchElementException;
import java.util.function.Function;

final class ChainCursor<V, T> implements MapCursor<T> {

	private final OrderedStringMap<V> owner; // null for read-only cursors
	private final Function<ChainEntry<V>, T> projection;

	/* null once done */
	private ChainEntry<V> current;
	private ChainEntry<V> lastReturned;

	ChainCursor(OrderedStringMap<V> owner, ChainEntry<V> head, Function<ChainEntry<V>, T> projection) {
		this.owner = owner;
		this.current = head;
		this.projection = projection;
	}

	/**
	 * The entry the next call to {@link #next()} would land on, or null. Each hop reads the
	 * link of the entry it stands on; a tombstone's link leads back to a node whose own forward
	 * link is current, so a run of tombstones unwinds one hop each.
	 */
	private ChainEntry<V> peek() {
		ChainEntry<V> e = current;
		while (e != null) {
			boolean skip = e.skipNext;
			e = e.next;
			if (!skip) break;
		}
		return e;
	}

	@Override
	public boolean hasNext() {
		if (current == null) return false;
		if (peek() == null) {
			current = null;
			return false;
		}
		return true;
	}

	@Override
	public T next() {
		ChainEntry<V> e = peek();
		if (e == null) {
			current = null;
			throw new NoSuchElementException();
		}
		current = e;
		lastReturned = e;
		return projection.apply(e);
	}

	@Override
	public void remove() {
		if (owner == null) throw new UnsupportedOperationException("read-only cursor");
		if (lastReturned == null) throw new IllegalStateException();
		ChainEntry<V> e = lastReturned;
		lastReturned = null;
		if (!e.isTombstone()) {
			owner.delete(e.key);
		}
	}
}
