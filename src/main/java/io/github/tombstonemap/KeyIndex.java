package io.github.tombstonemap;

import java.util.Arrays;

/**
 * String-keyed Robin Hood table backing {@link OrderedStringMap}.
 * Linear probing, backward-shift deletion, null-sentinel empty slots.
 * Keys must be non-null; mapped values must be non-null.
 */
final class KeyIndex<E> {

	static final double DEFAULT_LOAD_FACTOR = 0.75d;

	private String[] keys;
	private Object[] vals;
	private int[] dist; // probe distance (0-based)
	private int size;
	int capacity;
	int maxLoad;
	private final double loadFactor;
	private final int maxCapacity;

	KeyIndex(int initialCapacity, double loadFactor) {
		this(initialCapacity, loadFactor, Hashing.MAX_TABLE_SIZE);
	}

	KeyIndex(int initialCapacity, double loadFactor, int maxCapacity) {
		this.loadFactor = Hashing.validateLoadFactor(loadFactor);
		this.maxCapacity = Hashing.tableSizeFor(maxCapacity);
		allocate(Math.min(Hashing.tableSizeFor(initialCapacity), this.maxCapacity));
	}

	int size() {
		return size;
	}

	E get(String key) {
		int idx = findIndex(key);
		return (idx < 0) ? null : castValue(vals[idx]);
	}

	boolean contains(String key) {
		return findIndex(key) >= 0;
	}

	/** Maps {@code key} to {@code value}, returning the previous mapping or null. */
	E put(String key, E value) {
		if (value == null) throw new NullPointerException("Null index values not supported");
		int idx = findIndex(key);
		if (idx >= 0) {
			E old = castValue(vals[idx]);
			vals[idx] = value;
			return old;
		}
		if (size >= maxLoad && capacity >= maxCapacity) {
			throw new IllegalStateException("capacity exceeded: " + capacity);
		}
		insert(key, value);
		size++;
		if (size > maxLoad) {
			grow();
		}
		return null;
	}

	/* Robin Hood insertion of a key known to be absent; callers keep at least one slot empty. */
	private void insert(String key, Object value) {
		int mask = capacity - 1;
		int idx = Hashing.hash(key) & mask;
		int curDist = 0;

		String curKey = key;
		Object curVal = value;

		for (;;) {
			String k = keys[idx];
			if (k == null) {
				setSlot(idx, curKey, curVal, curDist);
				return;
			}
			int slotDist = dist[idx];
			if (slotDist < curDist) {
				// Robin Hood swap
				Object swapVal = vals[idx];
				setSlot(idx, curKey, curVal, curDist);
				curKey = k;
				curVal = swapVal;
				curDist = slotDist;
			}
			idx = (idx + 1) & mask;
			curDist++;
		}
	}

	/** Removes {@code key}, returning its mapping or null when absent. */
	E remove(String key) {
		int idx = findIndex(key);
		if (idx < 0) return null;
		E old = castValue(vals[idx]);
		deleteAt(idx);
		return old;
	}

	void clear() {
		Arrays.fill(keys, null);
		Arrays.fill(vals, null);
		Arrays.fill(dist, 0);
		size = 0;
	}

	private void allocate(int cap) {
		this.capacity = cap;
		this.keys = new String[cap];
		this.vals = new Object[cap];
		this.dist = new int[cap];
		// a full-size table never grows, so it may fill up to one empty slot
		this.maxLoad = (cap >= maxCapacity) ? cap - 1 : Hashing.maxLoad(cap, loadFactor);
	}

	private void grow() {
		String[] oldKeys = this.keys;
		Object[] oldVals = this.vals;
		allocate(capacity << 1);

		// Wrapped clusters arrive out of ideal-slot order, so rehash through the swapping insert.
		for (int i = 0; i < oldKeys.length; i++) {
			String k = oldKeys[i];
			if (k == null) continue;
			insert(k, oldVals[i]);
		}
	}

	private int findIndex(String key) {
		int mask = capacity - 1;
		int idx = Hashing.hash(key) & mask; // ideal slot
		int d = 0;                           // probe distance while scanning
		for (;;) {
			String k = keys[idx];
			if (k == null) return -1;
			if (k.equals(key)) return idx;
			if (dist[idx] < d) return -1; // early stop
			idx = (idx + 1) & mask;
			d++;
		}
	}

	private void deleteAt(int idx) {
		// Backward shift: pull the following cluster left to fill the hole.
		int mask = capacity - 1;
		int cur = idx;
		for (;;) {
			int next = (cur + 1) & mask;
			String nk = keys[next];
			if (nk == null || dist[next] == 0) { // end of cluster
				clearSlot(cur);
				break;
			}
			setSlot(cur, nk, vals[next], dist[next] - 1);
			cur = next;
		}
		size--;
	}

	private void setSlot(int idx, String key, Object value, int distance) {
		keys[idx] = key;
		vals[idx] = value;
		dist[idx] = distance;
	}

	private void clearSlot(int idx) {
		keys[idx] = null;
		vals[idx] = null;
		dist[idx] = 0;
	}

	@SuppressWarnings("unchecked")
	private E castValue(Object value) {
		return (E) value;
	}
}
