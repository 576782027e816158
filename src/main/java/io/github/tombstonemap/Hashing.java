package io.github.tombstonemap;

/**
 * Hash mixing and table sizing for {@link KeyIndex}.
 * The mixing step is the one Guava uses (Kevin Bourrillion, Jesse Wilson, Austin Appleby),
 * taken from an intermediate step of MurmurHash3 (public domain).
 */
final class Hashing {

	private Hashing() {}

	private static final long C1 = 0xcc9e2d51L;
	private static final long C2 = 0x1b873593L;

	static final int MIN_TABLE_SIZE = 16;

	/* Keep the table a power of two (Guava's Ints.MAX_POWER_OF_TWO). */
	static final int MAX_TABLE_SIZE = 1 << 30;

	static int smear(int hashCode) {
		return (int) (C2 * Integer.rotateLeft((int) (hashCode * C1), 15));
	}

	static int hash(String key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
		return smear(key.hashCode());
	}

	static int tableSizeFor(int requested) {
		if (requested < 0) {
			throw new IllegalArgumentException("initialCapacity must be >= 0: " + requested);
		}
		int cap = Math.max(MIN_TABLE_SIZE, requested);
		if (cap >= MAX_TABLE_SIZE) return MAX_TABLE_SIZE;
		return Integer.highestOneBit(cap - 1) << 1;
	}

	static int maxLoad(int tableSize, double loadFactor) {
		int ml = (int) (tableSize * loadFactor);
		return Math.max(1, Math.min(ml, tableSize - 1));
	}

	static double validateLoadFactor(double loadFactor) {
		if (!(loadFactor > 0.0d && loadFactor < 1.0d)) {
			throw new IllegalArgumentException("loadFactor must be in (0,1): " + loadFactor);
		}
		return loadFactor;
	}
}
