package io.github.tombstonemap;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class OrderedMapBenchmark {

	private static String[] randomKeys(Random rnd, int n) {
		String[] keys = new String[n];
		for (int i = 0; i < n; i++) keys[i] = Integer.toHexString(rnd.nextInt());
		return keys;
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "100", "1000", "10000" })
		int size;

		OrderedStringMap<Integer> ordered;
		LinkedHashMap<String, Integer> linked;
		HashMap<String, Integer> jdk;
		String[] keys;
		String[] misses;
		Random rnd;

		@Setup(Level.Trial)
		public void setup() {
			rnd = new Random(123);
			keys = randomKeys(rnd, size);
			misses = new String[size];
			for (int i = 0; i < size; i++) misses[i] = "miss-" + keys[i];
			ordered = new OrderedStringMap<>();
			linked = new LinkedHashMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				ordered.put(keys[i], i);
				linked.put(keys[i], i);
				jdk.put(keys[i], i);
			}
		}

		String nextKey() { return keys[rnd.nextInt(keys.length)]; }
		String nextMiss() { return misses[rnd.nextInt(misses.length)]; }
	}

	@State(Scope.Thread)
	public static class ChurnState {
		@Param({ "100", "1000", "10000" })
		int size;

		OrderedStringMap<Integer> ordered;
		LinkedHashMap<String, Integer> linked;
		String[] keys;
		int cursor;

		@Setup(Level.Trial)
		public void initKeys() {
			keys = randomKeys(new Random(456), size * 2);
		}

		@Setup(Level.Iteration)
		public void resetMaps() {
			ordered = new OrderedStringMap<>();
			linked = new LinkedHashMap<>();
			for (int i = 0; i < size; i++) {
				ordered.put(keys[i], i);
				linked.put(keys[i], i);
			}
			cursor = 0;
		}

		/* delete the oldest of a sliding window and append a new key */
		String evictKey() { return keys[cursor % keys.length]; }
		String appendKey() { return keys[(cursor++ + size) % keys.length]; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public int orderedGetHit(ReadState s) {
		return s.ordered.get(s.nextKey());
	}

	@Benchmark
	public int linkedGetHit(ReadState s) {
		return s.linked.get(s.nextKey());
	}

	@Benchmark
	public int jdkGetHit(ReadState s) {
		return s.jdk.get(s.nextKey());
	}

	@Benchmark
	public int orderedGetMiss(ReadState s) {
		Integer v = s.ordered.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	@Benchmark
	public int linkedGetMiss(ReadState s) {
		Integer v = s.linked.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	// ------- iterate -------
	@Benchmark
	public long orderedIterate(ReadState s) {
		long sum = 0;
		for (var it = s.ordered.valueCursor(); it.hasNext(); ) sum += it.next();
		return sum;
	}

	@Benchmark
	public long linkedIterate(ReadState s) {
		long sum = 0;
		for (int v : s.linked.values()) sum += v;
		return sum;
	}

	// ------- sliding window: delete oldest, append newest -------
	@Benchmark
	public boolean orderedChurn(ChurnState s) {
		boolean removed = s.ordered.delete(s.evictKey());
		s.ordered.set(s.appendKey(), s.cursor);
		return removed;
	}

	@Benchmark
	public boolean linkedChurn(ChurnState s) {
		boolean removed = s.linked.remove(s.evictKey()) != null;
		s.linked.put(s.appendKey(), s.cursor);
		return removed;
	}
}
