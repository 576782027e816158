package io.github.tombstonemap;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.jupiter.api.Test;

class MapCursorTest {

	private static OrderedStringMap<Integer> mapOf(String... keys) {
		var m = new OrderedStringMap<Integer>();
		for (int i = 0; i < keys.length; i++) m.set(keys[i], i);
		return m;
	}

	private static List<String> drain(MapCursor<String> it) {
		var out = new ArrayList<String>();
		it.forEachRemaining(out::add);
		return out;
	}

	@Test
	void deleteOfRestingEntryContinuesWithSuccessor() {
		var m = mapOf("a", "b", "c");
		var c = m.keyCursor();
		assertEquals("a", c.next());
		m.delete("b");
		assertEquals("c", c.next());
		assertFalse(c.hasNext());
		assertThrows(NoSuchElementException.class, c::next);
	}

	@Test
	void deleteOfUnvisitedKeyIsSkippedAndLaterInsertsVisited() {
		var m = mapOf("a", "b", "c", "d");
		var c = m.keyCursor();
		assertEquals("a", c.next());
		m.delete("c");
		m.set("e", 9);
		m.set("b", 10); // overwrite keeps b in place
		assertEquals(List.of("b", "d", "e"), drain(c));
	}

	@Test
	void deleteOfEntryTheCursorRestsOn() {
		var m = mapOf("a", "b", "c");
		var c = m.keyCursor();
		assertEquals("a", c.next());
		assertEquals("b", c.next());
		m.delete("b");
		assertEquals("c", c.next());
	}

	@Test
	void runOfDeletionsAroundRestingEntryUnwinds() {
		var m = mapOf("a", "b", "c", "d", "e", "f");
		var c = m.keyCursor();
		c.next(); // a
		c.next(); // b
		assertEquals("c", c.next());

		// delete the resting entry, then its predecessors, then its successor
		m.delete("c");
		m.delete("b");
		m.delete("a");
		m.delete("d");
		assertEquals(List.of("e", "f"), drain(c));
	}

	@Test
	void deleteOfRestingTailThenAppend() {
		var m = mapOf("a", "b");
		var c = m.keyCursor();
		c.next();
		assertEquals("b", c.next());
		m.delete("b");
		m.set("c", 2);
		assertTrue(c.hasNext());
		assertEquals("c", c.next());
		assertFalse(c.hasNext());
	}

	@Test
	void deleteAndReinsertOfRestingKeyVisitsItAgain() {
		var m = mapOf("a", "b", "c");
		var c = m.keyCursor();
		c.next();
		assertEquals("b", c.next());
		m.delete("b");
		m.set("b", 7);
		assertEquals(List.of("c", "b"), drain(c));
	}

	@Test
	void clearMakesParkedCursorDone() {
		var m = mapOf("a", "b");
		var c = m.keyCursor();
		assertEquals("a", c.next());
		m.clear();
		assertFalse(c.hasNext());

		// done stays done
		m.set("x", 1);
		assertFalse(c.hasNext());
		assertThrows(NoSuchElementException.class, c::next);
		assertEquals(List.of("x"), drain(m.keyCursor()));
	}

	@Test
	void clearedCursorSeesKeysInsertedBeforeItsNextStep() {
		var m = mapOf("a", "b", "c");
		var c = m.keyCursor();
		c.next();
		c.next();
		m.clear();
		m.set("y", 1).set("z", 2);
		assertEquals(List.of("y", "z"), drain(c));
	}

	@Test
	void unstartedCursorAfterClear() {
		var m = mapOf("a", "b");
		var c = m.keyCursor();
		m.clear();
		assertFalse(c.hasNext());
		assertFalse(c.hasNext());
	}

	@Test
	void exhaustedCursorIgnoresLaterInserts() {
		var m = mapOf("a");
		var c = m.keyCursor();
		assertEquals(List.of("a"), drain(c));
		m.set("b", 1);
		assertFalse(c.hasNext());
		assertThrows(NoSuchElementException.class, c::next);
	}

	@Test
	void exhaustionByClearMatchesNaturalExhaustion() {
		var cleared = mapOf("a", "b");
		var natural = mapOf("a", "b");
		var c1 = cleared.keyCursor();
		var c2 = natural.keyCursor();
		c1.next();
		c2.next();
		cleared.clear();
		c2.next();

		for (int round = 0; round < 3; round++) {
			assertEquals(c2.hasNext(), c1.hasNext());
			assertThrows(NoSuchElementException.class, c1::next);
			assertThrows(NoSuchElementException.class, c2::next);
			cleared.set("n" + round, round);
			natural.set("n" + round, round);
		}
	}

	@Test
	void hasNextDoesNotCommitToAnEntry() {
		var m = mapOf("a", "b", "c");
		var c = m.keyCursor();
		c.next();
		assertTrue(c.hasNext()); // would land on b
		m.delete("b");
		assertEquals("c", c.next());
	}

	@Test
	void eachCallReturnsAFreshCursor() {
		var m = mapOf("a", "b");
		var c1 = m.keyCursor();
		c1.next();
		var c2 = m.keyCursor();
		assertEquals("a", c2.next());
		assertEquals("b", c1.next());
		assertEquals("b", c2.next());
	}

	@Test
	void cursorRemoveDeletesLastReturned() {
		var m = mapOf("a", "b", "c", "d");
		var c = m.keyCursor();
		assertThrows(IllegalStateException.class, c::remove);
		while (c.hasNext()) {
			String k = c.next();
			if (k.equals("b") || k.equals("d")) c.remove();
		}
		assertEquals(List.of("a", "c"), drain(m.keyCursor()));

		var again = m.keyCursor();
		again.next();
		again.remove();
		assertThrows(IllegalStateException.class, again::remove);
	}

	@Test
	void cursorRemoveAfterExternalDeleteIsNoOp() {
		var m = mapOf("a", "b");
		var c = m.keyCursor();
		c.next();
		m.delete("a");
		m.set("a", 5); // a new entry under the same key
		c.remove();
		assertTrue(m.has("a"));
		assertEquals(List.of("b", "a"), drain(c));
	}

	@Test
	void forEachAllowsReentrantMutation() {
		var m = mapOf("a", "b", "c", "d");
		var seen = new ArrayList<String>();
		m.forEach((k, v) -> {
			seen.add(k);
			switch (k) {
			case "a" -> m.delete("c");
			case "b" -> m.delete("b");
			case "d" -> m.set("e", 99);
			default -> { }
			}
		});
		assertEquals(List.of("a", "b", "d", "e"), seen);
		assertEquals(List.of("a", "d", "e"), drain(m.keyCursor()));
	}

	@Test
	void forEachStopsAfterClearFromAction() {
		var m = mapOf("a", "b", "c");
		var seen = new ArrayList<String>();
		m.forEach((k, v) -> {
			seen.add(k);
			if (k.equals("a")) m.clear();
		});
		assertEquals(List.of("a"), seen);
		assertTrue(m.isEmpty());
	}

	@Test
	void forEachVisitsValuesSetDuringWalk() {
		var m = mapOf("a", "b");
		var seen = new ArrayList<Integer>();
		m.forEach((k, v) -> {
			seen.add(v);
			if (k.equals("a")) m.set("b", 42);
		});
		assertEquals(List.of(0, 42), seen);
	}

	@Test
	void manyParkedCursorsSurviveMassDeletion() {
		var m = new OrderedStringMap<Integer>();
		int n = 1_000;
		for (int i = 0; i < n; i++) m.set("k" + i, i);

		var cursors = new ArrayList<MapCursor<Integer>>();
		for (int i = 0; i < 10; i++) {
			var c = m.valueCursor();
			for (int j = 0; j <= i * 97; j++) c.next();
			cursors.add(c);
		}
		for (int i = 0; i < n; i++) {
			if (i % 5 != 0) m.delete("k" + i);
		}
		for (int i = 0; i < cursors.size(); i++) {
			int last = i * 97;
			var c = cursors.get(i);
			int expected = (last / 5 + 1) * 5;
			while (c.hasNext()) {
				assertEquals(expected, c.next());
				expected += 5;
			}
			assertEquals(n, expected);
		}
	}
}
