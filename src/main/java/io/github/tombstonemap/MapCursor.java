package io.github.tombstonemap;

import java.util.Iterator;

/**
 * Lazy insertion-order traversal over an {@link OrderedStringMap}.
 *
 * <p>A cursor stays correct while the map is mutated between calls: keys deleted ahead of it are
 * skipped, keys inserted ahead of it are visited, and deleting the entry it last returned does
 * not lose its place. Once {@link #hasNext()} has reported {@code false} it keeps doing so, even
 * if keys are inserted afterwards.
 *
 * <p>{@link #remove()} deletes the entry last returned by {@link #next()} if it is still in the
 * map; if it has already been deleted through the map the call does nothing.
 */
public interface MapCursor<T> extends Iterator<T> {
}
