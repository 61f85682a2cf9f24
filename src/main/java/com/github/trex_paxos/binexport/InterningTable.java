package com.github.trex_paxos.binexport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Canonicalizing store mapping content to a stable index. At most one entry exists per
/// distinct value, entries are never removed or mutated, and equal values always get the
/// same index. This is what keeps storage at O(distinct content) when a hostile binary
/// repeats the same instruction or block millions of times.
///
/// Lookups of already interned values are lock free. Inserts take a single write lock and
/// re-check under it so concurrent inserts of equal content collapse to one index.
///
/// @param <T> an immutable value type with content based equals and hashCode
public final class InterningTable<T> {

  private static final Logger logger = Logger.getLogger(InterningTable.class.getName());

  /// Largest table a Java array list can hold, index fields are int32 on the wire.
  public static final int DEFAULT_CAPACITY = Integer.MAX_VALUE - 8;

  private final String name;
  private final int capacity;
  private final Map<T, Integer> index = new ConcurrentHashMap<>();
  private final List<T> values = new ArrayList<>();
  private final GuardedReentrantReadWriteLock lock = new GuardedReentrantReadWriteLock();

  public InterningTable(String name) {
    this(name, DEFAULT_CAPACITY);
  }

  public InterningTable(String name, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, got " + capacity);
    }
    this.name = name;
    this.capacity = capacity;
  }

  /// Returns the index of `value`, appending it if it was not seen before.
  ///
  /// @throws CapacityExceededException if a new entry would not fit, nothing is appended
  public int intern(T value) {
    Objects.requireNonNull(value, "value");
    Integer existing = index.get(value);
    if (existing != null) {
      return existing;
    }
    try (var ignored = lock.writeLock()) {
      existing = index.get(value);
      if (existing != null) {
        return existing;
      }
      final int next = values.size();
      if (next >= capacity) {
        throw new CapacityExceededException(name, capacity);
      }
      values.add(value);
      // publish to the map last so lock free readers only see indices that resolve
      index.put(value, next);
      logger.log(Level.FINEST, () -> String.format("%s interned %d: %s", name, next, value));
      return next;
    }
  }

  /// @return the index of a previously interned value, or -1.
  public int indexOf(T value) {
    Integer existing = index.get(value);
    return existing == null ? -1 : existing;
  }

  public T get(int i) {
    try (var ignored = lock.readLock()) {
      return values.get(i);
    }
  }

  public int size() {
    try (var ignored = lock.readLock()) {
      return values.size();
    }
  }

  /// An immutable copy of the table in index order.
  public List<T> snapshot() {
    try (var ignored = lock.readLock()) {
      return Collections.unmodifiableList(new ArrayList<>(values));
    }
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return String.format("InterningTable[%s, size=%d]", name, size());
  }
}
