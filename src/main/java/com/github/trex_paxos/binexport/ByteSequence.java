package com.github.trex_paxos.binexport;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/// A ByteSequence wraps a byte array and adds equals and hashcode so that raw
/// instruction bytes and sideband payloads can take part in record equality and be
/// used as interning keys. It is immutable: construct it with `copyOf` unless you are
/// sure the wrapped array is never mutated, in which case `of` avoids the copy.
@RequiredArgsConstructor
public final class ByteSequence {
  public static final ByteSequence EMPTY = new ByteSequence(new byte[0]);

  final byte[] bytes;

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ByteSequence that = (ByteSequence) o;
    return Arrays.equals(bytes, that.bytes);
  }

  // memoized on first use, interning hashes the same bytes many times
  @Getter(lazy = true)
  private final int hashCode = Arrays.hashCode(bytes);

  @Override
  public int hashCode() {
    return this.getHashCode();
  }

  /// Space separated hex, e.g. `b8 01 00 00 00`.
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < bytes.length; i++) {
      if (i > 0) sb.append(' ');
      sb.append(String.format("%02x", bytes[i]));
    }
    return sb.toString();
  }

  /// This takes a defensive copy of the passed bytes.
  public static ByteSequence copyOf(byte[] bytes) {
    return new ByteSequence(bytes.clone());
  }

  /// This does not take a defensive copy of the passed bytes.
  public static ByteSequence of(byte[] bytes) {
    return new ByteSequence(bytes);
  }

  /// @return a copy of the wrapped bytes.
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }
}
