package com.github.trex_paxos.binexport;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/// One node of an operand's expression tree. The tree is stored as a parent-indexed forest:
/// the second operand of `mov eax, b4 [ebx + 12]` is
/// <pre>
/// "b4" --- "[" --- "+" --- "ebx"
///                       \  "12"
/// </pre>
/// Expressions are content addressed. Because the parent index is part of the content, two
/// identical subtrees hanging off the same parent share their records.
///
/// @param type          defaults to IMMEDIATE_INT on the wire
/// @param symbol        e.g. "eax", "[", "+"
/// @param immediate     integer value, an unsigned 64 bit quantity
/// @param parentIndex   index into the expression table, absent for the root
/// @param isRelocation  true if the expression has an entry in the relocation table
public record Expression(
    Type type,
    Optional<String> symbol,
    OptionalLong immediate,
    OptionalInt parentIndex,
    boolean isRelocation) {

  public Expression {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(symbol, "symbol");
    Objects.requireNonNull(immediate, "immediate");
    Objects.requireNonNull(parentIndex, "parentIndex");
  }

  public enum Type {
    SYMBOL(1),
    IMMEDIATE_INT(2),
    IMMEDIATE_FLOAT(3),
    OPERATOR(4),
    REGISTER(5),
    SIZE_PREFIX(6),
    DEREFERENCE(7);

    /// IMMEDIATE_INT is by far the most common type so it is the one omitted on the wire.
    public static final Type DEFAULT = IMMEDIATE_INT;

    private final int number;

    Type(int number) {
      this.number = number;
    }

    public int number() {
      return number;
    }

    /// @return the type for a wire number, or null if the number is unknown.
    public static Type forNumber(int number) {
      for (Type t : values()) {
        if (t.number == number) return t;
      }
      return null;
    }
  }

  public boolean isRoot() {
    return parentIndex.isEmpty();
  }

  /// The same expression re-parented, used when interning a subtree under its parent.
  public Expression withParent(int parent) {
    return new Expression(type, symbol, immediate, OptionalInt.of(parent), isRelocation);
  }

  public static Expression register(String name) {
    return new Expression(Type.REGISTER, Optional.of(name), OptionalLong.empty(), OptionalInt.empty(), false);
  }

  public static Expression immediate(long value) {
    return new Expression(Type.IMMEDIATE_INT, Optional.empty(), OptionalLong.of(value), OptionalInt.empty(), false);
  }
}
