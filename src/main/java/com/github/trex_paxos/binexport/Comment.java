package com.github.trex_paxos.binexport;

import java.util.Objects;

/// A comment attached to an instruction, or to one of its operands or expressions. There is
/// an N:M mapping between instructions and comments.
///
/// @param repeatable  the comment is propagated to all locations referencing this one
public record Comment(
    int instructionIndex,
    int instructionOperandIndex,
    int operandExpressionIndex,
    int stringTableIndex,
    boolean repeatable,
    Type type) {

  public Comment {
    Objects.requireNonNull(type, "type");
  }

  public enum Type {
    /// Displayed next to the instruction.
    DEFAULT(0),
    /// A line displayed above the instruction.
    ANTERIOR(1),
    /// A line displayed below the instruction.
    POSTERIOR(2),
    /// Applies to the beginning of a function.
    FUNCTION(3),
    /// Named constants and bitfields.
    ENUM(4),
    /// Named locations, usually jump targets.
    LOCATION(5),
    /// Data cross references.
    GLOBAL_REFERENCE(6),
    /// Local or stack variables.
    LOCAL_REFERENCE(7);

    private final int number;

    Type(int number) {
      this.number = number;
    }

    public int number() {
      return number;
    }

    public static Type forNumber(int number) {
      for (Type t : values()) {
        if (t.number == number) return t;
      }
      return null;
    }
  }
}
