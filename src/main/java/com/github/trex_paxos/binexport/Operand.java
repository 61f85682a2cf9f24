package com.github.trex_paxos.binexport;

import java.util.List;

/// An operand is one or more expressions linked into a single tree. Rendering order of
/// siblings is implicit in the order they are referenced here.
public record Operand(List<Integer> expressionIndex) {

  public Operand {
    expressionIndex = List.copyOf(expressionIndex);
  }
}
