package com.github.trex_paxos.binexport;

import java.util.List;
import java.util.Objects;

/// The control flow graph of one function. Block and edge endpoint indices point into the
/// global basic block table; the validator requires the entry block and both ends of every
/// edge to be members of `basicBlockIndex`.
///
/// @param basicBlockIndex       global basic block indices sorted by block address
/// @param entryBasicBlockIndex  the block whose first instruction is the function entry
/// @param edge                  control flow edges
public record FlowGraph(List<Integer> basicBlockIndex, int entryBasicBlockIndex, List<Edge> edge) {

  public FlowGraph {
    basicBlockIndex = List.copyOf(basicBlockIndex);
    edge = List.copyOf(edge);
  }

  /// The source instruction is the last instruction of the source block, the target
  /// instruction the first instruction of the target block.
  public record Edge(int sourceBasicBlockIndex, int targetBasicBlockIndex, Type type, boolean isBackEdge) {

    public Edge {
      Objects.requireNonNull(type, "type");
    }

    public enum Type {
      CONDITION_TRUE(1),
      CONDITION_FALSE(2),
      UNCONDITIONAL(3),
      SWITCH(4);

      public static final Type DEFAULT = UNCONDITIONAL;

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
}
