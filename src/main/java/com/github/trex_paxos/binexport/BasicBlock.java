package com.github.trex_paxos.binexport;

import java.util.List;
import java.util.OptionalInt;

/// A basic block as ranges over the instruction table. The instructions of a block are
/// usually one contiguous run but not always, so a block may need several ranges. The
/// concatenation of the ranges, in order, is the block's instruction sequence.
public record BasicBlock(List<IndexRange> instructionIndex) {

  public BasicBlock {
    instructionIndex = List.copyOf(instructionIndex);
  }

  /// Works like a begin and end iterator pair, `[beginIndex, endIndex)`. A range holding a
  /// single instruction omits the end.
  public record IndexRange(int beginIndex, OptionalInt endIndex) {

    public static IndexRange of(int begin, int end) {
      return end == begin + 1
          ? new IndexRange(begin, OptionalInt.empty())
          : new IndexRange(begin, OptionalInt.of(end));
    }

    /// The exclusive end, `beginIndex + 1` when omitted.
    public int effectiveEnd() {
      return endIndex.orElse(beginIndex + 1);
    }

    public int length() {
      return effectiveEnd() - beginIndex;
    }
  }

  /// Expands the ranges into the block's instruction indices.
  public int[] instructions() {
    return IndexRanges.expand(instructionIndex);
  }
}
