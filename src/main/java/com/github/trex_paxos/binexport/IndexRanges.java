package com.github.trex_paxos.binexport;

import java.util.ArrayList;
import java.util.List;

/// Range compression of basic block instruction sequences.
public final class IndexRanges {

  private IndexRanges() {
  }

  /// The minimal list of half-open ranges whose concatenation is `indices`. A contiguous run
  /// becomes a single range, and a single element range omits its end.
  ///
  /// @throws DataIntegrityException if `indices` is empty, an empty block is invalid
  public static List<BasicBlock.IndexRange> compress(int blockIndex, int[] indices) {
    if (indices.length == 0) {
      throw new DataIntegrityException("basic_block", blockIndex, "instruction_index", "empty basic block");
    }
    final List<BasicBlock.IndexRange> ranges = new ArrayList<>();
    int begin = indices[0];
    int end = begin + 1;
    for (int i = 1; i < indices.length; i++) {
      if (indices[i] == end) {
        end++;
      } else {
        ranges.add(BasicBlock.IndexRange.of(begin, end));
        begin = indices[i];
        end = begin + 1;
      }
    }
    ranges.add(BasicBlock.IndexRange.of(begin, end));
    return ranges;
  }

  /// Concatenates the instruction indices of `ranges`. Ranges are expected to be valid.
  public static int[] expand(List<BasicBlock.IndexRange> ranges) {
    int total = 0;
    for (BasicBlock.IndexRange range : ranges) {
      total += Math.max(0, range.length());
    }
    final int[] result = new int[total];
    int pos = 0;
    for (BasicBlock.IndexRange range : ranges) {
      for (int i = range.beginIndex(); i < range.effectiveEnd(); i++) {
        result[pos++] = i;
      }
    }
    return result;
  }
}
