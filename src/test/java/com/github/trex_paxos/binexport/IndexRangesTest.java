package com.github.trex_paxos.binexport;

import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.hamcrest.Matchers.is;

public class IndexRangesTest extends JulLoggingConfig {

  @Test
  public void contiguousRunIsOneRange() {
    final List<BasicBlock.IndexRange> ranges = IndexRanges.compress(0, new int[]{3, 4, 5});
    Assert.assertThat(ranges, is(List.of(new BasicBlock.IndexRange(3, OptionalInt.of(6)))));
  }

  @Test
  public void singleInstructionOmitsEnd() {
    final List<BasicBlock.IndexRange> ranges = IndexRanges.compress(0, new int[]{7});
    Assert.assertThat(ranges, is(List.of(new BasicBlock.IndexRange(7, OptionalInt.empty()))));
    Assert.assertThat(ranges.get(0).effectiveEnd(), is(8));
    Assert.assertThat(ranges.get(0).length(), is(1));
  }

  @Test
  public void gapsSplitRanges() {
    final int[] indices = {1, 2, 9, 10, 11, 4};
    final List<BasicBlock.IndexRange> ranges = IndexRanges.compress(0, indices);
    Assert.assertThat(ranges, is(List.of(
        BasicBlock.IndexRange.of(1, 3),
        BasicBlock.IndexRange.of(9, 12),
        BasicBlock.IndexRange.of(4, 5))));
    Assert.assertArrayEquals(indices, IndexRanges.expand(ranges));
  }

  @Test
  public void emptyBlockIsRejected() {
    try {
      IndexRanges.compress(3, new int[0]);
      Assert.fail("expected DataIntegrityException");
    } catch (DataIntegrityException e) {
      Assert.assertThat(e.getTable(), is("basic_block"));
      Assert.assertThat(e.getIndex(), is(3));
    }
  }

  @Test
  public void basicBlockExpandsItsRanges() {
    final BasicBlock block = new BasicBlock(List.of(BasicBlock.IndexRange.of(0, 2), BasicBlock.IndexRange.of(5, 6)));
    Assert.assertArrayEquals(new int[]{0, 1, 5}, block.instructions());
  }
}
