package com.github.trex_paxos.binexport;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static org.hamcrest.Matchers.is;

public class BinExportValidatorTest extends JulLoggingConfig {

  private static BinExport.Tables minimal() {
    return TestGraphs.tables(TestGraphs.minimalFunction());
  }

  private static DataIntegrityException rejected(BinExport.Tables tables) {
    try {
      BinExportValidator.validate(tables.freeze());
    } catch (DataIntegrityException e) {
      return e;
    }
    throw new AssertionError("expected DataIntegrityException");
  }

  private static Expression child(String symbol, int parent) {
    return Expression.register(symbol).withParent(parent);
  }

  @Test
  public void builtGraphsAreValid() {
    BinExportValidator.validate(TestGraphs.minimalFunction());
    BinExportValidator.validate(BinExportCodecTest.richGraph());
    BinExportValidator.validate(BinExport.EMPTY);
  }

  @Test
  public void operandWithTwoRootsIsRejected() {
    final BinExport.Tables tables = minimal();
    tables.operand.set(0, new Operand(List.of(0, 1)));
    final DataIntegrityException e = rejected(tables);
    Assert.assertThat(e.getTable(), is("operand"));
    Assert.assertThat(e.getReason(), is("expected exactly one root expression, found 2"));
  }

  @Test
  public void emptyOperandIsRejected() {
    final BinExport.Tables tables = minimal();
    tables.operand.add(new Operand(List.of()));
    final DataIntegrityException e = rejected(tables);
    Assert.assertThat(e.getTable(), is("operand"));
    Assert.assertThat(e.getIndex(), is(2));
    Assert.assertThat(e.getReason(), is("expected exactly one root expression, found 0"));
  }

  @Test
  public void longParentChainIsCheckedInLinearTime() {
    final BinExport.Tables tables = minimal();
    final int base = tables.expression.size();
    final List<Integer> chain = new ArrayList<>();
    chain.add(0);
    tables.expression.add(child("r", 0));
    chain.add(base);
    for (int i = 1; i < 200_000; i++) {
      tables.expression.add(child("r", base + i - 1));
      chain.add(base + i);
    }
    tables.operand.add(new Operand(chain));
    final long start = System.nanoTime();
    BinExportValidator.validate(tables.freeze());
    final long millis = (System.nanoTime() - start) / 1_000_000;
    Assert.assertThat("validation took " + millis + "ms", millis < 5_000, is(true));
  }

  @Test
  public void operandWithParentOutsideIsRejected() {
    final BinExport.Tables tables = minimal();
    tables.expression.add(child("ebx", 0));
    tables.operand.add(new Operand(List.of(2)));
    final DataIntegrityException e = rejected(tables);
    Assert.assertThat(e.getTable(), is("operand"));
    Assert.assertThat(e.getIndex(), is(2));
  }

  @Test
  public void operandWithCycleIsRejected() {
    final BinExport.Tables tables = minimal();
    // 2 and 3 are each other's parent, 0 is the only root
    tables.expression.add(child("a", 3));
    tables.expression.add(child("b", 2));
    tables.operand.add(new Operand(List.of(0, 2, 3)));
    final DataIntegrityException e = rejected(tables);
    Assert.assertThat(e.getTable(), is("operand"));
    Assert.assertThat(e.getReason().startsWith("cycle"), is(true));
  }

  @Test
  public void expressionParentOutOfRangeIsRejected() {
    final BinExport.Tables tables = minimal();
    tables.expression.add(child("a", 77));
    final DataIntegrityException e = rejected(tables);
    Assert.assertThat(e.getTable(), is("expression"));
    Assert.assertThat(e.getField(), is("parent_index"));
  }

  @Test
  public void instructionIndicesAreChecked() {
    final BinExport.Tables tables = minimal();
    tables.instruction.set(0, tables.instruction.get(0).withMnemonicIndex(1));
    Assert.assertThat(rejected(tables).getField(), is("mnemonic_index"));

    final BinExport.Tables comments = minimal();
    comments.instruction.set(0, comments.instruction.get(0).withCommentIndex(List.of(0)));
    Assert.assertThat(rejected(comments).getField(), is("comment_index"));
  }

  @Test
  public void firstInstructionNeedsAnAddress() {
    final BinExport.Tables tables = minimal();
    tables.instruction.set(0, tables.instruction.get(0).withAddress(OptionalLong.empty()));
    final DataIntegrityException e = rejected(tables);
    Assert.assertThat(e.getTable(), is("instruction"));
    Assert.assertThat(e.getField(), is("address"));
  }

  @Test
  public void instructionsMustAscendByAddress() {
    final BinExport.Tables tables = minimal();
    tables.instruction.add(new Instruction(OptionalLong.of(0x0fff), List.of(), 0, List.of(),
        ByteSequence.of(TestGraphs.NOP), List.of()));
    final DataIntegrityException e = rejected(tables);
    Assert.assertThat(e.getTable(), is("instruction"));
    Assert.assertThat(e.getIndex(), is(1));

    final BinExport.Tables duplicate = minimal();
    duplicate.instruction.add(new Instruction(OptionalLong.of(0x1000), List.of(), 0, List.of(),
        ByteSequence.of(TestGraphs.NOP), List.of()));
    Assert.assertThat(rejected(duplicate).getField(), is("address"));
  }

  @Test
  public void basicBlockRangesAreChecked() {
    final BinExport.Tables empty = minimal();
    empty.basicBlock.set(0, new BasicBlock(List.of()));
    Assert.assertThat(rejected(empty).getField(), is("instruction_index"));

    final BinExport.Tables beyond = minimal();
    beyond.basicBlock.set(0, new BasicBlock(List.of(new BasicBlock.IndexRange(0, OptionalInt.of(2)))));
    Assert.assertThat(rejected(beyond).getField(), is("end_index"));

    final BinExport.Tables backwards = minimal();
    backwards.basicBlock.set(0, new BasicBlock(List.of(new BasicBlock.IndexRange(0, OptionalInt.of(0)))));
    Assert.assertThat(rejected(backwards).getField(), is("end_index"));

    final BinExport.Tables negative = minimal();
    negative.basicBlock.set(0, new BasicBlock(List.of(new BasicBlock.IndexRange(-1, OptionalInt.of(1)))));
    Assert.assertThat(rejected(negative).getField(), is("begin_index"));
  }

  @Test
  public void flowGraphMembershipIsChecked() {
    final BinExport.Tables duplicate = minimal();
    duplicate.flowGraph.set(0, new FlowGraph(List.of(0, 0), 0, List.of()));
    Assert.assertThat(rejected(duplicate).getField(), is("basic_block_index"));

    final BinExport.Tables entry = minimal();
    entry.basicBlock.add(new BasicBlock(List.of(BasicBlock.IndexRange.of(0, 1))));
    entry.flowGraph.set(0, new FlowGraph(List.of(0), 1, List.of()));
    Assert.assertThat(rejected(entry).getField(), is("entry_basic_block_index"));

    final BinExport.Tables edge = minimal();
    edge.basicBlock.add(new BasicBlock(List.of(BasicBlock.IndexRange.of(0, 1))));
    edge.flowGraph.set(0, new FlowGraph(List.of(0), 0,
        List.of(new FlowGraph.Edge(0, 1, FlowGraph.Edge.Type.UNCONDITIONAL, false))));
    Assert.assertThat(rejected(edge).getField(), is("target_basic_block_index"));

    final BinExport.Tables none = minimal();
    none.flowGraph.set(0, new FlowGraph(List.of(), 0, List.of()));
    Assert.assertThat(rejected(none).getField(), is("basic_block_index"));
  }

  @Test
  public void callGraphIndicesAreChecked() {
    final BinExport.Tables library = minimal();
    library.vertex.set(0, new CallGraph.Vertex(0x1000, CallGraph.Vertex.Type.LIBRARY, Optional.empty(),
        Optional.empty(), OptionalInt.of(3), OptionalInt.empty()));
    Assert.assertThat(rejected(library).getField(), is("library_index"));

    final BinExport.Tables edge = minimal();
    edge.callEdge.add(new CallGraph.Edge(0, 1));
    final DataIntegrityException e = rejected(edge);
    Assert.assertThat(e.getTable(), is("call_graph.edge"));
    Assert.assertThat(e.getField(), is("target_vertex_index"));

    final BinExport.Tables duplicate = minimal();
    duplicate.vertex.add(CallGraph.Vertex.of(0x1000, CallGraph.Vertex.Type.THUNK));
    Assert.assertThat(rejected(duplicate) instanceof OrderingViolationException, is(true));
  }

  @Test
  public void defaultPositionIsAlwaysAccepted() {
    final BinExportBuilder builder = BinExport.builder();
    builder.addInstruction(0x1000, TestGraphs.RET, "ret");
    builder.addComment(0x1000, "no operands here");
    BinExportValidator.validate(builder.build());
  }

  @Test
  public void commentPositionsAreChecked() {
    final BinExport.Tables operand = minimal();
    operand.stringTable.add("note");
    operand.comment.add(new Comment(0, 5, 0, 0, false, Comment.Type.DEFAULT));
    Assert.assertThat(rejected(operand).getField(), is("instruction_operand_index"));

    final BinExport.Tables expression = minimal();
    expression.stringTable.add("note");
    expression.comment.add(new Comment(0, 1, 3, 0, false, Comment.Type.DEFAULT));
    Assert.assertThat(rejected(expression).getField(), is("operand_expression_index"));

    final BinExport.Tables string = minimal();
    string.comment.add(new Comment(0, 0, 0, 0, false, Comment.Type.DEFAULT));
    Assert.assertThat(rejected(string).getField(), is("string_table_index"));
  }

  @Test
  public void referenceInstructionIsChecked() {
    final BinExport.Tables tables = minimal();
    tables.stringTable.add("s");
    tables.stringReference.add(new Reference(4, 0, 0, 0));
    final DataIntegrityException e = rejected(tables);
    Assert.assertThat(e.getTable(), is("string_reference"));
    Assert.assertThat(e.getField(), is("instruction_index"));

    final BinExport.Tables data = minimal();
    data.dataReference.add(new DataReference(1, 0x4000));
    Assert.assertThat(rejected(data).getTable(), is("data_reference"));
  }
}
