package com.github.trex_paxos.binexport;

import java.util.List;

/// Small graphs shared by the tests.
final class TestGraphs {

  /// `mov eax, 1`
  static final byte[] MOV_EAX_1 = {(byte) 0xb8, 0x01, 0x00, 0x00, 0x00};
  static final byte[] NOP = {(byte) 0x90};
  static final byte[] RET = {(byte) 0xc3};

  private TestGraphs() {
  }

  /// One function at 0x1000 holding the single instruction `mov eax, 1`.
  static BinExport minimalFunction() {
    final BinExportBuilder builder = BinExport.builder();
    builder.addInstruction(0x1000L, MOV_EAX_1, "mov",
        ExpressionNode.register("eax"), ExpressionNode.immediate(1));
    final int block = builder.addBasicBlock(List.of(0x1000L));
    builder.flowGraph(0x1000L).addBasicBlock(block);
    builder.callGraph().addVertex(0x1000L, CallGraph.Vertex.Type.NORMAL);
    return builder.build();
  }

  /// Copies a graph into mutable tables so a test can break it.
  static BinExport.Tables tables(BinExport binExport) {
    final BinExport.Tables tables = new BinExport.Tables();
    tables.meta = binExport.metaInformation();
    tables.expression.addAll(binExport.expression());
    tables.operand.addAll(binExport.operand());
    tables.mnemonic.addAll(binExport.mnemonic());
    tables.instruction.addAll(binExport.instruction());
    tables.basicBlock.addAll(binExport.basicBlock());
    tables.flowGraph.addAll(binExport.flowGraph());
    tables.vertex.addAll(binExport.callGraph().vertex());
    tables.callEdge.addAll(binExport.callGraph().edge());
    tables.stringTable.addAll(binExport.stringTable());
    tables.addressComment.addAll(binExport.addressComment());
    tables.comment.addAll(binExport.comment());
    tables.stringReference.addAll(binExport.stringReference());
    tables.expressionSubstitution.addAll(binExport.expressionSubstitution());
    tables.section.addAll(binExport.section());
    tables.library.addAll(binExport.library());
    tables.dataReference.addAll(binExport.dataReference());
    tables.module.addAll(binExport.module());
    tables.mdIndex.addAll(binExport.mdIndex());
    tables.unknownFields.addAll(binExport.unknownFields());
    return tables;
  }
}
