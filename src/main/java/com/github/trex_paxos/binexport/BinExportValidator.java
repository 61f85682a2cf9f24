package com.github.trex_paxos.binexport;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static com.github.trex_paxos.binexport.DataIntegrityException.outOfRange;

/// Structural checks run on every graph before it is written and after it is read. A graph
/// that passes can be navigated by index without bounds checks: every index points into its
/// table, every operand is a single tree, every basic block is a non-empty run of
/// instructions and the call graph can be binary searched.
public final class BinExportValidator {

  private BinExportValidator() {
  }

  /// @throws DataIntegrityException naming the first offending table, record and field
  /// @throws OrderingViolationException if the call graph vertices are not strictly ascending
  public static void validate(BinExport binExport) {
    validateExpressions(binExport);
    validateOperands(binExport);
    validateInstructions(binExport);
    validateBasicBlocks(binExport);
    validateFlowGraphs(binExport);
    validateCallGraph(binExport);
    validateReferences("address_comment", binExport.addressComment(), binExport);
    validateReferences("string_reference", binExport.stringReference(), binExport);
    validateReferences("expression_substitution", binExport.expressionSubstitution(), binExport);
    validateComments(binExport);
    validateDataReferences(binExport);
  }

  private static void checkIndex(String table, int index, String field, long value, int limit) {
    if (value < 0 || value >= limit) {
      throw outOfRange(table, index, field, value, limit);
    }
  }

  private static void validateExpressions(BinExport binExport) {
    final List<Expression> expressions = binExport.expression();
    for (int i = 0; i < expressions.size(); i++) {
      final OptionalInt parent = expressions.get(i).parentIndex();
      if (parent.isPresent()) {
        checkIndex("expression", i, "parent_index", parent.getAsInt(), expressions.size());
      }
    }
  }

  /// Each operand lists every node of one expression tree: exactly one node without a parent
  /// and every other node's parent inside the same list. An empty operand has no root.
  private static void validateOperands(BinExport binExport) {
    final List<Expression> expressions = binExport.expression();
    final List<Operand> operands = binExport.operand();
    for (int i = 0; i < operands.size(); i++) {
      final List<Integer> members = operands.get(i).expressionIndex();
      final Set<Integer> memberSet = new HashSet<>(members);
      int roots = 0;
      for (int expressionIndex : members) {
        checkIndex("operand", i, "expression_index", expressionIndex, expressions.size());
        final Expression expression = expressions.get(expressionIndex);
        if (expression.isRoot()) {
          roots++;
        } else if (!memberSet.contains(expression.parentIndex().getAsInt())) {
          throw new DataIntegrityException("operand", i, "expression_index", String.format(
              "parent %d of expression %d is not part of the operand",
              expression.parentIndex().getAsInt(), expressionIndex));
        }
      }
      if (roots != 1) {
        throw new DataIntegrityException("operand", i, "expression_index",
            String.format("expected exactly one root expression, found %d", roots));
      }
      checkAcyclic(expressions, i, memberSet);
    }
  }

  /// Follows parent links from every member, each node is walked at most once. A walk that
  /// meets a node of its own path has found a cycle; one that meets a node already known to
  /// reach the root stops there.
  private static void checkAcyclic(List<Expression> expressions, int operand, Set<Integer> members) {
    final Set<Integer> reachesRoot = new HashSet<>(members.size() * 2);
    final Set<Integer> path = new HashSet<>();
    for (int start : members) {
      int current = start;
      while (!reachesRoot.contains(current)) {
        if (!path.add(current)) {
          throw new DataIntegrityException("operand", operand, "expression_index",
              "cycle through expression " + current);
        }
        final OptionalInt parent = expressions.get(current).parentIndex();
        if (parent.isEmpty()) break;
        current = parent.getAsInt();
      }
      reachesRoot.addAll(path);
      path.clear();
    }
  }

  private static void validateInstructions(BinExport binExport) {
    final List<Instruction> instructions = binExport.instruction();
    if (!instructions.isEmpty() && instructions.get(0).address().isEmpty()) {
      throw new DataIntegrityException("instruction", 0, "address",
          "first instruction must have an explicit address");
    }
    final long[] addresses = InstructionAddresses.resolve(instructions);
    for (int i = 1; i < addresses.length; i++) {
      if (Long.compareUnsigned(addresses[i - 1], addresses[i]) >= 0) {
        throw new DataIntegrityException("instruction", i, "address", String.format(
            "address 0x%x does not follow 0x%x", addresses[i], addresses[i - 1]));
      }
    }
    final int mnemonics = binExport.mnemonic().size();
    final int operands = binExport.operand().size();
    final int comments = binExport.comment().size();
    for (int i = 0; i < instructions.size(); i++) {
      final Instruction instruction = instructions.get(i);
      checkIndex("instruction", i, "mnemonic_index", instruction.mnemonicIndex(), mnemonics);
      for (int operand : instruction.operandIndex()) {
        checkIndex("instruction", i, "operand_index", operand, operands);
      }
      for (int comment : instruction.commentIndex()) {
        checkIndex("instruction", i, "comment_index", comment, comments);
      }
    }
  }

  private static void validateBasicBlocks(BinExport binExport) {
    final int instructions = binExport.instruction().size();
    final List<BasicBlock> blocks = binExport.basicBlock();
    for (int i = 0; i < blocks.size(); i++) {
      final List<BasicBlock.IndexRange> ranges = blocks.get(i).instructionIndex();
      if (ranges.isEmpty()) {
        throw new DataIntegrityException("basic_block", i, "instruction_index", "empty basic block");
      }
      for (BasicBlock.IndexRange range : ranges) {
        checkIndex("basic_block", i, "begin_index", range.beginIndex(), instructions);
        final int end = range.effectiveEnd();
        if (end <= range.beginIndex() || end > instructions) {
          throw new DataIntegrityException("basic_block", i, "end_index", String.format(
              "range [%d, %d) is empty or exceeds %d instructions", range.beginIndex(), end, instructions));
        }
      }
    }
  }

  private static void validateFlowGraphs(BinExport binExport) {
    final int blocks = binExport.basicBlock().size();
    final List<FlowGraph> flowGraphs = binExport.flowGraph();
    for (int i = 0; i < flowGraphs.size(); i++) {
      final FlowGraph flowGraph = flowGraphs.get(i);
      if (flowGraph.basicBlockIndex().isEmpty()) {
        throw new DataIntegrityException("flow_graph", i, "basic_block_index", "flow graph has no basic blocks");
      }
      final Set<Integer> members = new HashSet<>();
      for (int block : flowGraph.basicBlockIndex()) {
        checkIndex("flow_graph", i, "basic_block_index", block, blocks);
        if (!members.add(block)) {
          throw new DataIntegrityException("flow_graph", i, "basic_block_index",
              "duplicate basic block " + block);
        }
      }
      checkMember(members, i, "entry_basic_block_index", flowGraph.entryBasicBlockIndex());
      for (FlowGraph.Edge edge : flowGraph.edge()) {
        checkMember(members, i, "source_basic_block_index", edge.sourceBasicBlockIndex());
        checkMember(members, i, "target_basic_block_index", edge.targetBasicBlockIndex());
      }
    }
  }

  private static void checkMember(Set<Integer> members, int flowGraph, String field, int block) {
    if (!members.contains(block)) {
      throw new DataIntegrityException("flow_graph", flowGraph, field,
          String.format("basic block %d is not part of the flow graph", block));
    }
  }

  private static void validateCallGraph(BinExport binExport) {
    final List<CallGraph.Vertex> vertices = binExport.callGraph().vertex();
    final int libraries = binExport.library().size();
    final int modules = binExport.module().size();
    for (int i = 0; i < vertices.size(); i++) {
      final CallGraph.Vertex vertex = vertices.get(i);
      if (i > 0 && Long.compareUnsigned(vertices.get(i - 1).address(), vertex.address()) >= 0) {
        throw new OrderingViolationException(i, String.format("address 0x%x does not follow 0x%x",
            vertex.address(), vertices.get(i - 1).address()));
      }
      if (vertex.libraryIndex().isPresent()) {
        checkIndex("call_graph.vertex", i, "library_index", vertex.libraryIndex().getAsInt(), libraries);
      }
      if (vertex.moduleIndex().isPresent()) {
        checkIndex("call_graph.vertex", i, "module_index", vertex.moduleIndex().getAsInt(), modules);
      }
    }
    final List<CallGraph.Edge> edges = binExport.callGraph().edge();
    for (int i = 0; i < edges.size(); i++) {
      checkIndex("call_graph.edge", i, "source_vertex_index", edges.get(i).sourceVertexIndex(), vertices.size());
      checkIndex("call_graph.edge", i, "target_vertex_index", edges.get(i).targetVertexIndex(), vertices.size());
    }
  }

  private static void validateReferences(String table, List<Reference> references, BinExport binExport) {
    for (int i = 0; i < references.size(); i++) {
      final Reference reference = references.get(i);
      checkPosition(table, i, binExport, reference.instructionIndex(), reference.instructionOperandIndex(),
          reference.operandExpressionIndex());
      checkIndex(table, i, "string_table_index", reference.stringTableIndex(), binExport.stringTable().size());
    }
  }

  private static void validateComments(BinExport binExport) {
    final List<Comment> comments = binExport.comment();
    for (int i = 0; i < comments.size(); i++) {
      final Comment comment = comments.get(i);
      checkPosition("comment", i, binExport, comment.instructionIndex(), comment.instructionOperandIndex(),
          comment.operandExpressionIndex());
      checkIndex("comment", i, "string_table_index", comment.stringTableIndex(), binExport.stringTable().size());
    }
  }

  /// Position 0 is the field default and is accepted even for an instruction without operands.
  private static void checkPosition(String table, int index, BinExport binExport,
                                    int instructionIndex, int operandPosition, int expressionPosition) {
    final List<Instruction> instructions = binExport.instruction();
    checkIndex(table, index, "instruction_index", instructionIndex, instructions.size());
    final List<Integer> operands = instructions.get(instructionIndex).operandIndex();
    if (operandPosition != 0) {
      checkIndex(table, index, "instruction_operand_index", operandPosition, operands.size());
    }
    if (expressionPosition != 0) {
      final int operandSize = operandPosition < operands.size()
          ? binExport.operand().get(operands.get(operandPosition)).expressionIndex().size()
          : 0;
      checkIndex(table, index, "operand_expression_index", expressionPosition, operandSize);
    }
  }

  private static void validateDataReferences(BinExport binExport) {
    final List<DataReference> references = binExport.dataReference();
    for (int i = 0; i < references.size(); i++) {
      checkIndex("data_reference", i, "instruction_index", references.get(i).instructionIndex(),
          binExport.instruction().size());
    }
  }
}
