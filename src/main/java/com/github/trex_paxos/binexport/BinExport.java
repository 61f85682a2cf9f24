package com.github.trex_paxos.binexport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The top-level container of a disassembled executable. Every relation between the tables
/// is an index into a sibling table, never an object reference, so the whole graph can be
/// copied or handed to a consumer as a unit. Instances are immutable.
///
/// Instances returned by {@link BinExportReader} have been validated. Instances produced by
/// {@link BinExportBuilder} are valid by construction and are validated again on encode.
public record BinExport(
    Meta metaInformation,
    List<Expression> expression,
    List<Operand> operand,
    List<Mnemonic> mnemonic,
    List<Instruction> instruction,
    List<BasicBlock> basicBlock,
    List<FlowGraph> flowGraph,
    CallGraph callGraph,
    List<String> stringTable,
    List<Reference> addressComment,
    List<Comment> comment,
    List<Reference> stringReference,
    List<Reference> expressionSubstitution,
    List<Section> section,
    List<Library> library,
    List<DataReference> dataReference,
    List<Module> module,
    List<MdIndex> mdIndex,
    List<UnknownField> unknownFields) {

  public static final BinExport EMPTY = builder().build();

  public BinExport {
    Objects.requireNonNull(metaInformation, "metaInformation");
    Objects.requireNonNull(callGraph, "callGraph");
    expression = List.copyOf(expression);
    operand = List.copyOf(operand);
    mnemonic = List.copyOf(mnemonic);
    instruction = List.copyOf(instruction);
    basicBlock = List.copyOf(basicBlock);
    flowGraph = List.copyOf(flowGraph);
    stringTable = List.copyOf(stringTable);
    addressComment = List.copyOf(addressComment);
    comment = List.copyOf(comment);
    stringReference = List.copyOf(stringReference);
    expressionSubstitution = List.copyOf(expressionSubstitution);
    section = List.copyOf(section);
    library = List.copyOf(library);
    dataReference = List.copyOf(dataReference);
    module = List.copyOf(module);
    mdIndex = List.copyOf(mdIndex);
    unknownFields = List.copyOf(unknownFields);
  }

  public static BinExportBuilder builder() {
    return new BinExportBuilder();
  }

  /// Absolute address of every instruction, see {@link InstructionAddresses#resolve(List)}.
  public long[] instructionAddresses() {
    return InstructionAddresses.resolve(instruction);
  }

  /// Mutable holder used by the reader while parsing. Not exposed.
  static final class Tables {
    Meta meta = Meta.EMPTY;
    final ArrayList<Expression> expression = new ArrayList<>();
    final ArrayList<Operand> operand = new ArrayList<>();
    final ArrayList<Mnemonic> mnemonic = new ArrayList<>();
    final ArrayList<Instruction> instruction = new ArrayList<>();
    final ArrayList<BasicBlock> basicBlock = new ArrayList<>();
    final ArrayList<FlowGraph> flowGraph = new ArrayList<>();
    final ArrayList<CallGraph.Vertex> vertex = new ArrayList<>();
    final ArrayList<CallGraph.Edge> callEdge = new ArrayList<>();
    final ArrayList<String> stringTable = new ArrayList<>();
    final ArrayList<Reference> addressComment = new ArrayList<>();
    final ArrayList<Comment> comment = new ArrayList<>();
    final ArrayList<Reference> stringReference = new ArrayList<>();
    final ArrayList<Reference> expressionSubstitution = new ArrayList<>();
    final ArrayList<Section> section = new ArrayList<>();
    final ArrayList<Library> library = new ArrayList<>();
    final ArrayList<DataReference> dataReference = new ArrayList<>();
    final ArrayList<Module> module = new ArrayList<>();
    final ArrayList<MdIndex> mdIndex = new ArrayList<>();
    final ArrayList<UnknownField> unknownFields = new ArrayList<>();

    BinExport freeze() {
      return new BinExport(meta, expression, operand, mnemonic, instruction, basicBlock, flowGraph,
          new CallGraph(vertex, callEdge), stringTable, addressComment, comment, stringReference,
          expressionSubstitution, section, library, dataReference, module, mdIndex, unknownFields);
    }
  }
}
