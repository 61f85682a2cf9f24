package com.github.trex_paxos.binexport;

import com.github.trex_paxos.binexport.proto.BinExport2;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.UnknownFieldSet;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.trex_paxos.binexport.BinExportFormat.*;

/// Parses the BinExport2 wire format and validates the result before returning it.
///
/// The bytes are parsed by the protobuf runtime into the generated {@link BinExport2}
/// message, which is then copied into the immutable tables of {@link BinExport}. Nothing is
/// returned unless every index in the graph has been checked, see {@link BinExportValidator}.
/// Decoding has no shared state, so independent inputs can be decoded in parallel.
///
/// Absent fields take their schema default. Unknown top-level fields, including schema
/// extensions, are kept in {@link BinExport#unknownFields()}; unknown fields inside nested
/// messages are skipped. A schema field that arrives with the wrong wire type, an unknown
/// enum value and any group are rejected.
public final class BinExportReader {

  private static final Logger logger = Logger.getLogger(BinExportReader.class.getName());

  private final long maxMessageBytes;

  public BinExportReader() {
    this(getMaxMessageBytesOrDefault(BinExportReader.class));
  }

  public BinExportReader(long maxMessageBytes) {
    if (maxMessageBytes <= 0 || maxMessageBytes > DEFAULT_MAX_MESSAGE_BYTES) {
      throw new IllegalArgumentException("maxMessageBytes out of range: " + maxMessageBytes);
    }
    this.maxMessageBytes = maxMessageBytes;
  }

  public static Builder builder() {
    return new Builder();
  }

  /// Decodes with the default limits.
  public static BinExport decode(byte[] bytes) {
    return new BinExportReader().read(bytes);
  }

  /// @throws DataIntegrityException for malformed wire data or an invalid graph
  /// @throws OrderingViolationException if call graph vertices are not sorted by address
  /// @throws CapacityExceededException if the input is larger than the configured limit
  public BinExport read(byte[] bytes) {
    if (bytes.length > maxMessageBytes) {
      throw new CapacityExceededException(MESSAGE, maxMessageBytes);
    }
    final BinExport2 message;
    try {
      message = BinExport2.parseFrom(bytes);
    } catch (InvalidProtocolBufferException e) {
      final DataIntegrityException rejected =
          new DataIntegrityException(MESSAGE, DataIntegrityException.NO_INDEX, "wire", e.getMessage(), e);
      logger.log(Level.WARNING, () -> "rejecting input: " + rejected.getMessage());
      throw rejected;
    }
    final BinExport binExport;
    try {
      binExport = toBinExport(message);
    } catch (DataIntegrityException e) {
      logger.log(Level.WARNING, () -> "rejecting input: " + e.getMessage());
      throw e;
    }
    logger.log(Level.FINE, () -> String.format("decoded %d bytes: %d instructions, %d flow graphs, %d functions",
        bytes.length, binExport.instruction().size(), binExport.flowGraph().size(),
        binExport.callGraph().vertex().size()));
    try {
      BinExportValidator.validate(binExport);
    } catch (DataIntegrityException e) {
      logger.log(Level.WARNING, () -> "rejecting input: " + e.getMessage());
      throw e;
    }
    return binExport;
  }

  private static DataIntegrityException malformed(String reason) {
    return new DataIntegrityException(MESSAGE, DataIntegrityException.NO_INDEX, "wire", reason);
  }

  @SuppressWarnings("deprecation")
  private static BinExport toBinExport(BinExport2 message) {
    final BinExport.Tables tables = new BinExport.Tables();
    keepUnknownFields(message, tables);
    if (message.hasMetaInformation()) {
      tables.meta = readMeta(message.getMetaInformation());
    }
    for (BinExport2.Expression expression : message.getExpressionList()) {
      tables.expression.add(readExpression(expression, tables.expression.size()));
    }
    for (BinExport2.Operand operand : message.getOperandList()) {
      checkUnknownFields(operand, "operand", tables.operand.size());
      tables.operand.add(new Operand(operand.getExpressionIndexList()));
    }
    for (BinExport2.Mnemonic mnemonic : message.getMnemonicList()) {
      checkUnknownFields(mnemonic, "mnemonic", tables.mnemonic.size());
      tables.mnemonic.add(new Mnemonic(mnemonic.getName()));
    }
    for (BinExport2.Instruction instruction : message.getInstructionList()) {
      tables.instruction.add(readInstruction(instruction, tables.instruction.size()));
    }
    for (BinExport2.BasicBlock basicBlock : message.getBasicBlockList()) {
      tables.basicBlock.add(readBasicBlock(basicBlock, tables.basicBlock.size()));
    }
    for (BinExport2.FlowGraph flowGraph : message.getFlowGraphList()) {
      tables.flowGraph.add(readFlowGraph(flowGraph, tables.flowGraph.size()));
    }
    if (message.hasCallGraph()) {
      readCallGraph(message.getCallGraph(), tables);
    }
    tables.stringTable.addAll(message.getStringTableList());
    readReferences("address_comment", message.getAddressCommentList(), tables.addressComment);
    readReferences("string_reference", message.getStringReferenceList(), tables.stringReference);
    readReferences("expression_substitution", message.getExpressionSubstitutionList(),
        tables.expressionSubstitution);
    for (BinExport2.Comment comment : message.getCommentList()) {
      tables.comment.add(readComment(comment, tables.comment.size()));
    }
    for (BinExport2.Section section : message.getSectionList()) {
      checkUnknownFields(section, "section", tables.section.size());
      tables.section.add(new Section(section.getAddress(), section.getSize(), section.getFlagR(),
          section.getFlagW(), section.getFlagX()));
    }
    for (BinExport2.Library library : message.getLibraryList()) {
      checkUnknownFields(library, "library", tables.library.size());
      tables.library.add(new Library(library.getIsStatic(), library.getLoadAddress(),
          optional(library.hasName(), library.getName())));
    }
    for (BinExport2.DataReference reference : message.getDataReferenceList()) {
      checkUnknownFields(reference, "data_reference", tables.dataReference.size());
      tables.dataReference.add(new DataReference(reference.getInstructionIndex(), reference.getAddress()));
    }
    for (BinExport2.Module module : message.getModuleList()) {
      checkUnknownFields(module, "module", tables.module.size());
      tables.module.add(new Module(optional(module.hasName(), module.getName())));
    }
    for (BinExport2.MDIndex mdIndex : message.getMdIndexList()) {
      checkUnknownFields(mdIndex, "md_index", tables.mdIndex.size());
      tables.mdIndex.add(new MdIndex(mdIndex.getAddress(), mdIndex.getMdIndex()));
    }
    return tables.freeze();
  }

  /// Top-level fields the schema does not declare are kept for the writer. A schema field
  /// number in the unknown set means the field arrived with the wrong wire type.
  private static void keepUnknownFields(BinExport2 message, BinExport.Tables tables) {
    for (Map.Entry<Integer, UnknownFieldSet.Field> entry : message.getUnknownFields().asMap().entrySet()) {
      final int number = entry.getKey();
      final UnknownFieldSet.Field field = entry.getValue();
      if (!field.getGroupList().isEmpty()) {
        throw malformed("groups are not supported, field " + number);
      }
      if (isKnownField(number)) {
        throw malformed(String.format("field %s has the wrong wire type",
            BinExport2.getDescriptor().findFieldByNumber(number).getName()));
      }
      tables.unknownFields.add(UnknownField.of(number, field));
    }
  }

  /// The protobuf runtime files an unknown enum number, or a schema field with the wrong
  /// wire type, under the nested message's unknown fields. Those are errors; fields that are
  /// not in the schema at all are skipped.
  private static void checkUnknownFields(MessageOrBuilder message, String table, int index) {
    final Map<Integer, UnknownFieldSet.Field> unknown = message.getUnknownFields().asMap();
    if (unknown.isEmpty()) {
      return;
    }
    for (Map.Entry<Integer, UnknownFieldSet.Field> entry : unknown.entrySet()) {
      final int number = entry.getKey();
      final UnknownFieldSet.Field field = entry.getValue();
      if (!field.getGroupList().isEmpty()) {
        throw malformed(String.format("groups are not supported, field %d in %s", number, table));
      }
      final FieldDescriptor known = message.getDescriptorForType().findFieldByNumber(number);
      if (known == null) {
        logger.log(Level.FINEST, () -> String.format("skipping unknown field %d in %s[%d]", number, table, index));
        continue;
      }
      if (known.getType() == FieldDescriptor.Type.ENUM && !field.getVarintList().isEmpty()) {
        throw new DataIntegrityException(table, index, known.getName(),
            "unknown enum value " + field.getVarintList().get(0));
      }
      throw malformed(String.format("field %s.%s has the wrong wire type", table, known.getName()));
    }
  }

  private static Optional<String> optional(boolean present, String value) {
    return present ? Optional.of(value) : Optional.empty();
  }

  private static OptionalInt optionalInt(boolean present, int value) {
    return present ? OptionalInt.of(value) : OptionalInt.empty();
  }

  private static OptionalLong optionalLong(boolean present, long value) {
    return present ? OptionalLong.of(value) : OptionalLong.empty();
  }

  private static Meta readMeta(BinExport2.Meta meta) {
    checkUnknownFields(meta, "meta_information", DataIntegrityException.NO_INDEX);
    return new Meta(
        optional(meta.hasExecutableName(), meta.getExecutableName()),
        optional(meta.hasExecutableId(), meta.getExecutableId()),
        optional(meta.hasArchitectureName(), meta.getArchitectureName()),
        optionalLong(meta.hasTimestamp(), meta.getTimestamp()));
  }

  private static Expression readExpression(BinExport2.Expression expression, int index) {
    checkUnknownFields(expression, "expression", index);
    return new Expression(
        Expression.Type.forNumber(expression.getType().getNumber()),
        optional(expression.hasSymbol(), expression.getSymbol()),
        optionalLong(expression.hasImmediate(), expression.getImmediate()),
        optionalInt(expression.hasParentIndex(), expression.getParentIndex()),
        expression.getIsRelocation());
  }

  private static Instruction readInstruction(BinExport2.Instruction instruction, int index) {
    checkUnknownFields(instruction, "instruction", index);
    return new Instruction(
        optionalLong(instruction.hasAddress(), instruction.getAddress()),
        instruction.getCallTargetList(),
        instruction.getMnemonicIndex(),
        instruction.getOperandIndexList(),
        instruction.getRawBytes().isEmpty()
            ? ByteSequence.EMPTY
            : ByteSequence.of(instruction.getRawBytes().toByteArray()),
        instruction.getCommentIndexList());
  }

  private static BasicBlock readBasicBlock(BinExport2.BasicBlock basicBlock, int index) {
    checkUnknownFields(basicBlock, "basic_block", index);
    final List<BinExport2.BasicBlock.IndexRange> ranges = basicBlock.getInstructionIndexList();
    final BasicBlock.IndexRange[] result = new BasicBlock.IndexRange[ranges.size()];
    for (int i = 0; i < result.length; i++) {
      final BinExport2.BasicBlock.IndexRange range = ranges.get(i);
      checkUnknownFields(range, "basic_block", index);
      result[i] = new BasicBlock.IndexRange(range.getBeginIndex(),
          optionalInt(range.hasEndIndex(), range.getEndIndex()));
    }
    return new BasicBlock(List.of(result));
  }

  private static FlowGraph readFlowGraph(BinExport2.FlowGraph flowGraph, int index) {
    checkUnknownFields(flowGraph, "flow_graph", index);
    final List<BinExport2.FlowGraph.Edge> edges = flowGraph.getEdgeList();
    final FlowGraph.Edge[] result = new FlowGraph.Edge[edges.size()];
    for (int i = 0; i < result.length; i++) {
      final BinExport2.FlowGraph.Edge edge = edges.get(i);
      checkUnknownFields(edge, "flow_graph", index);
      result[i] = new FlowGraph.Edge(edge.getSourceBasicBlockIndex(), edge.getTargetBasicBlockIndex(),
          FlowGraph.Edge.Type.forNumber(edge.getType().getNumber()), edge.getIsBackEdge());
    }
    return new FlowGraph(flowGraph.getBasicBlockIndexList(), flowGraph.getEntryBasicBlockIndex(), List.of(result));
  }

  private static void readCallGraph(BinExport2.CallGraph callGraph, BinExport.Tables tables) {
    checkUnknownFields(callGraph, "call_graph", DataIntegrityException.NO_INDEX);
    for (BinExport2.CallGraph.Vertex vertex : callGraph.getVertexList()) {
      checkUnknownFields(vertex, "call_graph.vertex", tables.vertex.size());
      tables.vertex.add(new CallGraph.Vertex(
          vertex.getAddress(),
          CallGraph.Vertex.Type.forNumber(vertex.getType().getNumber()),
          optional(vertex.hasMangledName(), vertex.getMangledName()),
          optional(vertex.hasDemangledName(), vertex.getDemangledName()),
          optionalInt(vertex.hasLibraryIndex(), vertex.getLibraryIndex()),
          optionalInt(vertex.hasModuleIndex(), vertex.getModuleIndex())));
    }
    for (BinExport2.CallGraph.Edge edge : callGraph.getEdgeList()) {
      checkUnknownFields(edge, "call_graph.edge", tables.callEdge.size());
      tables.callEdge.add(new CallGraph.Edge(edge.getSourceVertexIndex(), edge.getTargetVertexIndex()));
    }
  }

  private static void readReferences(String table, List<BinExport2.Reference> references, List<Reference> sink) {
    for (BinExport2.Reference reference : references) {
      checkUnknownFields(reference, table, sink.size());
      sink.add(new Reference(reference.getInstructionIndex(), reference.getInstructionOperandIndex(),
          reference.getOperandExpressionIndex(), reference.getStringTableIndex()));
    }
  }

  private static Comment readComment(BinExport2.Comment comment, int index) {
    checkUnknownFields(comment, "comment", index);
    return new Comment(comment.getInstructionIndex(), comment.getInstructionOperandIndex(),
        comment.getOperandExpressionIndex(), comment.getStringTableIndex(), comment.getRepeatable(),
        Comment.Type.forNumber(comment.getType().getNumber()));
  }

  /// Fluent configuration, e.g. `BinExportReader.builder().maxMessageBytes(64 << 20).build()`.
  public static final class Builder {
    private long maxMessageBytes = getMaxMessageBytesOrDefault(BinExportReader.class);

    public Builder maxMessageBytes(long maxMessageBytes) {
      this.maxMessageBytes = maxMessageBytes;
      return this;
    }

    public BinExportReader build() {
      return new BinExportReader(maxMessageBytes);
    }
  }
}
