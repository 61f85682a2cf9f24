package com.github.trex_paxos.binexport;

import com.github.trex_paxos.binexport.proto.BinExport2;
import com.google.protobuf.ByteString;
import com.google.protobuf.UnknownFieldSet;

import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.trex_paxos.binexport.BinExportFormat.*;

/// Serializes a {@link BinExport} to the BinExport2 wire format.
///
/// The graph is validated first, then copied into the generated {@link BinExport2} message
/// which the protobuf runtime serializes in field number order, unknown fields last. A field
/// holding its default value is never set and an absent optional field is never set, so
/// neither is written; readers treat a missing field as exactly its default.
public final class BinExportWriter {

  private static final Logger logger = Logger.getLogger(BinExportWriter.class.getName());

  private final long maxMessageBytes;

  public BinExportWriter() {
    this(getMaxMessageBytesOrDefault(BinExportWriter.class));
  }

  public BinExportWriter(long maxMessageBytes) {
    if (maxMessageBytes <= 0 || maxMessageBytes > DEFAULT_MAX_MESSAGE_BYTES) {
      throw new IllegalArgumentException("maxMessageBytes out of range: " + maxMessageBytes);
    }
    this.maxMessageBytes = maxMessageBytes;
  }

  public static Builder builder() {
    return new Builder();
  }

  /// Encodes with the default limits.
  public static byte[] encode(BinExport binExport) {
    return new BinExportWriter().write(binExport);
  }

  /// @throws DataIntegrityException if the graph is not valid
  /// @throws OrderingViolationException if call graph vertices are not sorted by address
  /// @throws CapacityExceededException if the message would exceed the size limit, no bytes are returned
  public byte[] write(BinExport binExport) {
    BinExportValidator.validate(binExport);
    final BinExport2 message = toMessage(binExport);
    // the runtime computes the size in an int, a negative value is an overflow
    final int size = message.getSerializedSize();
    if (size < 0 || size > maxMessageBytes) {
      throw new CapacityExceededException(MESSAGE, maxMessageBytes);
    }
    logger.log(Level.FINE, () -> String.format("encoded %d instructions, %d flow graphs, %d functions in %d bytes",
        binExport.instruction().size(), binExport.flowGraph().size(), binExport.callGraph().vertex().size(), size));
    return message.toByteArray();
  }

  @SuppressWarnings("deprecation")
  private static BinExport2 toMessage(BinExport binExport) {
    final BinExport2.Builder out = BinExport2.newBuilder();
    if (!binExport.metaInformation().equals(Meta.EMPTY)) {
      out.setMetaInformation(writeMeta(binExport.metaInformation()));
    }
    out.addAllStringTable(binExport.stringTable());
    for (Mnemonic m : binExport.mnemonic()) {
      final BinExport2.Mnemonic.Builder mnemonic = BinExport2.Mnemonic.newBuilder();
      if (!m.name().isEmpty()) mnemonic.setName(m.name());
      out.addMnemonic(mnemonic);
    }
    for (Expression e : binExport.expression()) {
      out.addExpression(writeExpression(e));
    }
    for (Operand o : binExport.operand()) {
      out.addOperand(BinExport2.Operand.newBuilder().addAllExpressionIndex(o.expressionIndex()));
    }
    for (Instruction i : binExport.instruction()) {
      out.addInstruction(writeInstruction(i));
    }
    for (BasicBlock b : binExport.basicBlock()) {
      out.addBasicBlock(writeBasicBlock(b));
    }
    for (FlowGraph f : binExport.flowGraph()) {
      out.addFlowGraph(writeFlowGraph(f));
    }
    final CallGraph callGraph = binExport.callGraph();
    if (!callGraph.vertex().isEmpty() || !callGraph.edge().isEmpty()) {
      out.setCallGraph(writeCallGraph(callGraph));
    }
    writeReferences(binExport.addressComment(), out::addAddressComment);
    for (Comment c : binExport.comment()) {
      out.addComment(writeComment(c));
    }
    writeReferences(binExport.stringReference(), out::addStringReference);
    writeReferences(binExport.expressionSubstitution(), out::addExpressionSubstitution);
    for (Section s : binExport.section()) {
      final BinExport2.Section.Builder section = BinExport2.Section.newBuilder();
      if (s.address() != 0) section.setAddress(s.address());
      if (s.size() != 0) section.setSize(s.size());
      if (s.flagR()) section.setFlagR(true);
      if (s.flagW()) section.setFlagW(true);
      if (s.flagX()) section.setFlagX(true);
      out.addSection(section);
    }
    for (Library l : binExport.library()) {
      final BinExport2.Library.Builder library = BinExport2.Library.newBuilder();
      if (l.isStatic()) library.setIsStatic(true);
      if (l.loadAddress() != 0) library.setLoadAddress(l.loadAddress());
      l.name().ifPresent(library::setName);
      out.addLibrary(library);
    }
    for (DataReference d : binExport.dataReference()) {
      final BinExport2.DataReference.Builder reference = BinExport2.DataReference.newBuilder();
      if (d.instructionIndex() != 0) reference.setInstructionIndex(d.instructionIndex());
      if (d.address() != 0) reference.setAddress(d.address());
      out.addDataReference(reference);
    }
    for (Module m : binExport.module()) {
      final BinExport2.Module.Builder module = BinExport2.Module.newBuilder();
      m.name().ifPresent(module::setName);
      out.addModule(module);
    }
    for (MdIndex m : binExport.mdIndex()) {
      final BinExport2.MDIndex.Builder mdIndex = BinExport2.MDIndex.newBuilder();
      if (m.address() != 0) mdIndex.setAddress(m.address());
      // -0.0 is not the default
      if (Double.doubleToRawLongBits(m.mdIndex()) != 0) mdIndex.setMdIndex(m.mdIndex());
      out.addMdIndex(mdIndex);
    }
    if (!binExport.unknownFields().isEmpty()) {
      final UnknownFieldSet.Builder unknown = UnknownFieldSet.newBuilder();
      for (UnknownField u : binExport.unknownFields()) {
        unknown.mergeField(u.fieldNumber(), u.toField());
      }
      out.setUnknownFields(unknown.build());
    }
    return out.build();
  }

  private static BinExport2.Meta writeMeta(Meta meta) {
    final BinExport2.Meta.Builder out = BinExport2.Meta.newBuilder();
    meta.executableName().ifPresent(out::setExecutableName);
    meta.executableId().ifPresent(out::setExecutableId);
    meta.architectureName().ifPresent(out::setArchitectureName);
    meta.timestamp().ifPresent(out::setTimestamp);
    return out.build();
  }

  private static BinExport2.Expression writeExpression(Expression e) {
    final BinExport2.Expression.Builder out = BinExport2.Expression.newBuilder();
    if (e.type() != Expression.Type.DEFAULT) out.setType(BinExport2.Expression.Type.forNumber(e.type().number()));
    e.symbol().ifPresent(out::setSymbol);
    e.immediate().ifPresent(out::setImmediate);
    e.parentIndex().ifPresent(out::setParentIndex);
    if (e.isRelocation()) out.setIsRelocation(true);
    return out.build();
  }

  private static BinExport2.Instruction writeInstruction(Instruction i) {
    final BinExport2.Instruction.Builder out = BinExport2.Instruction.newBuilder();
    i.address().ifPresent(out::setAddress);
    out.addAllCallTarget(i.callTarget());
    if (i.mnemonicIndex() != 0) out.setMnemonicIndex(i.mnemonicIndex());
    out.addAllOperandIndex(i.operandIndex());
    if (i.rawBytes().length() > 0) out.setRawBytes(ByteString.copyFrom(i.rawBytes().bytes));
    out.addAllCommentIndex(i.commentIndex());
    return out.build();
  }

  private static BinExport2.BasicBlock writeBasicBlock(BasicBlock b) {
    final BinExport2.BasicBlock.Builder out = BinExport2.BasicBlock.newBuilder();
    for (BasicBlock.IndexRange range : b.instructionIndex()) {
      final BinExport2.BasicBlock.IndexRange.Builder inner = BinExport2.BasicBlock.IndexRange.newBuilder();
      if (range.beginIndex() != 0) inner.setBeginIndex(range.beginIndex());
      range.endIndex().ifPresent(inner::setEndIndex);
      out.addInstructionIndex(inner);
    }
    return out.build();
  }

  private static BinExport2.FlowGraph writeFlowGraph(FlowGraph f) {
    final BinExport2.FlowGraph.Builder out = BinExport2.FlowGraph.newBuilder();
    out.addAllBasicBlockIndex(f.basicBlockIndex());
    for (FlowGraph.Edge e : f.edge()) {
      final BinExport2.FlowGraph.Edge.Builder edge = BinExport2.FlowGraph.Edge.newBuilder();
      if (e.sourceBasicBlockIndex() != 0) edge.setSourceBasicBlockIndex(e.sourceBasicBlockIndex());
      if (e.targetBasicBlockIndex() != 0) edge.setTargetBasicBlockIndex(e.targetBasicBlockIndex());
      if (e.type() != FlowGraph.Edge.Type.DEFAULT) {
        edge.setType(BinExport2.FlowGraph.Edge.Type.forNumber(e.type().number()));
      }
      if (e.isBackEdge()) edge.setIsBackEdge(true);
      out.addEdge(edge);
    }
    if (f.entryBasicBlockIndex() != 0) out.setEntryBasicBlockIndex(f.entryBasicBlockIndex());
    return out.build();
  }

  private static BinExport2.CallGraph writeCallGraph(CallGraph callGraph) {
    final BinExport2.CallGraph.Builder out = BinExport2.CallGraph.newBuilder();
    for (CallGraph.Vertex v : callGraph.vertex()) {
      final BinExport2.CallGraph.Vertex.Builder vertex = BinExport2.CallGraph.Vertex.newBuilder();
      if (v.address() != 0) vertex.setAddress(v.address());
      if (v.type() != CallGraph.Vertex.Type.DEFAULT) {
        vertex.setType(BinExport2.CallGraph.Vertex.Type.forNumber(v.type().number()));
      }
      v.mangledName().ifPresent(vertex::setMangledName);
      v.demangledName().ifPresent(vertex::setDemangledName);
      v.libraryIndex().ifPresent(vertex::setLibraryIndex);
      v.moduleIndex().ifPresent(vertex::setModuleIndex);
      out.addVertex(vertex);
    }
    for (CallGraph.Edge e : callGraph.edge()) {
      final BinExport2.CallGraph.Edge.Builder edge = BinExport2.CallGraph.Edge.newBuilder();
      if (e.sourceVertexIndex() != 0) edge.setSourceVertexIndex(e.sourceVertexIndex());
      if (e.targetVertexIndex() != 0) edge.setTargetVertexIndex(e.targetVertexIndex());
      out.addEdge(edge);
    }
    return out.build();
  }

  private static void writeReferences(List<Reference> references, Consumer<BinExport2.Reference> sink) {
    for (Reference r : references) {
      final BinExport2.Reference.Builder reference = BinExport2.Reference.newBuilder();
      if (r.instructionIndex() != 0) reference.setInstructionIndex(r.instructionIndex());
      if (r.instructionOperandIndex() != 0) reference.setInstructionOperandIndex(r.instructionOperandIndex());
      if (r.operandExpressionIndex() != 0) reference.setOperandExpressionIndex(r.operandExpressionIndex());
      if (r.stringTableIndex() != 0) reference.setStringTableIndex(r.stringTableIndex());
      sink.accept(reference.build());
    }
  }

  private static BinExport2.Comment writeComment(Comment c) {
    final BinExport2.Comment.Builder out = BinExport2.Comment.newBuilder();
    if (c.instructionIndex() != 0) out.setInstructionIndex(c.instructionIndex());
    if (c.instructionOperandIndex() != 0) out.setInstructionOperandIndex(c.instructionOperandIndex());
    if (c.operandExpressionIndex() != 0) out.setOperandExpressionIndex(c.operandExpressionIndex());
    if (c.stringTableIndex() != 0) out.setStringTableIndex(c.stringTableIndex());
    if (c.repeatable()) out.setRepeatable(true);
    if (c.type() != Comment.Type.DEFAULT) out.setType(BinExport2.Comment.Type.forNumber(c.type().number()));
    return out.build();
  }

  /// Fluent configuration, e.g. `BinExportWriter.builder().maxMessageBytes(64 << 20).build()`.
  public static final class Builder {
    private long maxMessageBytes = getMaxMessageBytesOrDefault(BinExportWriter.class);

    public Builder maxMessageBytes(long maxMessageBytes) {
      this.maxMessageBytes = maxMessageBytes;
      return this;
    }

    public BinExportWriter build() {
      return new BinExportWriter(maxMessageBytes);
    }
  }
}
