package com.github.trex_paxos.binexport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Incrementally assembles a {@link BinExport} from a disassembly producer.
///
/// Every add method is safe to call from concurrent workers, for example one worker per
/// function. Workers only synchronize on the shared interning tables and the instruction
/// map. {@link #build()} is the single threaded barrier that runs after all workers are done:
/// it sorts instructions and call graph vertices, resolves every address based reference to
/// an index and validates the result.
///
/// Repeated content is stored once: strings, mnemonics, expressions and operands are
/// interned, an instruction is stored once per address, and a basic block once per distinct
/// instruction sequence no matter how many functions contain it.
public final class BinExportBuilder {

  private static final Logger logger = Logger.getLogger(BinExportBuilder.class.getName());

  private final InterningTable<String> strings = new InterningTable<>("string_table");
  private final InterningTable<String> mnemonics = new InterningTable<>("mnemonic");
  private final InterningTable<Expression> expressions = new InterningTable<>("expression");
  private final InterningTable<Operand> operands = new InterningTable<>("operand");
  private final InterningTable<BlockKey> blocks = new InterningTable<>("basic_block");
  private final ExpressionTreeBuilder expressionTrees = new ExpressionTreeBuilder(expressions, operands);
  private final ConcurrentMap<Long, PendingInstruction> instructions = new ConcurrentHashMap<>();
  private final List<FlowGraphBuilder> flowGraphs = Collections.synchronizedList(new ArrayList<>());
  private final CallGraphBuilder callGraph = new CallGraphBuilder();
  private final List<PendingComment> comments = Collections.synchronizedList(new ArrayList<>());
  private final List<PendingReference> addressComments = Collections.synchronizedList(new ArrayList<>());
  private final List<PendingReference> stringReferences = Collections.synchronizedList(new ArrayList<>());
  private final List<PendingReference> expressionSubstitutions = Collections.synchronizedList(new ArrayList<>());
  private final List<long[]> dataReferences = Collections.synchronizedList(new ArrayList<>());
  private final List<Section> sections = Collections.synchronizedList(new ArrayList<>());
  private final List<Library> libraries = Collections.synchronizedList(new ArrayList<>());
  private final List<Module> modules = Collections.synchronizedList(new ArrayList<>());
  private final List<MdIndex> mdIndices = Collections.synchronizedList(new ArrayList<>());
  private final List<UnknownField> unknownFields = Collections.synchronizedList(new ArrayList<>());
  private volatile Meta meta = Meta.EMPTY;

  public BinExportBuilder meta(Meta meta) {
    this.meta = Objects.requireNonNull(meta, "meta");
    return this;
  }

  public int internString(String value) {
    return strings.intern(value);
  }

  /// Interns one operand expression tree, exposed for producers that build operands ahead of
  /// their instructions.
  public int internOperand(ExpressionNode root) {
    return expressionTrees.intern(root);
  }

  /// Adds an instruction. Adding identical content for an address twice, as happens when a
  /// block is shared by several functions, stores it once.
  ///
  /// @param operands one expression tree root per operand, in operand order
  /// @throws DataIntegrityException if different content was already added for `address`
  public BinExportBuilder addInstruction(long address, byte[] rawBytes, String mnemonic,
                                         List<ExpressionNode> operands, List<Long> callTargets) {
    final List<Integer> operandIndex = new ArrayList<>(operands.size());
    for (ExpressionNode operand : operands) {
      operandIndex.add(expressionTrees.intern(operand));
    }
    final PendingInstruction pending = new PendingInstruction(
        address, ByteSequence.copyOf(rawBytes), mnemonics.intern(mnemonic),
        List.copyOf(operandIndex), List.copyOf(callTargets));
    final PendingInstruction existing = instructions.putIfAbsent(address, pending);
    if (existing != null && !existing.equals(pending)) {
      throw new DataIntegrityException("instruction", DataIntegrityException.NO_INDEX, "address",
          String.format("conflicting instructions at 0x%x", address));
    }
    return this;
  }

  public BinExportBuilder addInstruction(long address, byte[] rawBytes, String mnemonic, ExpressionNode... operands) {
    return addInstruction(address, rawBytes, mnemonic, List.of(operands), List.of());
  }

  /// Interns a basic block given by the addresses of its instructions in execution order.
  ///
  /// @return the global basic block index
  /// @throws DataIntegrityException if the block is empty
  public int addBasicBlock(List<Long> instructionAddresses) {
    if (instructionAddresses.isEmpty()) {
      throw new DataIntegrityException("basic_block", blocks.size(), "instruction_index", "empty basic block");
    }
    return blocks.intern(new BlockKey(List.copyOf(instructionAddresses)));
  }

  /// Starts the flow graph of the function at `entryAddress`.
  public FlowGraphBuilder flowGraph(long entryAddress) {
    final FlowGraphBuilder builder = new FlowGraphBuilder(this, entryAddress);
    flowGraphs.add(builder);
    return builder;
  }

  public CallGraphBuilder callGraph() {
    return callGraph;
  }

  public BinExportBuilder addComment(long instructionAddress, int operandIndex, int expressionIndex,
                                     String text, boolean repeatable, Comment.Type type) {
    comments.add(new PendingComment(
        new PendingReference(instructionAddress, operandIndex, expressionIndex, strings.intern(text)),
        repeatable, type));
    return this;
  }

  public BinExportBuilder addComment(long instructionAddress, String text) {
    return addComment(instructionAddress, 0, 0, text, false, Comment.Type.DEFAULT);
  }

  /// Legacy comment form kept for older readers, new producers should use {@link #addComment}.
  public BinExportBuilder addAddressComment(long instructionAddress, int operandIndex, int expressionIndex,
                                            String text) {
    addressComments.add(new PendingReference(instructionAddress, operandIndex, expressionIndex, strings.intern(text)));
    return this;
  }

  public BinExportBuilder addStringReference(long instructionAddress, int operandIndex, int expressionIndex, String text) {
    stringReferences.add(new PendingReference(instructionAddress, operandIndex, expressionIndex, strings.intern(text)));
    return this;
  }

  /// Replaces the rendering of an expression, e.g. a stack offset by a variable name.
  public BinExportBuilder addExpressionSubstitution(long instructionAddress, int operandIndex, int expressionIndex,
                                                    String replacement) {
    expressionSubstitutions.add(
        new PendingReference(instructionAddress, operandIndex, expressionIndex, strings.intern(replacement)));
    return this;
  }

  public BinExportBuilder addDataReference(long instructionAddress, long address) {
    dataReferences.add(new long[]{instructionAddress, address});
    return this;
  }

  public BinExportBuilder addSection(Section section) {
    sections.add(section);
    return this;
  }

  /// @return the library index to use in {@link CallGraph.Vertex#libraryIndex()}
  public int addLibrary(Library library) {
    synchronized (libraries) {
      libraries.add(library);
      return libraries.size() - 1;
    }
  }

  /// @return the module index to use in {@link CallGraph.Vertex#moduleIndex()}
  public int addModule(Module module) {
    synchronized (modules) {
      modules.add(module);
      return modules.size() - 1;
    }
  }

  public BinExportBuilder addMdIndex(long address, double mdIndex) {
    mdIndices.add(new MdIndex(address, mdIndex));
    return this;
  }

  /// Attaches an opaque top-level field, e.g. a schema extension, written back verbatim.
  public BinExportBuilder addUnknownField(UnknownField field) {
    unknownFields.add(field);
    return this;
  }

  /// Resolves all references and freezes the graph. Call once all producers are done.
  ///
  /// @throws DataIntegrityException if a reference cannot be resolved or the result is invalid
  /// @throws OrderingViolationException see {@link CallGraphBuilder#build()}
  public BinExport build() {
    // instructions in address order
    final List<PendingInstruction> pending = new ArrayList<>(instructions.values());
    pending.sort((a, b) -> Long.compareUnsigned(a.address, b.address));
    final Map<Long, Integer> instructionIndex = new HashMap<>(pending.size() * 2);
    final long[] addresses = new long[pending.size()];
    for (int i = 0; i < pending.size(); i++) {
      instructionIndex.put(pending.get(i).address, i);
      addresses[i] = pending.get(i).address;
    }

    final int[] mnemonicOrder = mnemonicsByFrequency(pending);
    final List<String> mnemonicNames = mnemonics.snapshot();
    final List<Mnemonic> mnemonicTable = new ArrayList<>(mnemonicNames.size());
    final int[] remap = new int[mnemonicNames.size()];
    for (int i = 0; i < mnemonicOrder.length; i++) {
      mnemonicTable.add(new Mnemonic(mnemonicNames.get(mnemonicOrder[i])));
      remap[mnemonicOrder[i]] = i;
    }

    final List<Comment> commentTable;
    final List<List<Integer>> commentsByInstruction = new ArrayList<>(pending.size());
    for (int i = 0; i < pending.size(); i++) commentsByInstruction.add(new ArrayList<>());
    synchronized (comments) {
      commentTable = new ArrayList<>(comments.size());
      for (PendingComment c : comments) {
        final int at = resolve(instructionIndex, "comment", commentTable.size(), c.reference.instructionAddress);
        commentsByInstruction.get(at).add(commentTable.size());
        commentTable.add(new Comment(at, c.reference.operandIndex, c.reference.expressionIndex,
            c.reference.stringIndex, c.repeatable, c.type));
      }
    }

    final List<Instruction> withAddresses = new ArrayList<>(pending.size());
    for (int i = 0; i < pending.size(); i++) {
      final PendingInstruction p = pending.get(i);
      withAddresses.add(new Instruction(OptionalLong.of(p.address), p.callTargets, remap[p.mnemonicIndex],
          p.operandIndex, p.rawBytes, commentsByInstruction.get(i)));
    }
    final List<Instruction> instructionTable = InstructionAddresses.omitImplicit(withAddresses, addresses);

    final List<BlockKey> blockKeys = blocks.snapshot();
    final List<BasicBlock> blockTable = new ArrayList<>(blockKeys.size());
    for (int b = 0; b < blockKeys.size(); b++) {
      final List<Long> members = blockKeys.get(b).instructionAddresses;
      final int[] indices = new int[members.size()];
      for (int i = 0; i < indices.length; i++) {
        indices[i] = resolve(instructionIndex, "basic_block", b, members.get(i));
      }
      blockTable.add(new BasicBlock(IndexRanges.compress(b, indices)));
    }

    final List<FlowGraphBuilder> functions;
    synchronized (flowGraphs) {
      functions = new ArrayList<>(flowGraphs);
    }
    functions.sort((a, b) -> Long.compareUnsigned(a.entryAddress(), b.entryAddress()));
    final List<FlowGraph> flowGraphTable = new ArrayList<>(functions.size());
    for (FlowGraphBuilder function : functions) {
      flowGraphTable.add(function.build(flowGraphTable.size(),
          block -> blockKeys.get(block).instructionAddresses.get(0)));
    }

    final List<DataReference> dataReferenceTable = new ArrayList<>();
    synchronized (dataReferences) {
      for (long[] d : dataReferences) {
        dataReferenceTable.add(new DataReference(
            resolve(instructionIndex, "data_reference", dataReferenceTable.size(), d[0]), d[1]));
      }
    }

    final BinExport result = new BinExport(
        meta,
        expressions.snapshot(),
        operands.snapshot(),
        mnemonicTable,
        instructionTable,
        blockTable,
        flowGraphTable,
        callGraph.build(),
        strings.snapshot(),
        resolveAll(addressComments, instructionIndex, "address_comment"),
        commentTable,
        resolveAll(stringReferences, instructionIndex, "string_reference"),
        resolveAll(expressionSubstitutions, instructionIndex, "expression_substitution"),
        copy(sections),
        copy(libraries),
        dataReferenceTable,
        copy(modules),
        copy(mdIndices),
        copy(unknownFields));
    logger.log(Level.FINE, () -> String.format(
        "built: %d instructions, %d basic blocks, %d flow graphs, %d functions, %d expressions, %d operands",
        instructionTable.size(), blockTable.size(), flowGraphTable.size(),
        result.callGraph().vertex().size(), result.expression().size(), result.operand().size()));
    BinExportValidator.validate(result);
    return result;
  }

  /// Permutation of mnemonic indices, most used first, ties in interning order, so that the
  /// most common mnemonic gets index 0 which is omitted on the wire.
  private int[] mnemonicsByFrequency(List<PendingInstruction> pending) {
    final int size = mnemonics.size();
    final long[] counts = new long[size];
    for (PendingInstruction p : pending) {
      counts[p.mnemonicIndex]++;
    }
    final List<Integer> order = new ArrayList<>(size);
    for (int i = 0; i < size; i++) order.add(i);
    order.sort((a, b) -> {
      int cmp = Long.compare(counts[b], counts[a]);
      return cmp != 0 ? cmp : Integer.compare(a, b);
    });
    return order.stream().mapToInt(Integer::intValue).toArray();
  }

  private static int resolve(Map<Long, Integer> instructionIndex, String table, int index, long address) {
    final Integer at = instructionIndex.get(address);
    if (at == null) {
      throw new DataIntegrityException(table, index, "instruction_index",
          String.format("no instruction at 0x%x", address));
    }
    return at;
  }

  private static List<Reference> resolveAll(List<PendingReference> pending, Map<Long, Integer> instructionIndex,
                                            String table) {
    synchronized (pending) {
      final List<Reference> result = new ArrayList<>(pending.size());
      for (PendingReference r : pending) {
        result.add(new Reference(resolve(instructionIndex, table, result.size(), r.instructionAddress),
            r.operandIndex, r.expressionIndex, r.stringIndex));
      }
      return result;
    }
  }

  private static <T> List<T> copy(List<T> synchronizedList) {
    synchronized (synchronizedList) {
      return new ArrayList<>(synchronizedList);
    }
  }

  /// A basic block before instruction indices are known.
  private record BlockKey(List<Long> instructionAddresses) {
  }

  private record PendingInstruction(long address, ByteSequence rawBytes, int mnemonicIndex,
                                    List<Integer> operandIndex, List<Long> callTargets) {
  }

  private record PendingReference(long instructionAddress, int operandIndex, int expressionIndex, int stringIndex) {
  }

  private record PendingComment(PendingReference reference, boolean repeatable, Comment.Type type) {
  }
}
