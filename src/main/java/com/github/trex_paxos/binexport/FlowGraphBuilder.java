package com.github.trex_paxos.binexport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntToLongFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Assembles the control flow graph of one function. Meant to be driven by a single worker;
/// blocks are interned through the owning {@link BinExportBuilder} which is thread safe.
///
/// Blocks and edges are recorded as global basic block indices. {@link #build} sorts the
/// blocks by the address of their first instruction, picks the entry block and marks back
/// edges: an edge is a back edge if its target dominates its source, or if its target is an
/// ancestor of its source in the depth first spanning tree. The second rule catches the
/// retreating edges of irreducible loops, which have no dominating header.
public final class FlowGraphBuilder {

  private static final Logger logger = Logger.getLogger(FlowGraphBuilder.class.getName());

  private final BinExportBuilder owner;
  private final long entryAddress;
  private final Set<Integer> blocks = new LinkedHashSet<>();
  private final List<PendingEdge> edges = new ArrayList<>();

  FlowGraphBuilder(BinExportBuilder owner, long entryAddress) {
    this.owner = owner;
    this.entryAddress = entryAddress;
  }

  public long entryAddress() {
    return entryAddress;
  }

  /// Adds a block by its instruction addresses, interning it in the global block table.
  ///
  /// @return the global basic block index
  public int addBasicBlock(List<Long> instructionAddresses) {
    final int index = owner.addBasicBlock(instructionAddresses);
    blocks.add(index);
    return index;
  }

  /// Adds an already interned block. Adding a block twice has no effect.
  public FlowGraphBuilder addBasicBlock(int basicBlockIndex) {
    blocks.add(basicBlockIndex);
    return this;
  }

  /// Adds an edge between two global basic block indices, both must be part of this graph
  /// by the time it is built.
  public FlowGraphBuilder addEdge(int sourceBasicBlockIndex, int targetBasicBlockIndex, FlowGraph.Edge.Type type) {
    edges.add(new PendingEdge(sourceBasicBlockIndex, targetBasicBlockIndex, type));
    return this;
  }

  /// @param blockAddress maps a global basic block index to the address of its first instruction
  FlowGraph build(int flowGraphIndex, IntToLongFunction blockAddress) {
    if (blocks.isEmpty()) {
      throw new DataIntegrityException("flow_graph", flowGraphIndex, "basic_block_index",
          String.format("flow graph at 0x%x has no basic blocks", entryAddress));
    }
    final List<Integer> sorted = new ArrayList<>(blocks);
    // unsigned order, addresses use the full 64 bit space
    sorted.sort((a, b) -> {
      int cmp = Long.compareUnsigned(blockAddress.applyAsLong(a), blockAddress.applyAsLong(b));
      return cmp != 0 ? cmp : Integer.compare(a, b);
    });

    final Map<Integer, Integer> position = new HashMap<>();
    int entry = -1;
    for (int i = 0; i < sorted.size(); i++) {
      position.put(sorted.get(i), i);
      if (entry < 0 && blockAddress.applyAsLong(sorted.get(i)) == entryAddress) {
        entry = i;
      }
    }
    if (entry < 0) {
      throw new DataIntegrityException("flow_graph", flowGraphIndex, "entry_basic_block_index",
          String.format("no basic block starts at entry address 0x%x", entryAddress));
    }

    final List<List<Integer>> successors = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) successors.add(new ArrayList<>());
    final int[][] local = new int[edges.size()][];
    for (int i = 0; i < edges.size(); i++) {
      final PendingEdge e = edges.get(i);
      final Integer source = position.get(e.source);
      final Integer target = position.get(e.target);
      if (source == null || target == null) {
        throw new DataIntegrityException("flow_graph", flowGraphIndex, "edge",
            String.format("edge %d -> %d references a basic block outside the flow graph", e.source, e.target));
      }
      successors.get(source).add(target);
      local[i] = new int[]{source, target};
    }

    final DominatorTree dominators = DominatorTree.compute(successors, entry);
    final List<FlowGraph.Edge> result = new ArrayList<>(edges.size());
    int backEdges = 0;
    for (int i = 0; i < edges.size(); i++) {
      final PendingEdge e = edges.get(i);
      final int source = local[i][0];
      final int target = local[i][1];
      final boolean back = dominators.dominates(target, source)
          || dominators.isSpanningTreeAncestor(target, source);
      if (back) backEdges++;
      result.add(new FlowGraph.Edge(e.source, e.target, e.type, back));
    }
    final int finalBackEdges = backEdges;
    logger.log(Level.FINE, () -> String.format("flow graph 0x%x: %d blocks, %d edges, %d back edges",
        entryAddress, sorted.size(), result.size(), finalBackEdges));
    return new FlowGraph(sorted, sorted.get(entry), result);
  }

  private record PendingEdge(int source, int target, FlowGraph.Edge.Type type) {
  }
}
