package com.github.trex_paxos.binexport;

import lombok.Synchronized;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Collects functions and calls from concurrent workers and assembles the call graph.
///
/// Construction is two pass: vertices and symbolic (address to address) calls are collected
/// first, then {@link #build()} sorts the vertices by address, resolves the calls to positions
/// in the sorted array and emits the edges. Consumers binary search the vertices so the sort
/// is not optional; if anyone was handed a vertex index before the sort and the sort would
/// move vertices, the build fails rather than invalidate that index.
public final class CallGraphBuilder {

  private static final Logger logger = Logger.getLogger(CallGraphBuilder.class.getName());

  private final Map<Long, CallGraph.Vertex> vertices = new LinkedHashMap<>();
  private final List<long[]> calls = new ArrayList<>();
  private boolean indicesIssued;

  /// Adds a function. The first vertex added for an address wins, later ones are ignored.
  @Synchronized
  public CallGraphBuilder addVertex(CallGraph.Vertex vertex) {
    final CallGraph.Vertex existing = vertices.putIfAbsent(vertex.address(), vertex);
    if (existing != null && !existing.equals(vertex)) {
      logger.log(Level.FINE, () -> String.format("keeping %s over %s", existing, vertex));
    }
    return this;
  }

  public CallGraphBuilder addVertex(long address, CallGraph.Vertex.Type type) {
    return addVertex(CallGraph.Vertex.of(address, type));
  }

  /// Records a call site. Both addresses must have a vertex by the time the graph is built.
  @Synchronized
  public CallGraphBuilder addCall(long sourceAddress, long targetAddress) {
    calls.add(new long[]{sourceAddress, targetAddress});
    return this;
  }

  /// The current position of the vertex at `address` in insertion order. Once an index has
  /// been handed out the build refuses to reorder vertices.
  ///
  /// @return the index, or -1 if there is no vertex at `address`
  @Synchronized
  public int indexOf(long address) {
    int i = 0;
    for (Long a : vertices.keySet()) {
      if (a == address) {
        indicesIssued = true;
        return i;
      }
      i++;
    }
    return -1;
  }

  @Synchronized
  public int vertexCount() {
    return vertices.size();
  }

  /// Sorts the vertices, resolves calls and returns the frozen call graph.
  ///
  /// @throws OrderingViolationException if indices were issued and sorting would move vertices
  /// @throws DataIntegrityException if a call references an address without a vertex
  @Synchronized
  public CallGraph build() {
    final List<CallGraph.Vertex> inserted = new ArrayList<>(vertices.values());
    final List<CallGraph.Vertex> sorted = new ArrayList<>(inserted);
    sorted.sort((a, b) -> Long.compareUnsigned(a.address(), b.address()));
    if (indicesIssued && !sorted.equals(inserted)) {
      for (int i = 0; i < inserted.size(); i++) {
        if (inserted.get(i) != sorted.get(i)) {
          throw new OrderingViolationException(i, String.format(
              "vertex 0x%x was handed out by index before sorting and would move", inserted.get(i).address()));
        }
      }
    }

    final Map<Long, Integer> position = new HashMap<>(sorted.size() * 2);
    for (int i = 0; i < sorted.size(); i++) {
      position.put(sorted.get(i).address(), i);
    }
    final List<CallGraph.Edge> edges = new ArrayList<>(calls.size());
    for (int i = 0; i < calls.size(); i++) {
      final long[] call = calls.get(i);
      final Integer source = position.get(call[0]);
      final Integer target = position.get(call[1]);
      if (source == null || target == null) {
        throw new DataIntegrityException("call_graph.edge", i, source == null ? "source_vertex_index" : "target_vertex_index",
            String.format("call 0x%x -> 0x%x has no vertex at 0x%x", call[0], call[1], source == null ? call[0] : call[1]));
      }
      edges.add(new CallGraph.Edge(source, target));
    }
    logger.log(Level.FINE, () -> String.format("call graph: %d vertices, %d edges", sorted.size(), edges.size()));
    return new CallGraph(sorted, edges);
  }
}
