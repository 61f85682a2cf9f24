package com.github.trex_paxos.binexport;

/// Call graph vertices are not sorted ascending by address. Consumers binary search the
/// vertex list so an unsorted list is fatal to encode and decode.
public class OrderingViolationException extends DataIntegrityException {

  public OrderingViolationException(int index, String reason) {
    super("call_graph.vertex", index, "address", reason);
  }
}
