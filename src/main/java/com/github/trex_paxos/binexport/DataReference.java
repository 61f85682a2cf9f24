package com.github.trex_paxos.binexport;

/// An instruction referring to data at `address`.
public record DataReference(int instructionIndex, long address) {
}
