package com.github.trex_paxos.binexport;

/// A function's MD index, keyed by function address.
public record MdIndex(long address, double mdIndex) {
}
