package com.github.trex_paxos.binexport;

public record Section(long address, long size, boolean flagR, boolean flagW, boolean flagX) {
}
