package com.github.trex_paxos.binexport;

import java.util.Objects;

/// Literal representation of a mnemonic, e.g. "mov".
public record Mnemonic(String name) {

  public Mnemonic {
    Objects.requireNonNull(name, "name");
  }
}
