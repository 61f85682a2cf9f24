package com.github.trex_paxos.binexport;

import lombok.Getter;

/// An index or an encoded message would overflow its addressable range.
@Getter
public class CapacityExceededException extends IllegalStateException {

  private final String table;
  private final long limit;

  public CapacityExceededException(String table, long limit) {
    super(String.format("%s exceeds capacity of %d", table, limit));
    this.table = table;
    this.limit = limit;
  }
}
