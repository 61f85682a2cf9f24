package com.github.trex_paxos.binexport;

import lombok.Getter;

/// Raised when a BinExport2 graph, or the bytes it was decoded from, breaks a structural rule:
/// an out-of-range index, a malformed expression forest, an invalid basic block range or a
/// malformed wire encoding. Identifies the offending table, record index and field.
@Getter
public class DataIntegrityException extends IllegalStateException {

  /// Record index used when the problem is not tied to a single record.
  public static final int NO_INDEX = -1;

  private final String table;
  private final int index;
  private final String field;
  private final String reason;

  public DataIntegrityException(String table, int index, String field, String reason) {
    super(String.format("%s[%d].%s: %s", table, index, field, reason));
    this.table = table;
    this.index = index;
    this.field = field;
    this.reason = reason;
  }

  public DataIntegrityException(String table, int index, String field, String reason, Throwable cause) {
    this(table, index, field, reason);
    initCause(cause);
  }

  static DataIntegrityException outOfRange(String table, int index, String field, long value, int limit) {
    return new DataIntegrityException(table, index, field,
        String.format("index %d not in [0, %d)", value, limit));
  }
}
