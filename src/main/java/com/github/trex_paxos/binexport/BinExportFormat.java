package com.github.trex_paxos.binexport;

import com.github.trex_paxos.binexport.proto.BinExport2;

/// Format level constants and limits shared by the reader and the writer. Field numbers
/// and defaults live in `src/main/proto/binexport2.proto`.
final class BinExportFormat {

  private BinExportFormat() {
  }

  /// Name used for errors about the top-level message.
  static final String MESSAGE = "binexport2";

  /// True for a field number declared by the BinExport2 schema, as opposed to an extension
  /// or a field added by a newer producer.
  static boolean isKnownField(int fieldNumber) {
    return BinExport2.getDescriptor().findFieldByNumber(fieldNumber) != null;
  }

  /// Largest message a Java byte array can hold.
  static final long DEFAULT_MAX_MESSAGE_BYTES = Integer.MAX_VALUE - 8;

  static final String MAX_MESSAGE_BYTES_PROPERTY = "MAX_MESSAGE_BYTES";

  /// Reads `<owner class name>.MAX_MESSAGE_BYTES` from the environment, overridden by a
  /// system property of the same name, falling back to the largest byte array.
  static long getMaxMessageBytesOrDefault(Class<?> owner) {
    final String key = String.format("%s.%s", owner.getName(), MAX_MESSAGE_BYTES_PROPERTY);
    String value = System.getenv(key) == null
        ? Long.valueOf(DEFAULT_MAX_MESSAGE_BYTES).toString()
        : System.getenv(key);
    value = System.getProperty(key, value);
    final long parsed = Long.parseLong(value);
    if (parsed <= 0 || parsed > DEFAULT_MAX_MESSAGE_BYTES) {
      throw new IllegalArgumentException(String.format("%s must be in (0, %d], got %d",
          key, DEFAULT_MAX_MESSAGE_BYTES, parsed));
    }
    return parsed;
  }
}
