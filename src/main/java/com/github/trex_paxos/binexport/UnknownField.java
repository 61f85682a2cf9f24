package com.github.trex_paxos.binexport;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.UnknownFieldSet;

import java.util.Objects;

/// A top-level field the codec does not interpret, such as a schema extension. All values
/// seen for one field number are kept together and written back verbatim, after the schema
/// fields and in ascending field number order.
///
/// @param encoded  every tag and value of the field exactly as it appears on the wire
public record UnknownField(int fieldNumber, ByteSequence encoded) {

  /// Field numbers are 29 bits on the wire.
  public static final int MAX_FIELD_NUMBER = (1 << 29) - 1;

  public UnknownField {
    Objects.requireNonNull(encoded, "encoded");
    if (fieldNumber <= 0 || fieldNumber > MAX_FIELD_NUMBER) {
      throw new IllegalArgumentException("field number out of range: " + fieldNumber);
    }
    if (BinExportFormat.isKnownField(fieldNumber)) {
      throw new IllegalArgumentException("field number is part of the schema: " + fieldNumber);
    }
    final UnknownFieldSet parsed = parse(encoded);
    if (parsed.asMap().size() != 1 || !parsed.hasField(fieldNumber)) {
      throw new IllegalArgumentException("encoding must hold field " + fieldNumber + " only");
    }
    if (!parsed.getField(fieldNumber).getGroupList().isEmpty()) {
      throw new IllegalArgumentException("groups are not supported");
    }
  }

  public static UnknownField varint(int fieldNumber, long value) {
    return of(fieldNumber, UnknownFieldSet.Field.newBuilder().addVarint(value).build());
  }

  public static UnknownField fixed32(int fieldNumber, int value) {
    return of(fieldNumber, UnknownFieldSet.Field.newBuilder().addFixed32(value).build());
  }

  public static UnknownField fixed64(int fieldNumber, long value) {
    return of(fieldNumber, UnknownFieldSet.Field.newBuilder().addFixed64(value).build());
  }

  public static UnknownField lengthDelimited(int fieldNumber, ByteSequence value) {
    return of(fieldNumber,
        UnknownFieldSet.Field.newBuilder().addLengthDelimited(ByteString.copyFrom(value.bytes)).build());
  }

  static UnknownField of(int fieldNumber, UnknownFieldSet.Field field) {
    return new UnknownField(fieldNumber, ByteSequence.of(field.toByteString(fieldNumber).toByteArray()));
  }

  /// The values in the form the protobuf runtime merges back into a message.
  UnknownFieldSet.Field toField() {
    return parse(encoded).getField(fieldNumber);
  }

  private static UnknownFieldSet parse(ByteSequence encoded) {
    try {
      return UnknownFieldSet.parseFrom(encoded.bytes);
    } catch (InvalidProtocolBufferException e) {
      throw new IllegalArgumentException("malformed field encoding: " + e.getMessage(), e);
    }
  }
}
