package com.github.trex_paxos.binexport;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/// One disassembled instruction. The address is only present for instructions that do not
/// directly follow their predecessor in the table, see {@link InstructionAddresses}.
///
/// @param address        explicit address, absent when it is the predecessor's end
/// @param callTarget     resolved call targets, not indices since a target may have no flow graph
/// @param mnemonicIndex  index into the mnemonic table, 0 is the most common mnemonic
/// @param operandIndex   indices into the operand table in operand order
/// @param rawBytes       the unmodified input bytes
/// @param commentIndex   indices into the comment table
public record Instruction(
    OptionalLong address,
    List<Long> callTarget,
    int mnemonicIndex,
    List<Integer> operandIndex,
    ByteSequence rawBytes,
    List<Integer> commentIndex) {

  public Instruction {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(rawBytes, "rawBytes");
    callTarget = List.copyOf(callTarget);
    operandIndex = List.copyOf(operandIndex);
    commentIndex = List.copyOf(commentIndex);
  }

  Instruction withAddress(OptionalLong newAddress) {
    return new Instruction(newAddress, callTarget, mnemonicIndex, operandIndex, rawBytes, commentIndex);
  }

  Instruction withMnemonicIndex(int newMnemonicIndex) {
    return new Instruction(address, callTarget, newMnemonicIndex, operandIndex, rawBytes, commentIndex);
  }

  Instruction withCommentIndex(List<Integer> newCommentIndex) {
    return new Instruction(address, callTarget, mnemonicIndex, operandIndex, rawBytes, newCommentIndex);
  }
}
