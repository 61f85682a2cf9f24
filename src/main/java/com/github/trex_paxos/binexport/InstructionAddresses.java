package com.github.trex_paxos.binexport;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/// Implicit instruction addressing. An instruction only stores its address when it does not
/// start where its predecessor ends; the first instruction always stores it.
public final class InstructionAddresses {

  private InstructionAddresses() {
  }

  /// The address an instruction following `previous` at `previousAddress` gets when it stores none.
  public static long next(long previousAddress, Instruction previous) {
    return previousAddress + previous.rawBytes().length();
  }

  /// Reconstructs the absolute address of every instruction.
  ///
  /// @throws DataIntegrityException if the first instruction has no explicit address
  public static long[] resolve(List<Instruction> instructions) {
    final long[] addresses = new long[instructions.size()];
    for (int i = 0; i < addresses.length; i++) {
      final Instruction instruction = instructions.get(i);
      if (instruction.address().isPresent()) {
        addresses[i] = instruction.address().getAsLong();
      } else if (i == 0) {
        throw new DataIntegrityException("instruction", 0, "address",
            "first instruction must carry an explicit address");
      } else {
        addresses[i] = next(addresses[i - 1], instructions.get(i - 1));
      }
    }
    return addresses;
  }

  /// Drops every address that can be derived from the predecessor. `addresses[i]` is the
  /// absolute address of `instructions.get(i)`, the input is expected in address order.
  public static List<Instruction> omitImplicit(List<Instruction> instructions, long[] addresses) {
    final List<Instruction> result = new ArrayList<>(instructions.size());
    for (int i = 0; i < addresses.length; i++) {
      final Instruction instruction = instructions.get(i);
      final boolean implicit = i > 0 && addresses[i] == next(addresses[i - 1], instructions.get(i - 1));
      result.add(instruction.withAddress(implicit ? OptionalLong.empty() : OptionalLong.of(addresses[i])));
    }
    return result;
  }
}
