package com.github.trex_paxos.binexport;

import java.util.Optional;
import java.util.OptionalLong;

/// Describes the input binary.
///
/// @param executableName    file name with extension but without path, e.g. "insider_gcc.exe"
/// @param executableId      application defined id, often the SHA256 of the input
/// @param architectureName  e.g. "x86-32"
/// @param timestamp         creation time in Unix seconds
public record Meta(
    Optional<String> executableName,
    Optional<String> executableId,
    Optional<String> architectureName,
    OptionalLong timestamp) {

  public static final Meta EMPTY = new Meta(Optional.empty(), Optional.empty(), Optional.empty(), OptionalLong.empty());
}
