package com.github.trex_paxos.binexport;

import java.util.Optional;

/// @param loadAddress  where the library was loaded, 0 if unknown
public record Library(boolean isStatic, long loadAddress, Optional<String> name) {
}
