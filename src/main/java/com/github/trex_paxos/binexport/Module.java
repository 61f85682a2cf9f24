package com.github.trex_paxos.binexport;

import java.util.Optional;

/// A platform dependent grouping of functions, such as a Java class name.
public record Module(Optional<String> name) {
}
