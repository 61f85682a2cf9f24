package com.github.trex_paxos.binexport;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/// Functions and the calls between them. Most downstream tooling binary searches the
/// vertices by address, so they must be sorted ascending by {@link Vertex#address()}.
public record CallGraph(List<Vertex> vertex, List<Edge> edge) {

  public static final CallGraph EMPTY = new CallGraph(List.of(), List.of());

  public CallGraph {
    vertex = List.copyOf(vertex);
    edge = List.copyOf(edge);
  }

  /// Binary search by entry point address.
  ///
  /// @return the vertex index, or a negative value if there is no function at `address`
  public int indexOf(long address) {
    int lo = 0;
    int hi = vertex.size() - 1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      int cmp = Long.compareUnsigned(vertex.get(mid).address(), address);
      if (cmp < 0) lo = mid + 1;
      else if (cmp > 0) hi = mid - 1;
      else return mid;
    }
    return -(lo + 1);
  }

  /// @param address        the function's entry point
  /// @param type           how the function was discovered
  /// @param mangledName    a user defined, real name, not an auto generated one like sub_BAADF00D
  /// @param demangledName  present if the name is a mangled C++ name that could be demangled
  /// @param libraryIndex   index into the library table for library functions
  /// @param moduleIndex    index into the module table, e.g. the class for DEX files
  public record Vertex(
      long address,
      Type type,
      Optional<String> mangledName,
      Optional<String> demangledName,
      OptionalInt libraryIndex,
      OptionalInt moduleIndex) {

    public Vertex {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(mangledName, "mangledName");
      Objects.requireNonNull(demangledName, "demangledName");
      Objects.requireNonNull(libraryIndex, "libraryIndex");
      Objects.requireNonNull(moduleIndex, "moduleIndex");
    }

    public static Vertex of(long address, Type type) {
      return new Vertex(address, type, Optional.empty(), Optional.empty(), OptionalInt.empty(), OptionalInt.empty());
    }

    public enum Type {
      /// Regular function with full disassembly.
      NORMAL(0),
      /// A well known library function.
      LIBRARY(1),
      /// Imported from a dynamic link library.
      IMPORTED(2),
      /// Forwards its work via an unconditional jump.
      THUNK(3),
      /// Contained invalid code or was rejected by some heuristic.
      INVALID(4);

      public static final Type DEFAULT = NORMAL;

      private final int number;

      Type(int number) {
        this.number = number;
      }

      public int number() {
        return number;
      }

      public static Type forNumber(int number) {
        for (Type t : values()) {
          if (t.number == number) return t;
        }
        return null;
      }

      /// Picks a type from what the producer knows about a function's origin. Invalid code
      /// wins over everything, then imports, library signatures and thunks.
      public static Type fromEvidence(boolean invalid, boolean imported, boolean library, boolean thunk) {
        if (invalid) return INVALID;
        if (imported) return IMPORTED;
        if (library) return LIBRARY;
        if (thunk) return THUNK;
        return NORMAL;
      }
    }
  }

  /// A call site. Self edges and duplicates are legitimate, they are instances not values.
  public record Edge(int sourceVertexIndex, int targetVertexIndex) {
  }
}
