/// Module for the BinExport2 codec providing a deduplicated, index-validated binary form of disassembled executables.
module com.github.trex_paxos.binexport {
    requires java.logging;
    requires com.google.protobuf;
    requires static lombok;
    exports com.github.trex_paxos.binexport;
    // generated messages, reflective accessors are built by the protobuf runtime
    opens com.github.trex_paxos.binexport.proto to com.google.protobuf;
}
