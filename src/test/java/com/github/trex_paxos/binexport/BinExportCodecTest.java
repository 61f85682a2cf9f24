package com.github.trex_paxos.binexport;

import com.github.trex_paxos.binexport.proto.BinExport2;
import com.google.protobuf.UnknownFieldSet;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static com.github.trex_paxos.binexport.ExpressionNode.dereference;
import static com.github.trex_paxos.binexport.ExpressionNode.immediate;
import static com.github.trex_paxos.binexport.ExpressionNode.operator;
import static com.github.trex_paxos.binexport.ExpressionNode.register;
import static com.github.trex_paxos.binexport.ExpressionNode.sizePrefix;
import static com.github.trex_paxos.binexport.ExpressionNode.symbol;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class BinExportCodecTest extends JulLoggingConfig {

  /// Two functions calling each other plus every auxiliary table.
  static BinExport richGraph() {
    final BinExportBuilder builder = BinExport.builder();
    builder.meta(new Meta(Optional.of("insider_gcc.exe"), Optional.of("9f86d081884c7d65"),
        Optional.of("x86-32"), OptionalLong.of(1_700_000_000L)));
    final int libc = builder.addLibrary(new Library(false, 0x7f00_0000L, Optional.of("libc.so.6")));
    builder.addLibrary(new Library(true, 0, Optional.empty()));
    final int module = builder.addModule(new Module(Optional.of("Lcom/example/Main;")));

    builder.addInstruction(0x1000, new byte[]{0x55}, "push", register("ebp"));
    builder.addInstruction(0x1001, new byte[]{(byte) 0x8b, 0x45, 0x08}, "mov", register("eax"),
        sizePrefix("b4", dereference(operator("+", register("ebp"), immediate(8)))));
    builder.addInstruction(0x1004, new byte[]{(byte) 0xe8, 0, 0, 0, 0}, "call",
        List.of(symbol("helper", 0x2000)), List.of(0x2000L));
    builder.addInstruction(0x1009, new byte[]{0x74, 0x01}, "jz", immediate(0x100c));
    builder.addInstruction(0x100b, new byte[]{(byte) 0x90}, "nop");
    builder.addInstruction(0x100c, new byte[]{(byte) 0xc3}, "ret");
    builder.addInstruction(0x2000, new byte[]{(byte) 0xc3}, "ret");

    final FlowGraphBuilder main = builder.flowGraph(0x1000);
    final int head = main.addBasicBlock(List.of(0x1000L, 0x1001L, 0x1004L, 0x1009L));
    final int fallThrough = main.addBasicBlock(List.of(0x100bL));
    final int exit = main.addBasicBlock(List.of(0x100cL));
    main.addEdge(head, exit, FlowGraph.Edge.Type.CONDITION_TRUE);
    main.addEdge(head, fallThrough, FlowGraph.Edge.Type.CONDITION_FALSE);
    main.addEdge(fallThrough, exit, FlowGraph.Edge.Type.UNCONDITIONAL);
    builder.flowGraph(0x2000).addBasicBlock(List.of(0x2000L));

    builder.callGraph().addVertex(new CallGraph.Vertex(0x2000, CallGraph.Vertex.Type.LIBRARY,
        Optional.of("_Z6helperv"), Optional.of("helper()"), OptionalInt.of(libc), OptionalInt.of(module)));
    builder.callGraph().addVertex(0x1000, CallGraph.Vertex.Type.NORMAL);
    builder.callGraph().addCall(0x1000, 0x2000);

    builder.addComment(0x1000, "prologue");
    builder.addComment(0x1001, 1, 3, "argument", true, Comment.Type.LOCAL_REFERENCE);
    builder.addAddressComment(0x100c, 0, 0, "legacy");
    builder.addStringReference(0x1004, 0, 0, "helper");
    builder.addExpressionSubstitution(0x1001, 1, 2, "arg_0");
    builder.addDataReference(0x1001, 0x4000);
    builder.addSection(new Section(0x1000, 0x1000, true, false, true));
    builder.addSection(new Section(0x4000, 0x200, true, true, false));
    builder.addMdIndex(0x1000, 12.5);
    builder.addMdIndex(0x2000, 0.0);
    return builder.build();
  }

  @Test
  public void minimalFunctionRoundTrips() {
    final BinExport original = TestGraphs.minimalFunction();
    Assert.assertThat(BinExportReader.decode(BinExportWriter.encode(original)), is(original));
  }

  @Test
  public void richGraphRoundTrips() {
    val original = richGraph();
    val bytes = BinExportWriter.encode(original);
    val decoded = BinExportReader.decode(bytes);
    Assert.assertThat(decoded, is(original));
    Assert.assertArrayEquals(bytes, BinExportWriter.encode(decoded));
  }

  @Test
  public void emptyGraphEncodesToNothing() {
    final byte[] bytes = BinExportWriter.encode(BinExport.EMPTY);
    Assert.assertThat(bytes.length, is(0));
    Assert.assertThat(BinExportReader.decode(bytes), is(BinExport.EMPTY));
  }

  @Test
  public void unknownTopLevelFieldsSurviveRoundTrip() {
    final BinExport original = TestGraphs.minimalFunction();
    final BinExport.Tables tables = TestGraphs.tables(original);
    tables.unknownFields.add(UnknownField.varint(42, 150));
    tables.unknownFields.add(UnknownField.fixed32(43, 0x04030201));
    tables.unknownFields.add(UnknownField.fixed64(44, 0x0807060504030201L));
    tables.unknownFields.add(UnknownField.lengthDelimited(100_000_000,
        ByteSequence.of("extension".getBytes(StandardCharsets.UTF_8))));
    final BinExport withExtensions = tables.freeze();

    final BinExport decoded = BinExportReader.decode(BinExportWriter.encode(withExtensions));
    Assert.assertThat(decoded, is(withExtensions));
    Assert.assertThat(decoded.unknownFields().get(3).fieldNumber(), is(100_000_000));
  }

  @Test
  public void unknownFieldsAreWrittenAfterSchemaFieldsByNumber() {
    final BinExport.Tables tables = TestGraphs.tables(TestGraphs.minimalFunction());
    tables.unknownFields.add(UnknownField.varint(100_000_001, 2));
    tables.unknownFields.add(UnknownField.varint(42, 1));
    final byte[] bytes = BinExportWriter.encode(tables.freeze());
    final BinExport decoded = BinExportReader.decode(bytes);
    Assert.assertThat(decoded.unknownFields().get(0), is(UnknownField.varint(42, 1)));
    Assert.assertThat(decoded.unknownFields().get(1), is(UnknownField.varint(100_000_001, 2)));
    // the varint for field 100000001 is the very last value on the wire
    Assert.assertThat(bytes[bytes.length - 1], is((byte) 2));
  }

  @Test
  public void repeatedUnknownFieldKeepsAllValues() {
    final BinExport.Tables tables = TestGraphs.tables(TestGraphs.minimalFunction());
    tables.unknownFields.add(UnknownField.of(42, UnknownFieldSet.Field.newBuilder()
        .addVarint(1).addVarint(2).build()));
    final BinExport decoded = BinExportReader.decode(BinExportWriter.encode(tables.freeze()));
    Assert.assertThat(decoded.unknownFields().size(), is(1));
    Assert.assertThat(decoded.unknownFields().get(0).toField().getVarintList(), contains(1L, 2L));
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownFieldCannotShadowASchemaField() {
    UnknownField.varint(BinExport2.INSTRUCTION_FIELD_NUMBER, 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownFieldCannotBeAGroup() {
    UnknownField.of(50, UnknownFieldSet.Field.newBuilder()
        .addGroup(UnknownFieldSet.getDefaultInstance()).build());
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownFieldEncodingMustMatchItsNumber() {
    new UnknownField(42, UnknownField.varint(43, 1).encoded());
  }

  @Test
  public void writerRejectsInvalidGraph() {
    final BinExport.Tables tables = TestGraphs.tables(TestGraphs.minimalFunction());
    tables.operand.set(0, new Operand(List.of(999)));
    try {
      BinExportWriter.encode(tables.freeze());
      Assert.fail("expected DataIntegrityException");
    } catch (DataIntegrityException e) {
      Assert.assertThat(e.getTable(), is("operand"));
    }
  }

  @Test
  public void writerEnforcesSizeLimit() {
    final BinExportWriter writer = BinExportWriter.builder().maxMessageBytes(16).build();
    try {
      writer.write(richGraph());
      Assert.fail("expected CapacityExceededException");
    } catch (CapacityExceededException e) {
      Assert.assertThat(e.getLimit(), is(16L));
    }
    final byte[] exact = BinExportWriter.encode(TestGraphs.minimalFunction());
    Assert.assertArrayEquals(exact,
        BinExportWriter.builder().maxMessageBytes(exact.length).build().write(TestGraphs.minimalFunction()));
  }

  @Test
  public void readerEnforcesSizeLimit() {
    final byte[] bytes = BinExportWriter.encode(TestGraphs.minimalFunction());
    final BinExportReader reader = BinExportReader.builder().maxMessageBytes(bytes.length - 1).build();
    try {
      reader.read(bytes);
      Assert.fail("expected CapacityExceededException");
    } catch (CapacityExceededException e) {
      Assert.assertThat(e.getTable(), is("binexport2"));
    }
    Assert.assertThat(BinExportReader.builder().maxMessageBytes(bytes.length).build().read(bytes),
        is(TestGraphs.minimalFunction()));
  }

  @Test
  public void sizeLimitFromSystemProperty() {
    final String key = BinExportReader.class.getName() + ".MAX_MESSAGE_BYTES";
    System.setProperty(key, "10");
    try {
      Assert.assertThat(BinExportFormat.getMaxMessageBytesOrDefault(BinExportReader.class), is(10L));
      try {
        new BinExportReader().read(new byte[11]);
        Assert.fail("expected CapacityExceededException");
      } catch (CapacityExceededException e) {
        Assert.assertThat(e.getLimit(), is(10L));
      }
      System.setProperty(key, "0");
      try {
        BinExportFormat.getMaxMessageBytesOrDefault(BinExportReader.class);
        Assert.fail("expected IllegalArgumentException");
      } catch (IllegalArgumentException e) {
        logger.fine(() -> "rejected: " + e.getMessage());
      }
    } finally {
      System.clearProperty(key);
    }
    Assert.assertThat(BinExportFormat.getMaxMessageBytesOrDefault(BinExportWriter.class),
        is(BinExportFormat.DEFAULT_MAX_MESSAGE_BYTES));
  }
}
