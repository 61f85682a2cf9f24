package com.github.trex_paxos.binexport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/// A producer side expression tree node with ordered children. Children are rendered left
/// to right in list order. Nodes are mutable so producers can assemble trees incrementally;
/// {@link ExpressionTreeBuilder} flattens them into the parent-indexed expression table.
public final class ExpressionNode {

  private final Expression.Type type;
  private final String symbol;
  private final Long immediate;
  private final boolean relocation;
  private final List<ExpressionNode> children = new ArrayList<>();

  public ExpressionNode(Expression.Type type, String symbol, Long immediate, boolean relocation) {
    this.type = Objects.requireNonNull(type, "type");
    this.symbol = symbol;
    this.immediate = immediate;
    this.relocation = relocation;
  }

  public static ExpressionNode register(String name) {
    return new ExpressionNode(Expression.Type.REGISTER, name, null, false);
  }

  public static ExpressionNode immediate(long value) {
    return new ExpressionNode(Expression.Type.IMMEDIATE_INT, null, value, false);
  }

  public static ExpressionNode symbol(String name, long value) {
    return new ExpressionNode(Expression.Type.SYMBOL, name, value, false);
  }

  public static ExpressionNode operator(String symbol, ExpressionNode... children) {
    return new ExpressionNode(Expression.Type.OPERATOR, symbol, null, false).add(children);
  }

  public static ExpressionNode dereference(ExpressionNode child) {
    return new ExpressionNode(Expression.Type.DEREFERENCE, "[", null, false).add(child);
  }

  public static ExpressionNode sizePrefix(String size, ExpressionNode child) {
    return new ExpressionNode(Expression.Type.SIZE_PREFIX, size, null, false).add(child);
  }

  public ExpressionNode add(ExpressionNode... nodes) {
    for (ExpressionNode node : nodes) {
      children.add(Objects.requireNonNull(node, "child"));
    }
    return this;
  }

  public List<ExpressionNode> children() {
    return Collections.unmodifiableList(children);
  }

  /// The record for this node, not yet attached to a parent.
  Expression toExpression() {
    return new Expression(
        type,
        Optional.ofNullable(symbol),
        immediate == null ? OptionalLong.empty() : OptionalLong.of(immediate),
        OptionalInt.empty(),
        relocation);
  }

  @Override
  public String toString() {
    if (children.isEmpty()) {
      return symbol != null ? symbol : String.valueOf(immediate);
    }
    return String.format("%s%s", symbol != null ? symbol : type, children);
  }
}
