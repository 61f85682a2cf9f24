package com.github.trex_paxos.binexport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Flattens operand expression trees into the shared expression and operand tables.
///
/// Nodes are emitted in pre-order so every parent is interned before its children and each
/// child's parent index points at an already existing record. Siblings keep their left to
/// right order because order in the operand's expression list is the only place rendering
/// order is recorded. Safe for concurrent use: the only shared state is the two interners.
public final class ExpressionTreeBuilder {

  private static final Logger logger = Logger.getLogger(ExpressionTreeBuilder.class.getName());

  private final InterningTable<Expression> expressions;
  private final InterningTable<Operand> operands;

  public ExpressionTreeBuilder(InterningTable<Expression> expressions, InterningTable<Operand> operands) {
    this.expressions = expressions;
    this.operands = operands;
  }

  /// Interns the tree rooted at `root` and returns its operand index.
  public int intern(ExpressionNode root) {
    return internForest(List.of(root));
  }

  /// Interns an operand given as a list of top level nodes, which must hold exactly one root.
  ///
  /// @throws DataIntegrityException on zero or several roots or on a cycle
  public int internForest(List<ExpressionNode> roots) {
    if (roots.size() != 1) {
      throw new DataIntegrityException("operand", operands.size(), "expression_index",
          String.format("operand must have exactly one root expression, got %d", roots.size()));
    }
    final List<Integer> flat = flatten(roots.get(0));
    final int operandIndex = operands.intern(new Operand(flat));
    logger.log(Level.FINEST, () -> String.format("operand %d %s -> %s", operandIndex, roots.get(0), flat));
    return operandIndex;
  }

  /// Pre-order flattening without recursion so a hostile depth cannot overflow the stack.
  /// A leaf node object may be reused under several parents. An inner node is expanded at
  /// most once, which keeps the walk linear in the number of distinct nodes.
  ///
  /// @throws DataIntegrityException on a cycle or an inner node reachable by two paths
  List<Integer> flatten(ExpressionNode root) {
    final List<Integer> result = new ArrayList<>();
    final Set<ExpressionNode> onPath = Collections.newSetFromMap(new IdentityHashMap<>());
    final Set<ExpressionNode> expanded = Collections.newSetFromMap(new IdentityHashMap<>());
    final ArrayDeque<Frame> stack = new ArrayDeque<>();
    final int rootIndex = expressions.intern(root.toExpression());
    result.add(rootIndex);
    onPath.add(root);
    expanded.add(root);
    stack.push(new Frame(root, rootIndex));
    while (!stack.isEmpty()) {
      final Frame top = stack.peek();
      final List<ExpressionNode> children = top.node.children();
      if (top.nextChild == children.size()) {
        onPath.remove(top.node);
        stack.pop();
        continue;
      }
      final ExpressionNode child = children.get(top.nextChild++);
      if (onPath.contains(child)) {
        throw new DataIntegrityException("expression", top.index, "parent_index",
            "cycle in expression tree at " + child.toExpression());
      }
      if (!child.children().isEmpty() && !expanded.add(child)) {
        throw new DataIntegrityException("expression", top.index, "parent_index",
            "inner node shared by more than one parent at " + child.toExpression());
      }
      onPath.add(child);
      final int index = expressions.intern(child.toExpression().withParent(top.index));
      result.add(index);
      stack.push(new Frame(child, index));
    }
    return result;
  }

  private static final class Frame {
    final ExpressionNode node;
    final int index;
    int nextChild;

    Frame(ExpressionNode node, int index) {
      this.node = node;
      this.index = index;
    }
  }
}
