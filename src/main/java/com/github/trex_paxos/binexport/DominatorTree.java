package com.github.trex_paxos.binexport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Dominator tree of a directed graph computed with the Lengauer-Tarjan algorithm (the simple
/// variant with path compression). Nodes are `0..n-1`. All traversals are iterative so a
/// hostile flow graph cannot exhaust the stack. Nodes unreachable from the root dominate
/// nothing and are dominated by nothing.
///
/// The depth first spanning tree used by the algorithm is kept as well, so that retreating
/// edges of irreducible loops can be told apart from forward and cross edges.
public final class DominatorTree {

  private static final int NONE = -1;

  private final int root;
  private final int[] idom;
  private final int[] pre;
  private final int[] post;
  private final int[] dfsPre;
  private final int[] dfsPost;

  private DominatorTree(int root, int[] idom, int[] dfsPre, int[] dfsPost) {
    this.root = root;
    this.idom = idom;
    this.dfsPre = dfsPre;
    this.dfsPost = dfsPost;
    this.pre = new int[idom.length];
    this.post = new int[idom.length];
    number();
  }

  /// @param successors `successors.get(v)` lists the targets of the edges leaving `v`
  public static DominatorTree compute(List<? extends List<Integer>> successors, int root) {
    final int n = successors.size();
    if (root < 0 || root >= n) {
      throw new IllegalArgumentException(String.format("root %d not in [0, %d)", root, n));
    }
    final List<List<Integer>> predecessors = new ArrayList<>(n);
    for (int i = 0; i < n; i++) predecessors.add(new ArrayList<>());
    for (int v = 0; v < n; v++) {
      for (int w : successors.get(v)) predecessors.get(w).add(v);
    }

    final int[] dfnum = new int[n];
    final int[] vertex = new int[n];
    final int[] parent = new int[n];
    final int[] finish = new int[n];
    Arrays.fill(dfnum, NONE);
    Arrays.fill(parent, NONE);
    Arrays.fill(finish, NONE);

    // depth first numbering
    int count = 0;
    int finished = 0;
    final ArrayDeque<int[]> stack = new ArrayDeque<>();
    dfnum[root] = count;
    vertex[count++] = root;
    stack.push(new int[]{root, 0});
    while (!stack.isEmpty()) {
      final int[] top = stack.peek();
      final List<Integer> out = successors.get(top[0]);
      if (top[1] == out.size()) {
        finish[top[0]] = finished++;
        stack.pop();
        continue;
      }
      final int w = out.get(top[1]++);
      if (dfnum[w] == NONE) {
        dfnum[w] = count;
        vertex[count++] = w;
        parent[w] = top[0];
        stack.push(new int[]{w, 0});
      }
    }

    final int[] semi = new int[n];
    final int[] label = new int[n];
    final int[] ancestor = new int[n];
    final int[] idom = new int[n];
    Arrays.fill(ancestor, NONE);
    Arrays.fill(idom, NONE);
    final List<List<Integer>> bucket = new ArrayList<>(n);
    for (int v = 0; v < n; v++) {
      semi[v] = dfnum[v];
      label[v] = v;
      bucket.add(new ArrayList<>());
    }

    for (int i = count - 1; i > 0; i--) {
      final int w = vertex[i];
      for (int v : predecessors.get(w)) {
        if (dfnum[v] == NONE) continue;
        final int u = eval(v, ancestor, label, semi);
        if (semi[u] < semi[w]) semi[w] = semi[u];
      }
      bucket.get(vertex[semi[w]]).add(w);
      final int p = parent[w];
      ancestor[w] = p;
      for (int v : bucket.get(p)) {
        final int u = eval(v, ancestor, label, semi);
        idom[v] = semi[u] < semi[v] ? u : p;
      }
      bucket.get(p).clear();
    }
    for (int i = 1; i < count; i++) {
      final int w = vertex[i];
      if (idom[w] != vertex[semi[w]]) idom[w] = idom[idom[w]];
    }
    idom[root] = root;
    return new DominatorTree(root, idom, dfnum, finish);
  }

  private static int eval(int v, int[] ancestor, int[] label, int[] semi) {
    if (ancestor[v] == NONE) return v;
    compress(v, ancestor, label, semi);
    return label[v];
  }

  private static void compress(int v, int[] ancestor, int[] label, int[] semi) {
    final ArrayDeque<Integer> path = new ArrayDeque<>();
    for (int x = v; ancestor[ancestor[x]] != NONE; x = ancestor[x]) {
      path.push(x);
    }
    while (!path.isEmpty()) {
      final int x = path.pop();
      final int a = ancestor[x];
      if (semi[label[a]] < semi[label[x]]) label[x] = label[a];
      ancestor[x] = ancestor[a];
    }
  }

  /// Pre and post order numbers on the dominator tree give O(1) dominance queries.
  private void number() {
    final int n = idom.length;
    final List<List<Integer>> children = new ArrayList<>(n);
    for (int i = 0; i < n; i++) children.add(new ArrayList<>());
    for (int v = 0; v < n; v++) {
      if (v != root && idom[v] != NONE) children.get(idom[v]).add(v);
    }
    Arrays.fill(pre, NONE);
    Arrays.fill(post, NONE);
    int clock = 0;
    final ArrayDeque<int[]> stack = new ArrayDeque<>();
    pre[root] = clock++;
    stack.push(new int[]{root, 0});
    while (!stack.isEmpty()) {
      final int[] top = stack.peek();
      final List<Integer> kids = children.get(top[0]);
      if (top[1] == kids.size()) {
        post[top[0]] = clock++;
        stack.pop();
      } else {
        final int c = kids.get(top[1]++);
        pre[c] = clock++;
        stack.push(new int[]{c, 0});
      }
    }
  }

  /// @return the immediate dominator of `v`, `v` itself for the root, -1 if unreachable
  public int immediateDominator(int v) {
    return idom[v];
  }

  public boolean isReachable(int v) {
    return idom[v] != NONE;
  }

  /// True if every path from the root to `b` passes through `a`. A reachable node dominates itself.
  public boolean dominates(int a, int b) {
    if (!isReachable(a) || !isReachable(b)) return false;
    return pre[a] <= pre[b] && post[b] <= post[a];
  }

  /// True if `a` is `b` or an ancestor of `b` in the depth first spanning tree. An edge
  /// `b -> a` with this property is a retreating edge.
  public boolean isSpanningTreeAncestor(int a, int b) {
    if (!isReachable(a) || !isReachable(b)) return false;
    return dfsPre[a] <= dfsPre[b] && dfsPost[b] <= dfsPost[a];
  }
}
