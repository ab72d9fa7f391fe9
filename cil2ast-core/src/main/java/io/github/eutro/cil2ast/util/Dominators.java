package io.github.eutro.cil2ast.util;

import java.util.HashSet;
import java.util.Set;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/

/**
 * Computes immediate dominators over a graph given as successor lists of integer nodes.
 * <p>
 * Used for both dominators and post-dominators; for the latter the graph is reversed by the caller.
 */
public final class Dominators {
    private Dominators() {
    }

    /**
     * Compute the immediate dominators of a graph.
     *
     * @param succ The successors of each node, indexed from zero.
     * @param root The root node.
     * @return The immediate dominator of each node, or -1 for the root and for nodes unreachable from it.
     */
    public static int[] compute(int[][] succ, int root) {
        Runner runner = new Runner(succ);
        runner.run(root + 1);
        int[] idoms = new int[succ.length];
        for (int v = 1; v <= succ.length; v++) {
            idoms[v - 1] = runner.semi[v] == 0 || v == root + 1 ? -1 : runner.dom[v] - 1;
        }
        return idoms;
    }

    private static class Runner {
        int n;
        final int[][] succ;
        final int[] dom;
        final int[] parent;
        final int[] ancestor;
        final int[] child;
        final int[] vertex;
        final int[] label;
        final int[] semi;
        final int[] size;
        final Set<Integer>[] pred;
        final Set<Integer>[] bucket;

        @SuppressWarnings("unchecked")
        Runner(int[][] graph) {
            int count = graph.length;
            succ = new int[count + 1][];
            for (int i = 0; i < count; i++) {
                int[] targets = new int[graph[i].length];
                for (int j = 0; j < targets.length; j++) {
                    targets[j] = graph[i][j] + 1;
                }
                succ[i + 1] = targets;
            }
            dom = new int[count + 1];
            parent = new int[count + 1];
            ancestor = new int[count + 1];
            child = new int[count + 1];
            vertex = new int[count + 1];
            label = new int[count + 1];
            semi = new int[count + 1];
            size = new int[count + 1];
            pred = new Set[count + 1];
            bucket = new Set[count + 1];
            for (int v = 1; v <= count; ++v) {
                pred[v] = new HashSet<>();
                bucket[v] = new HashSet<>();
            }
        }

        void dfs(int v) {
            semi[v] = ++n;
            vertex[n] = label[v] = v;
            ancestor[v] = child[v] = 0;
            size[v] = 1;
            for (int w : succ[v]) {
                if (semi[w] == 0) {
                    parent[w] = v;
                    dfs(w);
                }
                pred[w].add(v);
            }
        }

        void compress(int v) {
            if (ancestor[ancestor[v]] != 0) {
                compress(ancestor[v]);
                if (semi[label[ancestor[v]]] < semi[label[v]]) {
                    label[v] = label[ancestor[v]];
                }
                ancestor[v] = ancestor[ancestor[v]];
            }
        }

        int eval(int v) {
            if (ancestor[v] == 0) {
                return label[v];
            } else {
                compress(v);
                return semi[label[ancestor[v]]] >= semi[label[v]]
                        ? label[v]
                        : label[ancestor[v]];
            }
        }

        void link(int v, int w) {
            int s = w;
            while (semi[label[w]] < semi[label[child[s]]]) {
                if (size[s] + size[child[child[s]]] >= 2 * size[child[s]]) {
                    ancestor[child[s]] = s;
                    child[s] = child[child[s]];
                } else {
                    size[child[s]] = size[s];
                    s = ancestor[s] = child[s];
                }
            }
            label[s] = label[w];
            size[v] += size[w];
            if (size[v] < 2 * size[w]) {
                int t = s;
                s = child[v];
                child[v] = t;
            }
            while (s != 0) {
                ancestor[s] = v;
                s = child[s];
            }
        }

        void run(int root) {
            int u, w;
            n = 0;
            dfs(root);
            size[0] = label[0] = semi[0] = 0;
            for (int i = n; i >= 2; i--) {
                w = vertex[i];
                for (int v : pred[w]) {
                    u = eval(v);
                    if (semi[u] < semi[w]) {
                        semi[w] = semi[u];
                    }
                }
                bucket[vertex[semi[w]]].add(w);
                link(parent[w], w);
                for (int v : bucket[parent[w]]) {
                    u = eval(v);
                    dom[v] = semi[u] < semi[v] ? u : parent[w];
                }
                bucket[parent[w]].clear();
            }
            for (int i = 2; i <= n; ++i) {
                w = vertex[i];
                if (dom[w] != vertex[semi[w]]) {
                    dom[w] = dom[dom[w]];
                }
            }
            dom[root] = 0;
        }
    }
}
