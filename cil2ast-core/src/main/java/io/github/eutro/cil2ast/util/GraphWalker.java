package io.github.eutro.cil2ast.util;

import io.github.eutro.cil2ast.cfg.BasicBlock;
import io.github.eutro.cil2ast.cfg.ControlFlowGraph;
import io.github.eutro.cil2ast.cfg.ProtectedRegion;

import java.util.*;
import java.util.function.Function;

/**
 * A class for walking a graph depth-first, in pre- or post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    final List<T> roots;
    final Function<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from root nodes and a successor function.
     * <p>
     * Roots and successors are visited in the order they are given.
     *
     * @param roots       The roots of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(List<T> roots, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.roots = roots;
        this.getChildren = getChildren;
    }

    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> getChildren) {
        this(Collections.singletonList(root), getChildren);
    }

    /**
     * Create a graph walker over the blocks of a graph, following ordinary edges from the entry.
     *
     * @param graph The graph.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(ControlFlowGraph graph) {
        return new GraphWalker<>(graph.getEntry(), BasicBlock::successors);
    }

    /**
     * Create a graph walker over the blocks of a graph, from the entry and from every handler entry.
     *
     * @param graph The graph.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> handlerAwareWalker(ControlFlowGraph graph) {
        List<BasicBlock> roots = new ArrayList<>();
        roots.add(graph.getEntry());
        for (ProtectedRegion region : graph.getRegions()) {
            roots.add(region.getHandlerEntry());
        }
        return new GraphWalker<>(roots, BasicBlock::successors);
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the post-order traversal of the graph. Reversed, this is a topological order of the
     * graph with its back edges removed.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    /**
     * Get the reverse post-order traversal of the graph.
     *
     * @return The reverse post-order, as a list.
     */
    public List<T> reversePostOrder() {
        List<T> ls = postOrder().toList();
        Collections.reverse(ls);
        return ls;
    }

    private class PreIter implements Iterator<T> {
        private final Deque<Iterator<? extends T>> stack = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();
        private T next;

        {
            stack.push(roots.iterator());
            advance();
        }

        private void advance() {
            next = null;
            while (!stack.isEmpty()) {
                Iterator<? extends T> top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    continue;
                }
                T t = top.next();
                if (seen.add(t)) {
                    next = t;
                    stack.push(getChildren.apply(t).iterator());
                    return;
                }
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (next == null) throw new NoSuchElementException();
            T t = next;
            advance();
            return t;
        }
    }

    private class PostIter implements Iterator<T> {
        private final Deque<T> nodes = new ArrayDeque<>();
        private final Deque<Iterator<? extends T>> stack = new ArrayDeque<>();
        private final Iterator<T> rootIter = roots.iterator();
        private final Set<T> seen = new HashSet<>();

        private boolean descend() {
            while (true) {
                if (stack.isEmpty()) {
                    T root = null;
                    while (rootIter.hasNext()) {
                        T candidate = rootIter.next();
                        if (seen.add(candidate)) {
                            root = candidate;
                            break;
                        }
                    }
                    if (root == null) return false;
                    nodes.push(root);
                    stack.push(getChildren.apply(root).iterator());
                }
                Iterator<? extends T> top = stack.peek();
                boolean pushed = false;
                while (top.hasNext()) {
                    T t = top.next();
                    if (seen.add(t)) {
                        nodes.push(t);
                        stack.push(getChildren.apply(t).iterator());
                        pushed = true;
                        break;
                    }
                }
                if (!pushed) return true;
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty() || descend();
        }

        @Override
        public T next() {
            if (stack.isEmpty() && !descend()) throw new NoSuchElementException();
            if (stack.peek().hasNext() && !descend()) throw new NoSuchElementException();
            stack.pop();
            return nodes.pop();
        }
    }
}
