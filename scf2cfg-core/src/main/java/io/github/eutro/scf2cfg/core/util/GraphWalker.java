package io.github.eutro.scf2cfg.core.util;

import io.github.eutro.scf2cfg.core.ssa.BasicBlock;
import io.github.eutro.scf2cfg.core.ssa.Control;
import io.github.eutro.scf2cfg.core.ssa.Region;

import java.util.*;

/**
 * Walks a graph depth-first, in pre- or post-order.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    private final T root;
    private final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     * <p>
     * Elements yielded later by the successor function are visited first.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the control-flow graph of {@link BasicBlock}s.
     * <p>
     * Blocks without a control have no successors.
     *
     * @param root          The root block.
     * @param reverseBlocks If true, the first target of each jump is visited first.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(BasicBlock root, boolean reverseBlocks) {
        return new GraphWalker<>(root, block -> {
            Control ctrl = block.getControl();
            if (ctrl == null) return Collections.emptyList();
            return reverseBlocks ? reversed(ctrl.targets) : ctrl.targets;
        });
    }

    /**
     * Create a graph walker over the blocks of a {@link Region}, starting from its entry.
     *
     * @param region        The region.
     * @param reverseBlocks If true, the first target of each jump is visited first.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Region region, boolean reverseBlocks) {
        return blockWalker(region.getEntry(), reverseBlocks);
    }

    private static <T> List<T> reversed(List<T> ts) {
        List<T> copy = new ArrayList<>(ts);
        Collections.reverse(copy);
        return copy;
    }

    /**
     * An order over a graph.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        /**
         * Collect this order to a list.
         *
         * @return The reachable nodes of the graph, in this order.
         */
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the pre-order traversal of the graph.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return PreIter::new;
    }

    /**
     * Get the post-order traversal of the graph.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return PostIter::new;
    }

    private class PreIter implements Iterator<T> {
        private final List<T> stack = new ArrayList<>();
        private final Set<T> seen = new HashSet<>();

        {
            stack.add(root);
            seen.add(root);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            T top = stack.remove(stack.size() - 1);
            for (T next : getChildren.apply(top)) {
                if (seen.add(next)) {
                    stack.add(next);
                }
            }
            return top;
        }
    }

    private class PostIter implements Iterator<T> {
        // a frame per node on the path from the root, with the successors not yet visited
        private final Deque<T> nodes = new ArrayDeque<>();
        private final Deque<Iterator<? extends T>> pending = new ArrayDeque<>();
        private final Set<T> seen = new HashSet<>();

        {
            push(root);
        }

        private void push(T node) {
            seen.add(node);
            nodes.push(node);
            pending.push(getChildren.apply(node).iterator());
        }

        @Override
        public boolean hasNext() {
            return !nodes.isEmpty();
        }

        @Override
        public T next() {
            if (nodes.isEmpty()) throw new NoSuchElementException();
            while (true) {
                Iterator<? extends T> it = pending.peek();
                T child = null;
                while (it.hasNext()) {
                    T next = it.next();
                    if (!seen.contains(next)) {
                        child = next;
                        break;
                    }
                }
                if (child == null) {
                    pending.pop();
                    return nodes.pop();
                }
                push(child);
            }
        }
    }
}
