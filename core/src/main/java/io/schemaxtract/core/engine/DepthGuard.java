package io.schemaxtract.core.engine;

/**
 * Depth ceiling for recursive walks over the source graph. This is the only
 * defense against deep or cyclic input: the host cannot guarantee stable node
 * identity, so no visited-set is kept. A branch deeper than {@code maxDepth} is
 * dropped silently.
 *
 * @param maxDepth deepest level that is still visited (root is depth 0)
 */
public record DepthGuard(int maxDepth) {

    public DepthGuard {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative, got: " + maxDepth);
        }
    }

    /** A visit step of a guarded walk. */
    @FunctionalInterface
    public interface Visit<T> {
        void visit(T node, int depth);
    }

    public boolean permits(int depth) {
        return depth <= maxDepth;
    }

    /**
     * Visits {@code node} at {@code depth} unless the ceiling is exceeded.
     *
     * @return {@code false} if the branch was cut off
     */
    public <T> boolean descend(T node, int depth, Visit<T> visit) {
        if (!permits(depth)) {
            return false;
        }
        visit.visit(node, depth);
        return true;
    }
}
