package com.codeontology.core.directive;

/**
 * Thrown inside multi-target expansion when a group nests deeper than allowed.
 *
 * <p>{@link MultiTargetExpander} converts it into a
 * {@link DirectiveError.Kind#MAX_NESTING_DEPTH_EXCEEDED} result, so it never escapes the
 * directive API.
 */
public class MaxNestingDepthExceededException extends Exception {

    private final int depth;
    private final int maxDepth;

    public MaxNestingDepthExceededException(int depth, int maxDepth) {
        super("Multi-target nesting depth " + depth + " exceeds maximum " + maxDepth);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
