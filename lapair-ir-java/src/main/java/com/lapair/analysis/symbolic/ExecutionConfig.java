package com.lapair.analysis.symbolic;

/**
 * Bounds and join policy for {@link SymbolicExecution}.
 */
public final class ExecutionConfig {

    public static final int DEFAULT_MAX_PATHS = 256;
    public static final int DEFAULT_MAX_DEPTH = 1024;
    public static final int DEFAULT_MAX_LOOP_UNROLLING = 2;
    public static final int DEFAULT_MAX_STEPS = 100_000;

    public final JoinPolicy joinPolicy;

    /** Most paths explored, truncated ones included. Path-sensitive mode only. */
    public final int maxPaths;

    /**
     * Most re-entries into nodes already visited on a single path, summed over
     * all loops on it. Acyclic paths have none. Path-sensitive mode only.
     */
    public final int maxDepth;

    /**
     * Path-sensitive: most visits of one node along one path.
     * Merge: state updates a node accepts before its values are widened.
     */
    public final int maxLoopUnrolling;

    /** Total node visits across the whole run. */
    public final int maxSteps;

    public ExecutionConfig(JoinPolicy joinPolicy, int maxPaths, int maxDepth, int maxLoopUnrolling, int maxSteps) {
        if (joinPolicy == null) throw new IllegalArgumentException("joinPolicy is required");
        requirePositive("maxPaths", maxPaths);
        requirePositive("maxDepth", maxDepth);
        requirePositive("maxLoopUnrolling", maxLoopUnrolling);
        requirePositive("maxSteps", maxSteps);
        this.joinPolicy = joinPolicy;
        this.maxPaths = maxPaths;
        this.maxDepth = maxDepth;
        this.maxLoopUnrolling = maxLoopUnrolling;
        this.maxSteps = maxSteps;
    }

    public static ExecutionConfig defaults() {
        return new ExecutionConfig(JoinPolicy.PATH_SENSITIVE,
                DEFAULT_MAX_PATHS, DEFAULT_MAX_DEPTH, DEFAULT_MAX_LOOP_UNROLLING, DEFAULT_MAX_STEPS);
    }

    public ExecutionConfig withJoinPolicy(JoinPolicy policy) {
        return new ExecutionConfig(policy, maxPaths, maxDepth, maxLoopUnrolling, maxSteps);
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }

    @Override
    public String toString() {
        return "join=" + joinPolicy + " max_paths=" + maxPaths + " max_depth=" + maxDepth
                + " max_loop_unrolling=" + maxLoopUnrolling + " max_steps=" + maxSteps;
    }
}
