package com.lapair.analysis.symbolic;

/** How an explored path ended. */
public enum PathStatus {
    /** Reached a node without outgoing edges. */
    COMPLETED,
    /** A node was visited more often on this path than the unroll bound allows. */
    LOOP_BOUND,
    /** The path re-entered visited nodes more often than the depth bound allows. */
    DEPTH_BOUND,
    /** A fork was dropped because the path limit was reached. */
    PATH_LIMIT,
    /** The global step budget ran out while the path was pending. */
    STEP_BUDGET,
    /** The path condition folded to false. */
    INFEASIBLE
}
