package com.lapair.analysis.symbolic;

import com.lapair.ir.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outcome of one {@link SymbolicExecution#execute} call.
 */
public class ExecutionResult {

    private final List<PathResult> paths;
    private final Set<Node> visitedNodes;
    private final int steps;
    private final boolean complete;

    ExecutionResult(List<PathResult> paths, Set<Node> visitedNodes, int steps, boolean complete) {
        this.paths = List.copyOf(paths);
        this.visitedNodes = Collections.unmodifiableSet(visitedNodes);
        this.steps = steps;
        this.complete = complete;
    }

    static ExecutionResult empty() {
        return new ExecutionResult(List.of(), Collections.newSetFromMap(new IdentityHashMap<>()), 0, true);
    }

    /** Every explored path, truncated and infeasible ones included. */
    public List<PathResult> getPaths() { return paths; }

    public int pathCount() { return paths.size(); }

    public List<PathResult> completedPaths() {
        return paths.stream().filter(PathResult::isCompleted).collect(Collectors.toList());
    }

    public List<PathResult> pathsWithStatus(PathStatus status) {
        return paths.stream().filter(p -> p.status() == status).collect(Collectors.toList());
    }

    /** Final states of the completed paths ending at each terminal node. */
    public Map<Node, List<SymbolicState>> terminalStates() {
        Map<Node, List<SymbolicState>> byNode = new IdentityHashMap<>();
        for (PathResult p : paths) {
            if (p.isCompleted()) {
                byNode.computeIfAbsent(p.terminal(), n -> new ArrayList<>()).add(p.state());
            }
        }
        return byNode;
    }

    public List<SymbolicState> statesAt(Node terminal) {
        return terminalStates().getOrDefault(terminal, List.of());
    }

    public Set<Node> getVisitedNodes() { return visitedNodes; }

    public int getSteps() { return steps; }

    /** False when any path was cut by a bound or the step budget. */
    public boolean isComplete() { return complete; }
}
