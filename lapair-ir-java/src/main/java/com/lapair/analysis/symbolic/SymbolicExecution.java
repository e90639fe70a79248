package com.lapair.analysis.symbolic;

import com.lapair.ir.Edge;
import com.lapair.ir.IrProperties;
import com.lapair.ir.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Path-sensitive interpreter over the IR graph.
 *
 * Starting from an entry node with an empty state, each node's {@link Instruction}
 * is applied and the resulting state flows along the outgoing edges. A node with
 * several successors forks the state once per edge. What happens where paths meet
 * again is decided by {@link ExecutionConfig#joinPolicy}:
 * <ul>
 *   <li>{@link JoinPolicy#PATH_SENSITIVE}: depth-first exploration of individual
 *       paths. Each path is cut when it visits a node more than
 *       {@code maxLoopUnrolling} times or re-enters already visited nodes more
 *       than {@code maxDepth} times in total; forks beyond {@code maxPaths} are
 *       dropped. An acyclic path is never cut by either bound.</li>
 *   <li>{@link JoinPolicy#MERGE}: worklist dataflow pass keeping one merged state
 *       per node, widened to unknown values after {@code maxLoopUnrolling}
 *       changes.</li>
 * </ul>
 * Both modes stop after {@code maxSteps} node visits, so every run terminates on
 * cyclic graphs.
 *
 * Every visited node gets {@code symbolic_state=processed}; terminal nodes of
 * completed paths get {@code symbolic_paths} and {@code symbolic_result}.
 * Not thread-safe, and must not run concurrently with another pass that writes
 * properties of the same graph.
 */
public class SymbolicExecution {

    private final ExecutionConfig config;

    public SymbolicExecution() {
        this(ExecutionConfig.defaults());
    }

    public SymbolicExecution(ExecutionConfig config) {
        if (config == null) throw new IllegalArgumentException("config is required");
        this.config = config;
    }

    public ExecutionConfig getConfig() { return config; }

    /** Runs from {@code entryNode}; a null entry gives an empty, complete result. */
    public ExecutionResult execute(Node entryNode) {
        if (entryNode == null) {
            return ExecutionResult.empty();
        }
        ExecutionResult result = config.joinPolicy == JoinPolicy.MERGE
                ? new MergeRun().run(entryNode)
                : new PathRun().run(entryNode);
        annotate(result);
        if (!result.isComplete()) {
            System.err.println("[lapair] WARNING: symbolic execution from " + entryNode.getId()
                    + " was truncated (" + config + ")");
        }
        return result;
    }

    // -----------------------------------------------------------------------
    // Path-sensitive exploration
    // -----------------------------------------------------------------------

    /** Persistent list of the nodes on a path, newest first. */
    private record Trail(Node node, Trail parent, int depth) {
        List<Node> toList() {
            List<Node> nodes = new ArrayList<>(depth);
            for (Trail t = this; t != null; t = t.parent) nodes.add(t.node);
            Collections.reverse(nodes);
            return nodes;
        }
    }

    /**
     * A pending path: the node to execute next, the state flowing into it, the
     * per-path visit counts and the number of re-entries so far. Visit counts
     * are shared along a straight line and copied at forks.
     */
    private record Frame(Node node, SymbolicState state, Trail trail, Map<Node, Integer> visits, int reentries) {}

    private final class PathRun {
        private final List<PathResult> results = new ArrayList<>();
        private final Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        private boolean complete = true;
        private int steps = 0;
        private int paths = 1;

        ExecutionResult run(Node entry) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(entry, SymbolicState.empty(), null, new IdentityHashMap<>(), 0));

            while (!stack.isEmpty()) {
                Frame frame = stack.pop();
                if (steps >= config.maxSteps) {
                    stop(frame.trail, frame.node, frame.state, PathStatus.STEP_BUDGET);
                    while (!stack.isEmpty()) {
                        Frame pending = stack.pop();
                        stop(pending.trail, pending.node, pending.state, PathStatus.STEP_BUDGET);
                    }
                    break;
                }
                step(frame, stack);
            }
            return new ExecutionResult(results, visited, steps, complete);
        }

        private void step(Frame frame, Deque<Frame> stack) {
            Node node = frame.node;
            int count = frame.visits.merge(node, 1, Integer::sum);
            if (count > config.maxLoopUnrolling) {
                stop(frame.trail, node, frame.state, PathStatus.LOOP_BOUND);
                return;
            }
            int reentries = count > 1 ? frame.reentries + 1 : frame.reentries;
            if (reentries > config.maxDepth) {
                stop(frame.trail, node, frame.state, PathStatus.DEPTH_BOUND);
                return;
            }
            int depth = frame.trail == null ? 1 : frame.trail.depth + 1;

            steps++;
            visited.add(node);
            Trail trail = new Trail(node, frame.trail, depth);
            Instruction instruction = Instruction.decode(node);
            SymbolicState out = instruction.apply(frame.state);
            if (out.isInfeasible()) {
                finish(trail, node, out, PathStatus.INFEASIBLE);
                return;
            }

            List<Edge> successors = successorEdges(node);
            if (successors.isEmpty()) {
                finish(trail, node, out, PathStatus.COMPLETED);
                return;
            }

            List<Frame> forks = new ArrayList<>();
            for (Edge edge : successors) {
                SymbolicState refined = instruction.refine(out, edge.getProperty(IrProperties.BRANCH));
                if (refined.isInfeasible()) {
                    finish(trail, node, refined, PathStatus.INFEASIBLE);
                    continue;
                }
                boolean first = forks.isEmpty();
                if (!first) {
                    if (paths >= config.maxPaths) {
                        stop(trail, node, refined, PathStatus.PATH_LIMIT);
                        continue;
                    }
                    paths++;
                }
                // The first fork keeps the parent's counts; siblings get their own copy.
                Map<Node, Integer> visits = first ? frame.visits : new IdentityHashMap<>(frame.visits);
                forks.add(new Frame(edge.getTarget(), refined, trail, visits, reentries));
            }
            for (int i = forks.size() - 1; i >= 0; i--) {
                stack.push(forks.get(i));
            }
        }

        private void stop(Trail trail, Node node, SymbolicState state, PathStatus status) {
            complete = false;
            finish(trail, node, state, status);
        }

        private void finish(Trail trail, Node node, SymbolicState state, PathStatus status) {
            List<Node> nodes = trail == null ? List.of() : trail.toList();
            results.add(new PathResult(results.size(), nodes, node, state, status));
        }
    }

    // -----------------------------------------------------------------------
    // Merging exploration
    // -----------------------------------------------------------------------

    private final class MergeRun {
        private final Map<Node, SymbolicState> inStates = new IdentityHashMap<>();
        private final Map<Node, SymbolicState> terminalStates = new IdentityHashMap<>();
        private final Map<Node, Integer> updates = new IdentityHashMap<>();
        private final Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<Node> queued = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<Node> terminalOrder = new ArrayList<>();

        ExecutionResult run(Node entry) {
            Deque<Node> worklist = new ArrayDeque<>();
            inStates.put(entry, SymbolicState.empty());
            worklist.add(entry);
            queued.add(entry);

            int steps = 0;
            boolean complete = true;
            while (!worklist.isEmpty()) {
                if (steps >= config.maxSteps) {
                    complete = false;
                    break;
                }
                Node node = worklist.poll();
                queued.remove(node);
                steps++;
                visited.add(node);

                Instruction instruction = Instruction.decode(node);
                SymbolicState out = instruction.apply(inStates.get(node));
                if (out.isInfeasible()) continue;

                List<Edge> successors = successorEdges(node);
                if (successors.isEmpty()) {
                    if (terminalStates.put(node, out) == null) terminalOrder.add(node);
                    continue;
                }
                for (Edge edge : successors) {
                    SymbolicState refined = instruction.refine(out, edge.getProperty(IrProperties.BRANCH));
                    if (refined.isInfeasible()) continue;
                    Node target = edge.getTarget();
                    if (mergeInto(target, refined) && queued.add(target)) {
                        worklist.add(target);
                    }
                }
            }

            // Reached terminals keep the state merged so far; nodes still queued
            // when the budget ran out are reported as pending, like cut paths.
            List<PathResult> results = new ArrayList<>();
            for (Node terminal : terminalOrder) {
                results.add(new PathResult(results.size(), List.of(), terminal,
                        terminalStates.get(terminal), PathStatus.COMPLETED));
            }
            for (Node pending : worklist) {
                results.add(new PathResult(results.size(), List.of(), pending,
                        inStates.get(pending), PathStatus.STEP_BUDGET));
            }
            return new ExecutionResult(results, visited, steps, complete);
        }

        /** Returns true when the in-state of {@code target} changed. */
        private boolean mergeInto(Node target, SymbolicState incoming) {
            SymbolicState old = inStates.get(target);
            if (old == null) {
                inStates.put(target, incoming);
                return true;
            }
            SymbolicState merged = old.join(incoming);
            if (merged.equals(old)) return false;
            int changes = updates.merge(target, 1, Integer::sum);
            if (changes > config.maxLoopUnrolling) {
                merged = old.widen(merged);
                if (merged.equals(old)) return false;
            }
            inStates.put(target, merged);
            return true;
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static List<Edge> successorEdges(Node node) {
        return node.getOutgoingEdges().stream()
                .filter(e -> e != null && e.getTarget() != null)
                .collect(Collectors.toList());
    }

    private static void annotate(ExecutionResult result) {
        for (Node node : result.getVisitedNodes()) {
            node.setProperty(IrProperties.SYMBOLIC_STATE, IrProperties.SYMBOLIC_STATE_PROCESSED);
        }
        for (Map.Entry<Node, List<SymbolicState>> e : result.terminalStates().entrySet()) {
            List<SymbolicState> states = e.getValue();
            e.getKey().setProperty(IrProperties.SYMBOLIC_PATHS, Integer.toString(states.size()));
            e.getKey().setProperty(IrProperties.SYMBOLIC_RESULT, states.stream()
                    .map(SymbolicState::render)
                    .collect(Collectors.joining(" || ")));
        }
    }
}
