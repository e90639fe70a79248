package com.lapair.tool;

import com.lapair.analysis.ProgramSlicing;
import com.lapair.analysis.TaintAnalysis;
import com.lapair.analysis.dataflow.AvailableExpressions;
import com.lapair.analysis.dataflow.ConstantPropagation;
import com.lapair.analysis.dataflow.ControlFlowGraph;
import com.lapair.analysis.dataflow.LiveVariables;
import com.lapair.analysis.dataflow.ReachingDefinitions;
import com.lapair.analysis.symbolic.ExecutionResult;
import com.lapair.analysis.symbolic.Instruction;
import com.lapair.analysis.symbolic.PathStatus;
import com.lapair.analysis.symbolic.SymbolicExecution;
import com.lapair.ir.IrGraph;
import com.lapair.ir.Node;
import com.lapair.tool.config.AnalysisConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Runs the analyses listed in the config from the graph's entry node and
 * returns one summary line per analysis, in config order.
 */
public class AnalysisRunner {

    public List<String> run(IrGraph graph, AnalysisConfig config) {
        List<String> summary = new ArrayList<>();
        Node entry = graph.entry();
        if (entry == null) {
            System.err.println("[lapair] WARNING: graph is empty, no analyses run");
            return summary;
        }

        for (String analysis : config.getAnalyses()) {
            switch (analysis) {
                case AnalysisConfig.SLICE -> summary.add(slice(entry));
                case AnalysisConfig.TAINT -> summary.add(taint(entry));
                case AnalysisConfig.SYMBOLIC -> summary.add(symbolic(entry, config));
                case AnalysisConfig.REACHING_DEFINITIONS -> summary.add(reachingDefinitions(entry));
                case AnalysisConfig.LIVE_VARIABLES -> summary.add(liveVariables(entry));
                case AnalysisConfig.AVAILABLE_EXPRESSIONS -> summary.add(availableExpressions(entry));
                case AnalysisConfig.CONSTANT_PROPAGATION -> summary.add(constantPropagation(entry));
                default -> throw new IllegalArgumentException("Unknown analysis: " + analysis);
            }
        }
        return summary;
    }

    private String slice(Node entry) {
        ProgramSlicing slicing = new ProgramSlicing();
        Set<Node> backward = slicing.computeSlice(entry);
        Set<Node> forward = slicing.computeForwardSlice(entry);
        return "slice from " + entry.getId() + ": " + backward.size() + " backward, "
                + forward.size() + " forward";
    }

    private String taint(Node entry) {
        TaintAnalysis taint = new TaintAnalysis();
        taint.analyze(entry);
        return "taint from " + entry.getId() + ": " + taint.getTaintedIds().size() + " tainted";
    }

    private String symbolic(Node entry, AnalysisConfig config) {
        ExecutionResult result = new SymbolicExecution(config.getExecutionConfig()).execute(entry);
        return "symbolic from " + entry.getId() + ": " + result.pathCount() + " path(s), "
                + result.pathsWithStatus(PathStatus.COMPLETED).size() + " completed, "
                + result.getVisitedNodes().size() + " node(s) visited"
                + (result.isComplete() ? "" : " (truncated)");
    }

    private String reachingDefinitions(Node entry) {
        ReachingDefinitions rd = new ReachingDefinitions(ControlFlowGraph.build(entry));
        rd.analyze();
        return "reaching_definitions from " + entry.getId() + ": " + rd.allDefinitions().size()
                + " definition(s) over " + rd.getCfg().size() + " node(s)";
    }

    private String liveVariables(Node entry) {
        LiveVariables lv = new LiveVariables(ControlFlowGraph.build(entry));
        lv.analyze();
        return "live_variables from " + entry.getId() + ": " + lv.liveIn(entry).size()
                + " live at entry, " + lv.deadDefinitions().size() + " dead definition(s)";
    }

    private String availableExpressions(Node entry) {
        AvailableExpressions ae = new AvailableExpressions(ControlFlowGraph.build(entry));
        ae.analyze();
        return "available_expressions from " + entry.getId() + ": "
                + ae.redundantComputations().size() + " redundant computation(s)";
    }

    private String constantPropagation(Node entry) {
        ControlFlowGraph cfg = ControlFlowGraph.build(entry);
        ConstantPropagation cp = new ConstantPropagation(cfg);
        cp.analyze();
        long constants = cfg.getNodes().stream()
                .filter(n -> Instruction.decode(n).definedVariable()
                        .map(v -> cp.constantAfter(n, v).isPresent())
                        .orElse(false))
                .count();
        return "constant_propagation from " + entry.getId() + ": " + constants + " constant definition(s)";
    }
}
