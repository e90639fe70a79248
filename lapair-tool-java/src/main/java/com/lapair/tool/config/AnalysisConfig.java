package com.lapair.tool.config;

import com.google.gson.annotations.SerializedName;
import com.lapair.analysis.symbolic.ExecutionConfig;
import com.lapair.analysis.symbolic.JoinPolicy;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of the tool's JSON config file.
 *
 * <pre>
 * {
 *   "compiler_args": ["-std=c++17"],
 *   "analyses": ["slice", "taint", "symbolic"],
 *   "symbolic": { "join_policy": "merge", "max_paths": 64 }
 * }
 * </pre>
 * Every field is optional.
 */
public class AnalysisConfig {

    public static final String SLICE = "slice";
    public static final String TAINT = "taint";
    public static final String SYMBOLIC = "symbolic";
    public static final String REACHING_DEFINITIONS = "reaching_definitions";
    public static final String LIVE_VARIABLES = "live_variables";
    public static final String AVAILABLE_EXPRESSIONS = "available_expressions";
    public static final String CONSTANT_PROPAGATION = "constant_propagation";

    public static final List<String> DEFAULT_ANALYSES = List.of(SLICE, TAINT, SYMBOLIC);
    public static final List<String> KNOWN_ANALYSES = List.of(SLICE, TAINT, SYMBOLIC,
            REACHING_DEFINITIONS, LIVE_VARIABLES, AVAILABLE_EXPRESSIONS, CONSTANT_PROPAGATION);

    @SerializedName("compiler_args")
    private List<String> compilerArgs;

    /** Analyses run by {@code --analyze} (default: slice, taint, symbolic). */
    @SerializedName("analyses")
    private List<String> analyses;

    @SerializedName("symbolic")
    private SymbolicSection symbolic;

    public static class SymbolicSection {
        @SerializedName("join_policy")        public String joinPolicy;
        @SerializedName("max_paths")          public Integer maxPaths;
        @SerializedName("max_depth")          public Integer maxDepth;
        @SerializedName("max_loop_unrolling") public Integer maxLoopUnrolling;
        @SerializedName("max_steps")          public Integer maxSteps;
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    public List<String> getCompilerArgs() { return compilerArgs != null ? compilerArgs : Collections.emptyList(); }
    public List<String> getAnalyses()     { return analyses     != null ? analyses     : DEFAULT_ANALYSES; }

    /**
     * Symbolic execution bounds, falling back to {@link ExecutionConfig#defaults()}
     * for every field not present.
     *
     * @throws IllegalArgumentException for an unknown join policy or a non-positive bound
     */
    public ExecutionConfig getExecutionConfig() {
        ExecutionConfig d = ExecutionConfig.defaults();
        if (symbolic == null) return d;
        return new ExecutionConfig(
                symbolic.joinPolicy != null ? JoinPolicy.parse(symbolic.joinPolicy) : d.joinPolicy,
                symbolic.maxPaths != null ? symbolic.maxPaths : d.maxPaths,
                symbolic.maxDepth != null ? symbolic.maxDepth : d.maxDepth,
                symbolic.maxLoopUnrolling != null ? symbolic.maxLoopUnrolling : d.maxLoopUnrolling,
                symbolic.maxSteps != null ? symbolic.maxSteps : d.maxSteps
        );
    }
}
