package com.lapair.analysis.dataflow;

import com.lapair.ir.Node;

/** Assignment of {@code variable} by the instruction on {@code node}. Node identity, not id. */
public record Definition(String variable, Node node) {
    @Override
    public String toString() {
        return variable + "@" + node.getId();
    }
}
