package com.lapair.tool.frontend;

import com.lapair.ir.IrGraph;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns source files into IR.
 *
 * Implementations must register every edge they create on both endpoints
 * (see {@link com.lapair.ir.IrGraphBuilder#connect}). Node ids need not be
 * globally unique, but nothing downstream checks for collisions either.
 */
public interface FrontEnd {

    /**
     * @param sources      source files, at least one
     * @param compilerArgs compiler-style flags passed through to the parser
     * @throws FrontEndException when any input cannot be translated
     */
    IrGraph translate(List<Path> sources, List<String> compilerArgs);
}
