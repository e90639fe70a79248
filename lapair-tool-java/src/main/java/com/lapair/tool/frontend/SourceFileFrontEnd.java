package com.lapair.tool.frontend;

import com.lapair.ir.IrGraph;
import com.lapair.ir.IrGraphBuilder;
import com.lapair.ir.IrProperties;
import com.lapair.ir.Node;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Placeholder front end: checks each input the way a syntax-only compiler pass
 * would reject it (missing, unreadable, not a C-family file) and emits one
 * {@code translation_unit} node per file. No function-level IR is produced yet.
 */
public class SourceFileFrontEnd implements FrontEnd {

    public static final String TRANSLATION_UNIT = "translation_unit";

    private static final Set<String> C_EXTENSIONS = Set.of("c", "h");
    private static final Set<String> CXX_EXTENSIONS = Set.of("cc", "cpp", "cxx", "hh", "hpp", "hxx");

    @Override
    public IrGraph translate(List<Path> sources, List<String> compilerArgs) {
        if (sources == null || sources.isEmpty()) {
            throw new FrontEndException("No source files given");
        }
        String joinedArgs = compilerArgs == null ? "" : String.join(" ", compilerArgs);

        IrGraphBuilder builder = new IrGraphBuilder();
        for (Path source : sources) {
            String language = languageOf(source);
            if (!Files.isRegularFile(source)) {
                throw new FrontEndException("Source file not found: " + source);
            }
            if (!Files.isReadable(source)) {
                throw new FrontEndException("Source file is not readable: " + source);
            }

            Node unit = builder.node(source.toString());
            unit.setProperty(IrProperties.KIND, TRANSLATION_UNIT);
            unit.setProperty(IrProperties.PATH, source.toAbsolutePath().normalize().toString());
            unit.setProperty(IrProperties.LANGUAGE, language);
            unit.setProperty(IrProperties.COMPILER_ARGS, joinedArgs);
        }
        IrGraph graph = builder.build();
        System.err.println("[lapair] Front end produced " + graph.nodes().size() + " translation unit(s)");
        return graph;
    }

    static String languageOf(Path source) {
        String name = source.getFileName() == null ? "" : source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String ext = dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (C_EXTENSIONS.contains(ext)) return "c";
        if (CXX_EXTENSIONS.contains(ext)) return "c++";
        throw new FrontEndException("Unsupported source file type: " + source);
    }
}
