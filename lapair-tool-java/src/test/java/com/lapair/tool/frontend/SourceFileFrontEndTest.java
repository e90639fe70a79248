package com.lapair.tool.frontend;

import com.lapair.ir.IrGraph;
import com.lapair.ir.IrProperties;
import com.lapair.ir.Node;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileFrontEndTest {

    private final SourceFileFrontEnd frontEnd = new SourceFileFrontEnd();

    @Test
    void emitsOneTranslationUnitPerFile(@TempDir Path tmp) throws IOException {
        Path cpp = Files.writeString(tmp.resolve("main.cpp"), "int main() { return 0; }\n");
        Path c = Files.writeString(tmp.resolve("util.c"), "int f(void) { return 1; }\n");

        IrGraph graph = frontEnd.translate(List.of(cpp, c), List.of("-std=c++17", "-Wall"));

        assertEquals(2, graph.nodes().size());
        assertTrue(graph.edges().isEmpty());

        Node first = graph.entry();
        assertEquals(cpp.toString(), first.getId());
        assertEquals(SourceFileFrontEnd.TRANSLATION_UNIT, first.getProperty(IrProperties.KIND));
        assertEquals("c++", first.getProperty(IrProperties.LANGUAGE));
        assertEquals("-std=c++17 -Wall", first.getProperty(IrProperties.COMPILER_ARGS));
        assertEquals(cpp.toAbsolutePath().normalize().toString(), first.getProperty(IrProperties.PATH));

        assertEquals("c", graph.nodes().get(1).getProperty(IrProperties.LANGUAGE));
    }

    @Test
    void headerExtensionsAreAccepted() {
        assertEquals("c", SourceFileFrontEnd.languageOf(Path.of("x.h")));
        assertEquals("c++", SourceFileFrontEnd.languageOf(Path.of("x.HPP")));
        assertEquals("c++", SourceFileFrontEnd.languageOf(Path.of("dir/x.cc")));
    }

    @Test
    void nullCompilerArgsGiveEmptyProperty(@TempDir Path tmp) throws IOException {
        Path src = Files.writeString(tmp.resolve("a.cc"), "");
        IrGraph graph = frontEnd.translate(List.of(src), null);
        assertEquals("", graph.entry().getProperty(IrProperties.COMPILER_ARGS));
        assertTrue(graph.entry().hasProperty(IrProperties.COMPILER_ARGS));
    }

    @Test
    void missingFileFails(@TempDir Path tmp) {
        var e = assertThrows(FrontEndException.class,
                () -> frontEnd.translate(List.of(tmp.resolve("nope.cpp")), List.of()));
        assertTrue(e.getMessage().contains("nope.cpp"));
    }

    @Test
    void directoryIsNotASourceFile(@TempDir Path tmp) throws IOException {
        Path dir = Files.createDirectory(tmp.resolve("src.cpp"));
        assertThrows(FrontEndException.class, () -> frontEnd.translate(List.of(dir), List.of()));
    }

    @Test
    void unsupportedExtensionFails(@TempDir Path tmp) throws IOException {
        Path py = Files.writeString(tmp.resolve("script.py"), "print(1)\n");
        assertThrows(FrontEndException.class, () -> frontEnd.translate(List.of(py), List.of()));
    }

    @Test
    void noSourcesFails() {
        assertThrows(FrontEndException.class, () -> frontEnd.translate(List.of(), List.of()));
    }
}
