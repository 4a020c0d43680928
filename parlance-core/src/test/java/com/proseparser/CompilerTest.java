package com.proseparser;

import com.proseparser.codegen.PythonGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private static Path example(String name) throws URISyntaxException {
        return Path.of(CompilerTest.class.getResource("/examples/" + name).toURI());
    }

    @ParameterizedTest
    @ValueSource(strings = {"basic", "loops", "nested"})
    void testExampleScripts(String name) throws Exception {
        String expected = Files.readString(example(name + ".py"), StandardCharsets.UTF_8);
        String actual = new Compiler().compileFile(example(name + ".uhl"));

        assertEquals(expected.strip(), actual.strip());
    }

    @Test
    void testCompileString() {
        assertEquals("x = 5", new Compiler().compile("declare a variable named x and set it to 5"));
    }

    @Test
    void testCustomGenerator() {
        String python = new Compiler(new PythonGenerator("\t")).compile("repeat 2 times do set x to 1");
        assertEquals("for _ in range(2):\n\tx = 1", python);
    }

    @Test
    void testErrorsPropagate() {
        CompilationException e = assertThrows(CompilationException.class,
            () -> new Compiler().compile("declare a variable named"));
        assertInstanceOf(ParseException.class, e);
    }

    @Test
    void testMissingFile() {
        assertThrows(NoSuchFileException.class,
            () -> new Compiler().compileFile(Path.of("does-not-exist.uhl")));
    }

    @Test
    void testOnlyNarrativeCompilesToNothing() {
        assertEquals("", new Compiler().compile("Here we talk about what the program will do."));
    }
}
