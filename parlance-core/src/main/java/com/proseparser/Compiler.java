package com.proseparser;

import com.proseparser.ast.Program;
import com.proseparser.codegen.PythonGenerator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Source text to Python in one call: tokenize, parse, generate. Compilation errors
 * propagate unchanged as {@link CompilationException}s.
 */
public class Compiler {

    private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

    private final PythonGenerator generator;

    public Compiler() {
        this(new PythonGenerator());
    }

    public Compiler(PythonGenerator generator) {
        this.generator = generator;
    }

    public String compile(String source) {
        return generator.generate(parse(source));
    }

    public String compileFile(Path path) throws IOException {
        logger.info("Compiling {}", path);
        return compile(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Tokenizes and parses without generating code.
     */
    public Program parse(String source) {
        List<Token> tokens = Lexer.tokenize(source);
        Program program = new Parser(tokens).parse();
        logger.debug("{} tokens, {} statements", tokens.size(), program.statements().size());
        return program;
    }
}
