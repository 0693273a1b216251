package org.briltext.compiler;

import org.briltext.compiler.api.BrilException;
import org.briltext.compiler.api.ICompiler;
import org.briltext.compiler.api.SyntaxException;
import org.briltext.compiler.backend.emit.TextEmitter;
import org.briltext.compiler.diagnostics.DiagnosticsEngine;
import org.briltext.compiler.frontend.irgen.IrConverterRegistry;
import org.briltext.compiler.frontend.irgen.IrGenerator;
import org.briltext.compiler.frontend.lexer.Lexer;
import org.briltext.compiler.frontend.lexer.Token;
import org.briltext.compiler.frontend.module.ImportResolver;
import org.briltext.compiler.frontend.module.ModuleLoader;
import org.briltext.compiler.frontend.parser.Parser;
import org.briltext.compiler.frontend.parser.ast.AstNode;
import org.briltext.compiler.ir.IrProgram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from Bril text
 * to the structured program and back. Every call uses fresh phase instances and its own
 * {@link DiagnosticsEngine}, so a single instance can be shared.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final TextEmitter emitter;

    /**
     * Creates a compiler whose printer uses the name-only function header.
     */
    public Compiler() {
        this(new TextEmitter());
    }

    /**
     * @param emitter The printer used by {@link #print(IrProgram)}.
     */
    public Compiler(TextEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public IrProgram parse(String source, String programName) throws BrilException {
        long start = System.nanoTime();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        Lexer lexer = new Lexer(source, diagnostics, programName);
        List<Token> tokens = lexer.scanTokens();
        if (diagnostics.hasErrors()) {
            throw new SyntaxException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        // Phase 2: Parsing
        Parser parser = new Parser(tokens, diagnostics);
        List<AstNode> ast = parser.parse();
        if (diagnostics.hasErrors()) {
            throw new SyntaxException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        // Phase 3: Tree transformation
        IrGenerator generator = new IrGenerator(diagnostics, IrConverterRegistry.initializeWithDefaults());
        IrProgram program = generator.generate(ast, programName);
        if (diagnostics.hasErrors()) {
            throw new SyntaxException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        LOG.debug("Parsed {} in {} ms", programName, (System.nanoTime() - start) / 1_000_000);
        return program;
    }

    @Override
    public String print(IrProgram program) {
        return emitter.emit(program);
    }

    @Override
    public IrProgram resolveImports(IrProgram program, ModuleLoader loader) throws BrilException {
        return new ImportResolver(loader).resolve(program);
    }
}
