package org.briltext.compiler.api;

import org.briltext.compiler.frontend.module.ModuleLoader;
import org.briltext.compiler.ir.IrProgram;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for translating between the Bril text format
 * and the structured program model.
 */
public interface ICompiler {

    /**
     * Parses Bril source text into a structured program.
     *
     * @param source The complete source text.
     * @param programName A name for the source, used in diagnostics.
     * @return The structured program.
     * @throws SyntaxException if the text does not conform to the grammar.
     * @throws DuplicateFunctionException if a function name is defined twice.
     */
    IrProgram parse(String source, String programName) throws BrilException;

    /**
     * Pretty-prints a structured program in the text format.
     *
     * @param program The program to print.
     * @return The program text.
     */
    String print(IrProgram program);

    /**
     * Merges all modules transitively imported by the program into a single program.
     *
     * @param program The root program.
     * @param loader The collaborator that loads modules by name.
     * @return The merged program, without imports.
     * @throws ModuleLoadException if a module cannot be loaded.
     * @throws DuplicateFunctionException if modules define the same function name.
     */
    IrProgram resolveImports(IrProgram program, ModuleLoader loader) throws BrilException;

    /**
     * Parses the source text of a file.
     * @param sourcePath The path to the source file.
     * @return The structured program.
     * @throws BrilException if errors occur during parsing.
     * @throws IOException if the file cannot be read.
     */
    default IrProgram parse(Path sourcePath) throws BrilException, IOException {
        return parse(Files.readString(sourcePath), sourcePath.toString());
    }
}
