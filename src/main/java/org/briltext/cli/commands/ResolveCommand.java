package org.briltext.cli.commands;

import org.briltext.cli.config.BrilSettings;
import org.briltext.compiler.Compiler;
import org.briltext.compiler.api.BrilException;
import org.briltext.compiler.frontend.module.FileModuleLoader;
import org.briltext.compiler.interchange.JsonProgramCodec;
import org.briltext.compiler.ir.IrProgram;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.PrintWriter;

@Command(name = "resolve", description = "Merges all modules imported by a JSON Bril program into one program.")
public class ResolveCommand extends AbstractBrilCommand {

    @Option(names = {"-d", "--dir"}, description = "Directory to load modules from (default: bril.modules.directory).")
    private File directory;

    @Override
    protected void run(String input, BrilSettings settings, PrintWriter out) throws BrilException {
        JsonProgramCodec codec = new JsonProgramCodec(settings.prettyPrint());
        Compiler compiler = new Compiler();
        File moduleDir = directory != null ? directory : new File(settings.moduleDirectory());
        FileModuleLoader loader = new FileModuleLoader(moduleDir.toPath(), settings.moduleExtension(), compiler);

        IrProgram merged = compiler.resolveImports(codec.fromJson(input), loader);
        out.println(codec.toJson(merged));
    }
}
