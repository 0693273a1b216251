package org.briltext.cli.commands;

import org.briltext.cli.config.BrilSettings;
import org.briltext.compiler.Compiler;
import org.briltext.compiler.api.BrilException;
import org.briltext.compiler.backend.emit.TextEmitter;
import org.briltext.compiler.interchange.JsonProgramCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;

@Command(name = "bril2txt", description = "Pretty-prints a JSON Bril program in the text format.")
public class Bril2TxtCommand extends AbstractBrilCommand {

    @Option(names = "--signatures", description = "Print function parameters and return types.")
    private boolean signatures;

    @Override
    protected void run(String input, BrilSettings settings, PrintWriter out) throws BrilException {
        Compiler compiler = new Compiler(new TextEmitter(signatures || settings.emitSignatures()));
        out.print(compiler.print(new JsonProgramCodec().fromJson(input)));
        out.flush();
    }
}
