package org.briltext.cli.commands;

import org.briltext.cli.config.BrilSettings;
import org.briltext.compiler.Compiler;
import org.briltext.compiler.api.BrilException;
import org.briltext.compiler.interchange.JsonProgramCodec;
import org.briltext.compiler.ir.IrProgram;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(name = "bril2json", description = "Parses a Bril text program and prints its JSON form.")
public class Bril2JsonCommand extends AbstractBrilCommand {

    @Override
    protected void run(String input, BrilSettings settings, PrintWriter out) throws BrilException {
        IrProgram program = new Compiler().parse(input, inputName());
        out.println(new JsonProgramCodec(settings.prettyPrint()).toJson(program));
    }
}
