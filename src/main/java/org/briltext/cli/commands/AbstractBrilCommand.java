package org.briltext.cli.commands;

import com.typesafe.config.ConfigException;
import org.briltext.cli.CommandLineInterface;
import org.briltext.cli.config.BrilSettings;
import org.briltext.compiler.api.BrilException;
import org.briltext.compiler.frontend.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Shared plumbing of the conversion commands: input selection, settings and the mapping
 * of failures to exit code 1 with the message on standard error.
 */
abstract class AbstractBrilCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractBrilCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-f", "--file"}, description = "Input file (default: standard input).")
    private File file;

    @Override
    public final Integer call() {
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final BrilSettings settings = BrilSettings.from(parent.getConfig());
            final String input = parent.readInput(file).content();
            run(input, settings, spec.commandLine().getOut());
            return 0;
        } catch (BrilException | IOException | ConfigException e) {
            LOG.debug("{} failed", spec.name(), e);
            err.println(e.getMessage());
            err.flush();
            return 1;
        }
    }

    /**
     * Name of the input used in diagnostics.
     */
    protected String inputName() {
        return file != null ? file.getPath() : SourceLoader.STDIN_NAME;
    }

    /**
     * Performs the conversion.
     *
     * @param input The complete input text.
     * @param settings The effective settings.
     * @param out The standard output writer.
     * @throws BrilException if the conversion fails.
     */
    protected abstract void run(String input, BrilSettings settings, PrintWriter out) throws BrilException;
}
