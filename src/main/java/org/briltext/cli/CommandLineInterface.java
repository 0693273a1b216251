package org.briltext.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import org.briltext.cli.commands.Bril2JsonCommand;
import org.briltext.cli.commands.Bril2TxtCommand;
import org.briltext.cli.commands.ResolveCommand;
import org.briltext.cli.config.ConfigLoader;
import org.briltext.cli.config.LoggingConfigurator;
import org.briltext.compiler.frontend.io.SourceLoader;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "bril",
    mixinStandardHelpOptions = true,
    version = "bril-text 1.0",
    description = "Converts Bril programs between the text and JSON formats and resolves imports.",
    subcommands = {
        Bril2JsonCommand.class,
        Bril2TxtCommand.class,
        ResolveCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final InputStream stdin;
    private Config config;

    public CommandLineInterface() {
        this(System.in);
    }

    /**
     * @param stdin The stream subcommands read when no input file is given.
     */
    public CommandLineInterface(final InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line reading standard input.
     * @return The configured picocli command line.
     */
    public static CommandLine createCommandLine() {
        return createCommandLine(System.in);
    }

    /**
     * Creates the command line with a custom input stream.
     * @param stdin The stream read when no input file is given.
     * @return The configured picocli command line.
     */
    public static CommandLine createCommandLine(final InputStream stdin) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface(stdin));
        commandLine.setCommandName("bril");
        return commandLine;
    }

    /**
     * Returns the configuration, loading it and applying the logging settings on first use.
     *
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            if (config.hasPath("logging.format")) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                        LoggingConfigurator.appenderFor(config.getString("logging.format")));
                reconfigureLogback();
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * Reads the subcommand input from the given file, or from standard input when it is null.
     *
     * @param file The input file, may be null.
     * @return The content and the name used in diagnostics.
     * @throws IOException if the input cannot be read.
     */
    public SourceLoader.LoadResult readInput(final File file) throws IOException {
        if (file == null) {
            return SourceLoader.loadStream(stdin);
        }
        return SourceLoader.loadFile(file.toPath());
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
