package org.briltext.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class CommandLineInterfaceTest {

    @Test
    public void testCliInitialization() {
        CommandLine cmd = CommandLineInterface.createCommandLine();

        assertThat(cmd.getCommandName()).isEqualTo("bril");
        assertThat(cmd.getSubcommands()).containsKeys("bril2json", "bril2txt", "resolve", "help");
    }

    @Test
    public void testNoSubcommandPrintsUsage() {
        CommandLine cmd = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: bril").contains("bril2json");
    }
}
