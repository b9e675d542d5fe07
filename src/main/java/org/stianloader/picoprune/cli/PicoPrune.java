package org.stianloader.picoprune.cli;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.Charset;

import org.jetbrains.annotations.NotNull;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
        name = "picoprune",
        description = "Report on and clean up a pkginfo based software repository",
        mixinStandardHelpOptions = true,
        version = "picoprune 1.0.0"
)
public class PicoPrune implements Runnable {

    @NotNull
    public static CommandLine createCommandLine(@NotNull InputStream in, @NotNull PrintStream out, @NotNull PrintStream err) {
        ConfirmationGate gate = new ConfirmationGate(new BufferedReader(new InputStreamReader(in, Charset.defaultCharset())), out);
        CommandLine commandLine = new CommandLine(new PicoPrune());
        commandLine.addSubcommand(new ReportCommand(out));
        commandLine.addSubcommand(new DeprecateCommand(out, gate));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine;
    }

    public static void main(String[] args) {
        System.exit(PicoPrune.createCommandLine(System.in, System.out, System.err).execute(args));
    }

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        this.spec.commandLine().usage(this.spec.commandLine().getOut());
    }
}
