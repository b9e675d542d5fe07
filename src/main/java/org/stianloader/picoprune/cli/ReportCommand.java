package org.stianloader.picoprune.cli;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.Callable;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.repo.RepositoryLayout;
import org.stianloader.picoprune.report.ReportFindings;
import org.stianloader.picoprune.report.ReportKind;
import org.stianloader.picoprune.report.ReportPrinter;
import org.stianloader.picoprune.report.RepositorySnapshot;

import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(
        name = "report",
        description = "Analyse the repository for unused, out of date and broken items",
        mixinStandardHelpOptions = true
)
public class ReportCommand implements Callable<Integer> {

    @Option(names = {"--keep"}, paramLabel = "N", defaultValue = "1",
            description = "Amount of newest production versions of a used item which are not out of date (default: ${DEFAULT-VALUE})")
    private int keep;

    @Option(names = {"--plist"}, defaultValue = "false",
            description = "Print the findings of all reports as a single property list")
    private boolean plist;

    @Mixin
    private RepositoryOptions repository;

    @NotNull
    private final PrintStream out;

    public ReportCommand(@NotNull PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() throws PropertyListException {
        RepositoryLayout layout;
        try {
            layout = this.repository.open();
        } catch (IllegalStateException e) {
            LoggingAdapter.getDefaultLogger().error(ReportCommand.class, e.getMessage());
            return ExitCode.SOFTWARE;
        }
        if (this.keep < 1) {
            LoggingAdapter.getDefaultLogger().error(ReportCommand.class, "--keep must be at least 1, got {}", this.keep);
            return ExitCode.USAGE;
        }

        Map<ReportKind, ReportFindings> results = ReportKind.runAll(RepositorySnapshot.load(layout, this.keep));
        if (this.plist) {
            ReportPrinter.writePropertyList(this.out, results);
            this.out.println();
        } else {
            ReportPrinter.printAll(this.out, results);
        }
        this.out.flush();
        return ExitCode.OK;
    }
}
