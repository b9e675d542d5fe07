package org.stianloader.picoprune.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.removal.ArchiveDestinationException;
import org.stianloader.picoprune.removal.RemovalExecutor;
import org.stianloader.picoprune.removal.RemovalMode;
import org.stianloader.picoprune.removal.RemovalPlan;
import org.stianloader.picoprune.removal.RemovalPlanner;
import org.stianloader.picoprune.removal.RemovalResult;
import org.stianloader.picoprune.removal.RemovalSelection;
import org.stianloader.picoprune.repo.DescriptorStore;
import org.stianloader.picoprune.repo.RepositoryLayout;

import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(
        name = "deprecate",
        description = "Remove or archive items from the repository and remove their names from manifests",
        mixinStandardHelpOptions = true
)
public class DeprecateCommand implements Callable<Integer> {

    @Option(names = {"--archive"}, paramLabel = "DIR",
            description = "Move the items into this directory instead of deleting them")
    @Nullable
    private Path archive;

    @Option(names = {"-c", "--category"}, paramLabel = "CATEGORY",
            description = "Remove all items of this category. Use '" + RemovalSelection.NO_CATEGORY + "' for items without a category")
    @Nullable
    private List<String> categories;

    @Option(names = {"-n", "--name"}, paramLabel = "NAME",
            description = "Remove all versions of the item with this name")
    @Nullable
    private List<String> names;

    @Option(names = {"--plist"}, paramLabel = "FILE",
            description = "Remove the items listed in this removal list ({\"removals\": [{\"path\": ...}]})")
    @Nullable
    private Path removalList;

    @Mixin
    private RepositoryOptions repository;

    @NotNull
    private final ConfirmationGate gate;

    @NotNull
    private final PrintStream out;

    public DeprecateCommand(@NotNull PrintStream out, @NotNull ConfirmationGate gate) {
        this.out = out;
        this.gate = gate;
    }

    private void printPlan(@NotNull RemovalPlan plan, @NotNull RemovalMode mode) {
        this.out.println("Items to be " + mode.describe() + ":");
        for (Path file : plan.getAllFiles()) {
            this.out.println("\t" + file);
        }
        this.out.println();
        this.out.println("Items to be removed from manifests:");
        for (String name : plan.getNames()) {
            this.out.println("\t" + name);
        }
        this.out.println();
        for (String warning : plan.getWarnings()) {
            this.out.println("WARNING: " + warning);
        }
    }

    private void printResult(@NotNull RemovalResult result, @NotNull RemovalMode mode) {
        this.out.println(result.getProcessed().size() + " files " + mode.describe() + ".");
        for (Map.Entry<Path, String> failure : result.getFailures().entrySet()) {
            this.out.println("Unable to process " + failure.getKey() + ": " + failure.getValue());
        }
        for (Map.Entry<String, List<String>> change : result.getManifestChanges().entrySet()) {
            this.out.println("Manifest " + change.getKey() + ":");
            for (String line : change.getValue()) {
                this.out.println("\t" + line);
            }
        }
        for (String advisory : result.getAdvisories()) {
            this.out.println("WARNING: " + advisory);
        }
    }

    @Override
    public Integer call() throws IOException {
        RemovalSelection selection = RemovalSelection.NONE;
        if (this.categories != null) {
            selection = selection.withCategories(this.categories);
        }
        if (this.names != null) {
            selection = selection.withNames(this.names);
        }
        Path removalList = this.removalList;
        if (removalList != null) {
            try {
                selection = selection.withListedPaths(RemovalSelection.readRemovalList(removalList));
            } catch (PropertyListException e) {
                LoggingAdapter.getDefaultLogger().error(DeprecateCommand.class, "Unable to read removal list: {}", e.getMessage());
                return ExitCode.SOFTWARE;
            }
        }

        RepositoryLayout layout;
        try {
            layout = this.repository.open();
        } catch (IllegalStateException e) {
            LoggingAdapter.getDefaultLogger().error(DeprecateCommand.class, e.getMessage());
            return ExitCode.SOFTWARE;
        }

        Path archive = this.archive;
        RemovalMode mode = archive == null ? RemovalMode.DELETE : RemovalMode.archive(archive);
        RemovalPlan plan = new RemovalPlanner(layout).plan(selection, new DescriptorStore(layout).load());
        this.printPlan(plan, mode);
        if (plan.isEmpty()) {
            this.out.println("Nothing to do.");
            return ExitCode.OK;
        }

        if (!this.gate.confirm()) {
            this.out.println("Aborted.");
            return ExitCode.OK;
        }

        RemovalResult result;
        try {
            result = new RemovalExecutor(layout).execute(plan, mode);
        } catch (ArchiveDestinationException e) {
            LoggingAdapter.getDefaultLogger().error(DeprecateCommand.class, "{} Please check permissions.", e.getMessage());
            return ExitCode.SOFTWARE;
        }
        this.printResult(result, mode);
        this.out.flush();
        return ExitCode.OK;
    }
}
