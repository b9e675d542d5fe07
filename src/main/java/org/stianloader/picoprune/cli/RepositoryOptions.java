package org.stianloader.picoprune.cli;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoprune.repo.CatalogPolicy;
import org.stianloader.picoprune.repo.RepositoryLayout;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Options shared by all commands that operate on a repository.
 */
public class RepositoryOptions {

    @Option(names = {"--repo"}, paramLabel = "DIR", defaultValue = "${env:PICOPRUNE_REPO}",
            description = "Root directory of the repository (default: the PICOPRUNE_REPO environment variable)")
    @Nullable
    private Path repository;

    @Option(names = {"--production-catalog"}, paramLabel = "CATALOG", defaultValue = "production",
            description = "Name of the production catalog, all other catalogs are testing catalogs (default: ${DEFAULT-VALUE})")
    @NotNull
    private String productionCatalog = "production";

    @Spec(Spec.Target.MIXEE)
    private CommandSpec spec;

    /**
     * Opens the repository.
     *
     * @return The layout of the repository
     * @throws ParameterException If no repository was given
     * @throws IllegalStateException If the repository is not available
     */
    @NotNull
    public RepositoryLayout open() {
        Path repository = this.repository;
        if (repository == null) {
            throw new ParameterException(this.spec.commandLine(), "No repository given. Use --repo or set PICOPRUNE_REPO.");
        }
        return new RepositoryLayout(repository, new CatalogPolicy(this.productionCatalog));
    }
}
