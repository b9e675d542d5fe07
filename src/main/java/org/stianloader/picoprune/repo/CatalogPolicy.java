package org.stianloader.picoprune.repo;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.Descriptor;

/**
 * Defines which catalog is the production catalog. Every other catalog a descriptor is member of
 * counts as a testing catalog.
 */
public final class CatalogPolicy {

    @NotNull
    public static final CatalogPolicy DEFAULT = new CatalogPolicy("production");

    @NotNull
    private final String productionCatalog;

    public CatalogPolicy(@NotNull String productionCatalog) {
        this.productionCatalog = Objects.requireNonNull(productionCatalog, "\"productionCatalog\" may not be null");
    }

    /**
     * Obtains the catalog filter that only accepts descriptors in the production catalog.
     *
     * @return A single-element set
     */
    @NotNull
    public Set<@NotNull String> productionFilter() {
        return Collections.singleton(this.productionCatalog);
    }

    @Contract(pure = true)
    public boolean isInProduction(@NotNull Descriptor descriptor) {
        return descriptor.getCatalogs().contains(this.productionCatalog);
    }

    @Contract(pure = true)
    public boolean isInTesting(@NotNull Descriptor descriptor) {
        Collection<String> catalogs = descriptor.getCatalogs();
        for (String catalog : catalogs) {
            if (!catalog.equals(this.productionCatalog)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "CatalogPolicy[production=" + this.productionCatalog + "]";
    }
}
