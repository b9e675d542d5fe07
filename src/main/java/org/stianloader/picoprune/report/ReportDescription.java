package org.stianloader.picoprune.report;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * Describes a {@link Report}.
 *
 * @param name The human readable name, also used as the key of the report in structured output
 * @param description What the report collects, may be empty
 * @param sortKeys The keys findings are sorted by, most significant first
 * @param itemOrder The keys of an item that are printed first, in this order
 */
public record ReportDescription(@NotNull String name, @NotNull String description, @NotNull List<@NotNull SortKey> sortKeys, @NotNull List<@NotNull String> itemOrder) {

    /**
     * A key to sort findings by. The values of the key "version" are compared as loose versions,
     * all other values are compared as strings.
     *
     * @param key The item key
     * @param reverse Whether to sort in descending order
     */
    public record SortKey(@NotNull String key, boolean reverse) {
        @NotNull
        public static SortKey ascending(@NotNull String key) {
            return new SortKey(key, false);
        }

        @NotNull
        public static SortKey descending(@NotNull String key) {
            return new SortKey(key, true);
        }
    }

    @NotNull
    public static List<@NotNull SortKey> keys(@NotNull SortKey... keys) {
        return Collections.unmodifiableList(Arrays.asList(keys));
    }

    @NotNull
    public static List<@NotNull String> order(@NotNull String... keys) {
        return Collections.unmodifiableList(Arrays.asList(keys));
    }
}
