package org.stianloader.picoprune.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.report.ReportDescription.SortKey;
import org.stianloader.picoprune.version.LooseVersion;

/**
 * The findings of a {@link Report}: a list of items (one per finding, e.g. one per orphaned installer)
 * and a list of metadata entries (summaries which are not tied to a single item).
 * Both are lists of insertion-ordered dictionaries of property-list compatible values.
 */
public final class ReportFindings {

    @NotNull
    private final List<@NotNull Map<String, Object>> items = new ArrayList<>();

    @NotNull
    private final List<@NotNull Map<String, Object>> metadata = new ArrayList<>();

    @NotNull
    private static Comparator<Map<String, Object>> comparator(@NotNull SortKey sortKey) {
        Comparator<Map<String, Object>> comparator;
        if (sortKey.key().equals("version")) {
            comparator = Comparator.comparing((item) -> LooseVersion.parse(Objects.toString(item.get("version"), "")));
        } else {
            comparator = Comparator.comparing((item) -> Objects.toString(item.get(sortKey.key()), ""));
        }
        return sortKey.reverse() ? comparator.reversed() : comparator;
    }

    /**
     * Adds an item. Keys are kept in the order of the arguments.
     *
     * @param keyValuePairs Alternating keys and values
     * @return This instance
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ReportFindings addItem(@NotNull Object... keyValuePairs) {
        this.items.add(ReportFindings.dictionary(keyValuePairs));
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ReportFindings addMetadata(@NotNull Object... keyValuePairs) {
        this.metadata.add(ReportFindings.dictionary(keyValuePairs));
        return this;
    }

    @NotNull
    private static Map<String, Object> dictionary(@NotNull Object... keyValuePairs) {
        if (keyValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Keys and values must come in pairs");
        }
        Map<String, Object> dict = new LinkedHashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            dict.put((String) keyValuePairs[i], keyValuePairs[i + 1]);
        }
        return dict;
    }

    /**
     * Converts the findings into their structured representation {@code {"items": [...], "metadata": [...]}}.
     *
     * @return A property-list compatible dictionary
     */
    @NotNull
    public Map<String, Object> asDictionary() {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("items", new ArrayList<>(this.items));
        dict.put("metadata", new ArrayList<>(this.metadata));
        return dict;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Map<String, Object>> getItems() {
        return Collections.unmodifiableList(this.items);
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull Map<String, Object>> getMetadata() {
        return Collections.unmodifiableList(this.metadata);
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.items.isEmpty() && this.metadata.isEmpty();
    }

    /**
     * Sorts the items by the given keys, the first key being the most significant one.
     *
     * @param sortKeys The keys to sort by
     * @return This instance
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ReportFindings sort(@NotNull List<@NotNull SortKey> sortKeys) {
        Comparator<Map<String, Object>> comparator = null;
        for (SortKey key : sortKeys) {
            Comparator<Map<String, Object>> next = ReportFindings.comparator(key);
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        if (comparator != null) {
            this.items.sort(comparator);
        }
        return this;
    }
}
