package org.stianloader.picoprune;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A manifest assigns products to deployment targets by name. It is kept as the full parsed dictionary,
 * so that writing a manifest back to disk preserves every key that picoprune does not know of.
 */
public final class Manifest {

    @NotNull
    public static final String KEY_CONDITIONAL_ITEMS = "conditional_items";

    /**
     * The keys of the arrays that reference products by name, in the order they are processed.
     */
    @NotNull
    public static final List<@NotNull String> REFERENCE_KEYS = Collections.unmodifiableList(Arrays.asList(
            "managed_installs", "managed_uninstalls", "optional_installs", "managed_updates"));

    /**
     * A single array of product references, either at the top level of a manifest or inside of
     * a {@code conditional_items} entry.
     */
    public static final class ReferenceList {
        private final boolean conditional;
        @NotNull
        private final List<Object> entries;
        @NotNull
        private final String key;

        ReferenceList(@NotNull String key, boolean conditional, @NotNull List<Object> entries) {
            this.key = key;
            this.conditional = conditional;
            this.entries = entries;
        }

        /**
         * Obtains the live list backing the manifest. Mutations are reflected the next time the manifest is written.
         *
         * @return The mutable entries
         */
        @NotNull
        public List<Object> entries() {
            return this.entries;
        }

        @Contract(pure = true)
        public boolean isConditional() {
            return this.conditional;
        }

        @NotNull
        @Contract(pure = true)
        public String key() {
            return this.key;
        }

        @Override
        public String toString() {
            return this.conditional ? "conditional " + this.key : this.key;
        }
    }

    @NotNull
    private final Map<String, Object> dictionary;

    @NotNull
    private final String name;

    @NotNull
    private final Path path;

    public Manifest(@NotNull String name, @NotNull Path path, @NotNull Map<String, Object> dictionary) {
        this.name = Objects.requireNonNull(name, "\"name\" may not be null");
        this.path = Objects.requireNonNull(path, "\"path\" may not be null");
        this.dictionary = Objects.requireNonNull(dictionary, "\"dictionary\" may not be null");
    }

    private static void collectLists(@NotNull Map<?, ?> dict, boolean conditional, @NotNull List<ReferenceList> out) {
        for (String key : REFERENCE_KEYS) {
            Object value = dict.get(key);
            if (value instanceof List) {
                @SuppressWarnings("unchecked")
                List<Object> entries = (List<Object>) value;
                out.add(new ReferenceList(key, conditional, entries));
            }
        }
        Object conditionals = dict.get(KEY_CONDITIONAL_ITEMS);
        if (conditionals instanceof List) {
            for (Object conditionalItem : (List<?>) conditionals) {
                if (conditionalItem instanceof Map) {
                    Manifest.collectLists((Map<?, ?>) conditionalItem, true, out);
                }
            }
        }
    }

    @NotNull
    @Contract(pure = true)
    public Map<String, Object> getDictionary() {
        return this.dictionary;
    }

    /**
     * Obtains the name of the manifest, which is its path relative to the manifest directory.
     *
     * @return The manifest name
     */
    @NotNull
    @Contract(pure = true)
    public String getName() {
        return this.name;
    }

    @NotNull
    @Contract(pure = true)
    public Path getPath() {
        return this.path;
    }

    /**
     * Obtains all product reference arrays of this manifest, including those nested inside of
     * {@code conditional_items}. Keys whose value is not an array are skipped.
     *
     * @return The reference lists, top level lists first
     */
    @NotNull
    public List<@NotNull ReferenceList> getReferenceLists() {
        List<ReferenceList> lists = new ArrayList<>();
        Manifest.collectLists(this.dictionary, false, lists);
        return lists;
    }

    @Override
    public String toString() {
        return "Manifest[name=" + this.name + "]";
    }
}
