package org.stianloader.picoprune;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoprune.logging.LoggingAdapter;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.version.LooseVersion;

/**
 * A descriptor ("pkginfo") describes one installable version of a product and where its installer item is stored.
 *
 * <p>The {@link #getPath() path} of a descriptor is its identity within a repository. The {@link #getName() name}
 * is shared between all versions of a product.
 */
public final class Descriptor {

    @NotNull
    public static final String KEY_CATALOGS = "catalogs";
    @NotNull
    public static final String KEY_CATEGORY = "category";
    @NotNull
    public static final String KEY_FORCE_INSTALL_AFTER_DATE = "force_install_after_date";
    @NotNull
    public static final String KEY_INSTALLER_ITEM_LOCATION = "installer_item_location";
    @NotNull
    public static final String KEY_INSTALLER_ITEM_SIZE = "installer_item_size";
    @NotNull
    public static final String KEY_NAME = "name";
    @NotNull
    public static final String KEY_REQUIRES = "requires";
    @NotNull
    public static final String KEY_UNATTENDED_INSTALL = "unattended_install";
    @NotNull
    public static final String KEY_UPDATE_FOR = "update_for";
    @NotNull
    public static final String KEY_VERSION = "version";

    /**
     * Creates a descriptor from the root dictionary of a pkginfo file.
     *
     * <p>Only the name is mandatory. Optional keys with an unexpected type are logged and treated as absent,
     * array elements of an unexpected type are skipped.
     *
     * @param path The location of the pkginfo file
     * @param dict The parsed root dictionary
     * @return The descriptor
     * @throws PropertyListException If the name is absent or not a string
     */
    @NotNull
    public static Descriptor fromDictionary(@NotNull Path path, @NotNull Map<String, Object> dict) throws PropertyListException {
        Object name = dict.get(KEY_NAME);
        if (!(name instanceof String)) {
            throw new PropertyListException(path, "The pkginfo has no \"" + KEY_NAME + "\" string");
        }
        String version = Descriptor.optString(path, dict, KEY_VERSION);
        Number size = Descriptor.optValue(path, dict, KEY_INSTALLER_ITEM_SIZE, Number.class, "an integer");
        return new Descriptor(path, (String) name, version == null ? LooseVersion.EMPTY : LooseVersion.parse(version),
                Descriptor.optString(path, dict, KEY_INSTALLER_ITEM_LOCATION),
                size == null ? null : size.longValue(),
                Descriptor.optString(path, dict, KEY_CATEGORY),
                Descriptor.stringList(path, dict, KEY_REQUIRES),
                Descriptor.stringList(path, dict, KEY_UPDATE_FOR),
                dict.get(KEY_FORCE_INSTALL_AFTER_DATE),
                Descriptor.optValue(path, dict, KEY_UNATTENDED_INSTALL, Boolean.class, "a boolean"),
                Descriptor.stringList(path, dict, KEY_CATALOGS));
    }

    @Nullable
    private static String optString(@NotNull Path path, @NotNull Map<String, Object> dict, @NotNull String key) {
        return Descriptor.optValue(path, dict, key, String.class, "a string");
    }

    @Nullable
    private static <T> T optValue(@NotNull Path path, @NotNull Map<String, Object> dict, @NotNull String key, @NotNull Class<T> type, @NotNull String expected) {
        Object value = dict.get(key);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            LoggingAdapter.getDefaultLogger().warn(Descriptor.class, "Ignoring \"{}\" of pkginfo {}: expected {}, got {}", key, path, expected, value);
            return null;
        }
        return type.cast(value);
    }

    @NotNull
    private static List<@NotNull String> stringList(@NotNull Path path, @NotNull Map<String, Object> dict, @NotNull String key) {
        List<?> value = Descriptor.optValue(path, dict, key, List.class, "an array");
        if (value == null) {
            return Collections.emptyList();
        }
        List<@NotNull String> strings = new ArrayList<>();
        for (Object element : value) {
            if (element instanceof String) {
                strings.add((String) element);
            } else {
                LoggingAdapter.getDefaultLogger().warn(Descriptor.class, "Ignoring element {} of \"{}\" in pkginfo {}: expected a string", element, key, path);
            }
        }
        return Collections.unmodifiableList(strings);
    }

    @NotNull
    private final List<@NotNull String> catalogs;
    @Nullable
    private final String category;
    @Nullable
    private final Object forceInstallAfterDate;
    @Nullable
    private final String installerItemLocation;
    @Nullable
    private final Long installerItemSize;
    @NotNull
    private final String name;
    @NotNull
    private final Path path;
    @NotNull
    private final List<@NotNull String> requires;
    @Nullable
    private final Boolean unattendedInstall;
    @NotNull
    private final List<@NotNull String> updateFor;
    @NotNull
    private final LooseVersion version;

    public Descriptor(@NotNull Path path, @NotNull String name, @NotNull LooseVersion version, @Nullable String installerItemLocation,
            @Nullable Long installerItemSize, @Nullable String category, @NotNull List<@NotNull String> requires,
            @NotNull List<@NotNull String> updateFor, @Nullable Object forceInstallAfterDate, @Nullable Boolean unattendedInstall,
            @NotNull List<@NotNull String> catalogs) {
        this.path = Objects.requireNonNull(path, "\"path\" may not be null");
        this.name = Objects.requireNonNull(name, "\"name\" may not be null");
        this.version = Objects.requireNonNull(version, "\"version\" may not be null");
        this.installerItemLocation = installerItemLocation;
        this.installerItemSize = installerItemSize;
        this.category = category;
        this.requires = Collections.unmodifiableList(new ArrayList<>(requires));
        this.updateFor = Collections.unmodifiableList(new ArrayList<>(updateFor));
        this.forceInstallAfterDate = forceInstallAfterDate;
        this.unattendedInstall = unattendedInstall;
        this.catalogs = Collections.unmodifiableList(new ArrayList<>(catalogs));
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getCatalogs() {
        return this.catalogs;
    }

    @Nullable
    @Contract(pure = true)
    public String getCategory() {
        return this.category;
    }

    /**
     * Obtains the raw value of the {@code force_install_after_date} key. Usually an {@link java.time.Instant}.
     *
     * @return The forced installation date, or null if it is not set
     */
    @Nullable
    @Contract(pure = true)
    public Object getForceInstallAfterDate() {
        return this.forceInstallAfterDate;
    }

    @Nullable
    @Contract(pure = true)
    public String getInstallerItemLocation() {
        return this.installerItemLocation;
    }

    /**
     * Obtains the size of the installer item in kilobytes.
     *
     * @return The size, or null if the descriptor does not declare it
     */
    @Nullable
    @Contract(pure = true)
    public Long getInstallerItemSize() {
        return this.installerItemSize;
    }

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

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getRequires() {
        return this.requires;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getUpdateFor() {
        return this.updateFor;
    }

    @NotNull
    @Contract(pure = true)
    public LooseVersion getVersion() {
        return this.version;
    }

    @Contract(pure = true)
    public boolean isUnattendedInstall() {
        return Boolean.TRUE.equals(this.unattendedInstall);
    }

    @Override
    @NotNull
    public String toString() {
        return "Descriptor[name=" + this.name + " version=" + this.version + " path=" + this.path + "]";
    }
}
