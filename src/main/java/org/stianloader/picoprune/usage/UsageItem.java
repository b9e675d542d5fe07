package org.stianloader.picoprune.usage;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoprune.Descriptor;
import org.stianloader.picoprune.version.LooseVersion;

/**
 * The identity the usage closure operates on: a product name and one of its versions.
 *
 * <p>Two items are equal if their name and version are equal. The {@link #getPath() path} and
 * {@link #getSize() size} are informational and stem from the first descriptor (in path order)
 * that carries this identity.
 */
public final class UsageItem {

    @NotNull
    private static final String[] SIZE_UNITS = {"KB", "MB", "GB", "TB"};

    @NotNull
    public static UsageItem of(@NotNull Descriptor descriptor) {
        return new UsageItem(descriptor.getName(), descriptor.getVersion(), descriptor.getPath(), descriptor.getInstallerItemSize());
    }

    @NotNull
    private final String name;
    @NotNull
    private final Path path;
    @Nullable
    private final Long size;
    @NotNull
    private final LooseVersion version;

    public UsageItem(@NotNull String name, @NotNull LooseVersion version, @NotNull Path path, @Nullable Long size) {
        this.name = Objects.requireNonNull(name, "\"name\" may not be null");
        this.version = Objects.requireNonNull(version, "\"version\" may not be null");
        this.path = Objects.requireNonNull(path, "\"path\" may not be null");
        this.size = size;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof UsageItem) {
            UsageItem other = (UsageItem) obj;
            return other.name.equals(this.name) && other.version.equals(this.version);
        }
        return false;
    }

    /**
     * Formats the installer size (which is stored in kilobytes) for humans, for example "1.5 GB".
     *
     * @return The formatted size, or an empty string if the size is unknown
     */
    @NotNull
    public String getHumanReadableSize() {
        Long size = this.size;
        if (size == null) {
            return "";
        }
        double value = size;
        int unit = 0;
        while (value >= 1024 && unit < SIZE_UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, SIZE_UNITS[unit]);
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

    /**
     * Obtains the installer size in kilobytes.
     *
     * @return The size or null if unknown
     */
    @Nullable
    @Contract(pure = true)
    public Long getSize() {
        return this.size;
    }

    @NotNull
    @Contract(pure = true)
    public LooseVersion getVersion() {
        return this.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.version);
    }

    @Override
    public String toString() {
        return this.name + "-" + this.version;
    }
}
