package org.stianloader.picoprune.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A version string that is ordered "loosely": it is split into runs of digits, runs of letters
 * and any other single characters. Dots only act as separators and are dropped.
 *
 * <p>Components are compared pairwise. Two numeric components compare numerically, two textual
 * components compare lexically (case-sensitive) and a numeric component always sorts before a
 * textual one. If all shared components are equal, the version with fewer components is the older one.
 * This means that "1.0" is older than "1.0.0", which in turn is older than "1.0.0b".
 *
 * <p>No attempt is made to interpret qualifiers such as "beta" or "SNAPSHOT". Versions of packages
 * in a software repository are written by many different vendors, so no single scheme would fit.
 */
public final class LooseVersion implements Comparable<LooseVersion> {

    @NotNull
    public static final LooseVersion EMPTY = new LooseVersion("", Collections.emptyList());

    @NotNull
    public static LooseVersion parse(@NotNull String string) {
        List<@NotNull Object> components = new ArrayList<>();
        int length = string.length();
        int i = 0;
        while (i < length) {
            char c = string.charAt(i);
            int start = i;
            if (Character.isDigit(c)) {
                while (i < length && Character.isDigit(string.charAt(i))) {
                    i++;
                }
                components.add(new BigInteger(string.substring(start, i)));
            } else if (Character.isLetter(c)) {
                while (i < length && Character.isLetter(string.charAt(i))) {
                    i++;
                }
                components.add(string.substring(start, i));
            } else {
                i++;
                if (c != '.') {
                    components.add(String.valueOf(c));
                }
            }
        }
        return new LooseVersion(string, Collections.unmodifiableList(components));
    }

    // Either BigInteger or String instances
    @NotNull
    private final List<@NotNull Object> components;

    @NotNull
    private final String originText;

    private LooseVersion(@NotNull String originText, @NotNull List<@NotNull Object> components) {
        this.originText = originText;
        this.components = components;
    }

    @Override
    public int compareTo(@NotNull LooseVersion other) {
        int shared = Math.min(this.components.size(), other.components.size());
        for (int i = 0; i < shared; i++) {
            int cmp = LooseVersion.compareComponents(this.components.get(i), other.components.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(this.components.size(), other.components.size());
    }

    private static int compareComponents(@NotNull Object a, @NotNull Object b) {
        if (a instanceof BigInteger) {
            if (b instanceof BigInteger) {
                return ((BigInteger) a).compareTo((BigInteger) b);
            }
            return -1;
        } else if (b instanceof BigInteger) {
            return 1;
        }
        return ((String) a).compareTo((String) b);
    }

    /**
     * Two versions are equal if they are made of the same components, even if their
     * {@link #getOriginText() origin text} differs (for example "1.0" and "1..0").
     */
    @Override
    public boolean equals(Object obj) {
        if (obj instanceof LooseVersion) {
            return this.components.equals(((LooseVersion) obj).components);
        }
        return false;
    }

    /**
     * Obtains the text that was used to create this version.
     *
     * @return The unaltered version string
     */
    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.components);
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull LooseVersion other) {
        return this.compareTo(other) > 0;
    }

    @Override
    @NotNull
    public String toString() {
        return this.originText;
    }
}
