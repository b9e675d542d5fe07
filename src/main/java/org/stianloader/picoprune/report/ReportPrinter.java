package org.stianloader.picoprune.report;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoprune.plist.PropertyListException;
import org.stianloader.picoprune.plist.PropertyLists;

/**
 * Renders report findings, either as human readable text or as a single property list document.
 */
public final class ReportPrinter {

    private static final int DESCRIPTION_WIDTH = 73;
    private static final String SEPARATOR = "--------------------";

    /**
     * Wraps the text into lines which, including the leading tab, are at most {@code width} characters wide.
     * Words longer than the width are put onto a line of their own.
     *
     * @param text The text to wrap
     * @param width The maximum line width, the indentation counting as one character
     * @return The wrapped lines, each starting with a tab
     */
    @NotNull
    static List<@NotNull String> wrap(@NotNull String text, int width) {
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder("\t");
        for (String word : text.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (line.length() > 1 && line.length() + 1 + word.length() > width) {
                lines.add(line.toString());
                line.setLength(1);
            }
            if (line.length() > 1) {
                line.append(' ');
            }
            line.append(word);
        }
        if (line.length() > 1) {
            lines.add(line.toString());
        }
        return lines;
    }

    private static void printSection(@NotNull PrintStream out, @NotNull String title, @NotNull List<@NotNull Map<String, Object>> section, @NotNull List<@NotNull String> order) {
        if (section.isEmpty()) {
            return;
        }
        out.println("\t" + title + ":");
        out.println("\t" + SEPARATOR);
        for (Map<String, Object> entry : section) {
            for (String key : order) {
                if (entry.containsKey(key)) {
                    out.println("\t" + key + ": " + entry.get(key));
                }
            }
            for (Map.Entry<String, Object> value : entry.entrySet()) {
                if (!order.contains(value.getKey())) {
                    out.println("\t" + value.getKey() + ": " + value.getValue());
                }
            }
            out.println("\t" + SEPARATOR);
        }
    }

    /**
     * Prints a single report as text.
     *
     * @param out The stream to print to
     * @param description The description of the report
     * @param findings The sorted findings of the report
     */
    public static void print(@NotNull PrintStream out, @NotNull ReportDescription description, @NotNull ReportFindings findings) {
        out.println("# " + description.name() + " #:");
        if (!description.description().isEmpty()) {
            for (String line : ReportPrinter.wrap(description.description(), DESCRIPTION_WIDTH)) {
                out.println(line);
            }
            out.println();
        }
        if (findings.isEmpty()) {
            out.println("\tNo items.");
            out.println();
            return;
        }
        ReportPrinter.printSection(out, "Items", findings.getItems(), description.itemOrder());
        ReportPrinter.printSection(out, "Metadata", findings.getMetadata(), List.of());
        out.println();
    }

    /**
     * Prints all reports as text, in the iteration order of the map.
     *
     * @param out The stream to print to
     * @param results The findings of every report
     */
    public static void printAll(@NotNull PrintStream out, @NotNull Map<@NotNull ReportKind, @NotNull ReportFindings> results) {
        for (Map.Entry<ReportKind, ReportFindings> result : results.entrySet()) {
            ReportPrinter.print(out, result.getKey().describe(), result.getValue());
        }
    }

    /**
     * Converts the findings of all reports into one dictionary keyed by the report names.
     *
     * @param results The findings of every report
     * @return A property-list compatible dictionary
     */
    @NotNull
    public static Map<String, Object> asDictionary(@NotNull Map<@NotNull ReportKind, @NotNull ReportFindings> results) {
        Map<String, Object> dict = new LinkedHashMap<>();
        for (Map.Entry<ReportKind, ReportFindings> result : results.entrySet()) {
            dict.put(result.getKey().describe().name(), result.getValue().asDictionary());
        }
        return dict;
    }

    /**
     * Writes the findings of all reports as one XML property list.
     *
     * @param out The stream to write to
     * @param results The findings of every report
     * @throws PropertyListException If the findings cannot be serialized
     */
    public static void writePropertyList(@NotNull OutputStream out, @NotNull Map<@NotNull ReportKind, @NotNull ReportFindings> results) throws PropertyListException {
        PropertyLists.write(ReportPrinter.asDictionary(results), out, null);
    }

    private ReportPrinter() {
        throw new UnsupportedOperationException();
    }
}
