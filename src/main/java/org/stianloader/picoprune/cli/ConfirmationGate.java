package org.stianloader.picoprune.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

import org.jetbrains.annotations.NotNull;

/**
 * Asks the user whether a destructive operation may proceed.
 * Only "Y" and "YES" (in any case) are accepted, anything else including the end of the input declines.
 */
public class ConfirmationGate {

    @NotNull
    public static final String PROMPT = "Are you sure you want to continue? (Y|N): ";

    @NotNull
    private final BufferedReader in;
    @NotNull
    private final PrintStream out;

    public ConfirmationGate(@NotNull BufferedReader in, @NotNull PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public boolean confirm() throws IOException {
        this.out.print(ConfirmationGate.PROMPT);
        this.out.flush();
        String response = this.in.readLine();
        if (response == null) {
            this.out.println();
            return false;
        }
        response = response.trim().toUpperCase(Locale.ROOT);
        return response.equals("Y") || response.equals("YES");
    }
}
