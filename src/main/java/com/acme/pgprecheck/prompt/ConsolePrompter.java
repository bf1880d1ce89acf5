package com.acme.pgprecheck.prompt;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Uses the system console when there is one. Without a console (piped input, IDE runs)
 * it falls back to plain stdin, in which case the secret is echoed by the terminal.
 */
public final class ConsolePrompter implements Prompter {

    private final Console console = System.console();
    private final PrintStream out;
    private BufferedReader stdin;

    public ConsolePrompter(PrintStream out) {
        this.out = out;
    }

    @Override
    public String readSecret(String prompt) throws IOException {
        if (console != null) {
            char[] secret = console.readPassword("%s", prompt);
            return secret == null ? null : new String(secret);
        }
        return readLine(prompt);
    }

    @Override
    public String readLine(String prompt) throws IOException {
        if (console != null) {
            return console.readLine("%s", prompt);
        }
        out.print(prompt);
        out.flush();
        if (stdin == null) {
            stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return stdin.readLine();
    }
}
