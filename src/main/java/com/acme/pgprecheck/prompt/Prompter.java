package com.acme.pgprecheck.prompt;

import java.io.IOException;

/** Interactive operator input. Both methods return {@code null} at end of input. */
public interface Prompter {

    /** Reads a line without echoing it. */
    String readSecret(String prompt) throws IOException;

    String readLine(String prompt) throws IOException;
}
