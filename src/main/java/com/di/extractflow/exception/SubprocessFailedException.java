package com.di.extractflow.exception;

import lombok.Getter;

/**
 * A domain binary exited with a non-zero status.
 */
@Getter
public class SubprocessFailedException extends ExtractFlowException {

    private final String binary;
    private final int exitCode;
    private final String stderr;

    public SubprocessFailedException(String binary, int exitCode, String stderr) {
        super("Binary '" + binary + "' exited with code " + exitCode
                + (stderr == null || stderr.isBlank() ? "" : ": " + abbreviate(stderr)));
        this.binary = binary;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    private static String abbreviate(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= 500 ? trimmed : trimmed.substring(trimmed.length() - 500);
    }
}
