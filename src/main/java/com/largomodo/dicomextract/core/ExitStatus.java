package com.largomodo.dicomextract.core;

/**
 * Terminal status of a run, mapped to process exit codes by the CLI.
 * <p>
 * Codes 1 (general error) and 2 (invalid arguments) are owned by the command-line layer.
 */
public enum ExitStatus {
    SUCCESS(0),
    NO_QUALIFYING_RECORDS(3),
    ARCHIVE_UNREADABLE(4);

    private final int exitCode;

    ExitStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
