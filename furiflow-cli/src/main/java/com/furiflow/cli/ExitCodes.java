package com.furiflow.cli;

/**
 * Process exit codes shared by the commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int NO_ENTRY_POINT = 2;
    public static final int VALIDATION_FAILED = 3;

    private ExitCodes() {
    }
}
