package com.codepartition.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;
    public static final int CONFIGURATION_ERROR = 2;

    private ExitCodes() {
    }
}
