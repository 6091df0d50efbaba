package com.newsintel.alcalor.cli;

/**
 * Bad command line. The runner prints usage and exits with code 2.
 */
public class CliUsageException extends Exception {

    public CliUsageException(String message) {
        super(message);
    }
}
