package com.telefonchi.migrationcli.command;

/** The command line could not be understood. Reported with the usage text and exit code 2. */
public class CommandLineUsageException extends RuntimeException {

    public CommandLineUsageException(String message) {
        super(message);
    }
}
