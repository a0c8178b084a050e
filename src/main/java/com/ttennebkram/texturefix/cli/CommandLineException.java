package com.ttennebkram.texturefix.cli;

/**
 * Bad command line: unknown flag, missing value or value of the wrong type.
 */
public class CommandLineException extends Exception {

    public CommandLineException(String message) {
        super(message);
    }

    public CommandLineException(String message, Throwable cause) {
        super(message, cause);
    }
}
