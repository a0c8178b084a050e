package com.ttennebkram.texturefix.cli;

/**
 * Walks command-line arguments. Accepts both {@code --name value} and
 * {@code --name=value}.
 */
class ArgumentReader {

    private final String[] args;
    private int index = 0;

    private String flag;
    private String inlineValue;

    ArgumentReader(String[] args) {
        this.args = args;
    }

    /**
     * Advance to the next flag.
     *
     * @return false when all arguments are consumed
     * @throws CommandLineException on a positional argument
     */
    boolean nextFlag() throws CommandLineException {
        if (index >= args.length) {
            return false;
        }
        String arg = args[index++].trim();
        if (!arg.startsWith("-")) {
            throw new CommandLineException("Unexpected argument: " + arg);
        }
        int eq = arg.indexOf('=');
        if (arg.startsWith("--") && eq > 0) {
            flag = arg.substring(0, eq);
            inlineValue = arg.substring(eq + 1);
        } else {
            flag = arg;
            inlineValue = null;
        }
        return true;
    }

    String flag() {
        return flag;
    }

    boolean is(String longName, String shortName) {
        return flag.equals(longName) || (shortName != null && flag.equals(shortName));
    }

    String stringValue() throws CommandLineException {
        if (inlineValue != null) {
            return inlineValue;
        }
        if (index >= args.length) {
            throw new CommandLineException("Missing value for " + flag);
        }
        return args[index++];
    }

    int intValue() throws CommandLineException {
        String value = stringValue();
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CommandLineException("Invalid integer for " + flag + ": " + value, e);
        }
    }

    double doubleValue() throws CommandLineException {
        String value = stringValue();
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new CommandLineException("Invalid number for " + flag + ": " + value, e);
        }
    }

    void rejectValue() throws CommandLineException {
        if (inlineValue != null) {
            throw new CommandLineException(flag + " does not take a value");
        }
    }
}
