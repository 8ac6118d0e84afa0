package com.example.mongoprofile.config;

/**
 * Raised before any document is read when a profiling option is out of range, malformed or conflicting.
 */
public class InvalidOptionException extends IllegalArgumentException
{
    private final String option;

    public InvalidOptionException(String option, String message)
    {
        super("Invalid option '" + option + "': " + message);
        this.option = option;
    }

    public InvalidOptionException(String option, String message, Throwable cause)
    {
        super("Invalid option '" + option + "': " + message, cause);
        this.option = option;
    }

    /**
     * Name of the offending option, e.g. {@code requiredThreshold} or {@code regexRules.date}
     */
    public String getOption()
    {
        return option;
    }
}
