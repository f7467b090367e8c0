package org.pylexer.cli.output;

/**
 * Output formats supported by the {@code tokenize} command.
 */
public enum OutputFormat {
    /** One aligned line per token or error. */
    TEXT,
    /** A JSON array with one object per token or error. */
    JSON
}
