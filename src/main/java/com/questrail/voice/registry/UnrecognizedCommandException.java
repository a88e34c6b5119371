package com.questrail.voice.registry;

/**
 * A command line matched none of the registered patterns.
 *
 * <p>Never fatal: the line is dropped and processing continues.</p>
 */
public final class UnrecognizedCommandException extends Exception
{
    private final String text;

    public UnrecognizedCommandException(String text, String reason) {
        super(reason);
        this.text = text;
    }

    public UnrecognizedCommandException(String text, String reason, Throwable cause) {
        super(reason, cause);
        this.text = text;
    }

    public String text() {
        return text;
    }
}
