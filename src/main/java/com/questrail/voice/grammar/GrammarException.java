package com.questrail.voice.grammar;

/**
 * Indicates that a rule expression or command pattern is malformed, or that
 * the assembled grammar is inconsistent (undefined or left-recursive rules).
 *
 * <p>Raised only while a grammar is being assembled, never while matching.</p>
 */
public class GrammarException extends RuntimeException
{
    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
