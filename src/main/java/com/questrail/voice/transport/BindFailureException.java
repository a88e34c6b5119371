package com.questrail.voice.transport;

/**
 * The transport endpoint could not be created. Fatal to server startup.
 */
public final class BindFailureException extends RuntimeException
{
    public BindFailureException(String message) {
        super(message);
    }

    public BindFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
