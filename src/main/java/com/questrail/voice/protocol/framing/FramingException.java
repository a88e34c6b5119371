package com.questrail.voice.protocol.framing;

/**
 * Base type for stream framing violations.
 *
 * <p>A framing violation is fatal to the connection it occurred on and to
 * nothing else. No frame is delivered for the offending bytes.</p>
 */
public class FramingException extends Exception
{
    public FramingException(String message)
    {
        super(message);
    }
}
