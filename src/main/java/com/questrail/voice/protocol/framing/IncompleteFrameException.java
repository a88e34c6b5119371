package com.questrail.voice.protocol.framing;

/**
 * The peer closed the stream while a partial frame was still buffered.
 */
public final class IncompleteFrameException extends FramingException
{
    private final int abandonedBytes;

    public IncompleteFrameException(int abandonedBytes)
    {
        super("incomplete frame: stream closed with " + abandonedBytes + " unterminated bytes");
        this.abandonedBytes = abandonedBytes;
    }

    public int abandonedBytes()
    {
        return abandonedBytes;
    }
}
