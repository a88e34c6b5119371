package com.questrail.voice.protocol.framing;

/**
 * More bytes accumulated without a terminator than the receiver allows.
 */
public final class FrameTooLongException extends FramingException
{
    private final int bufferedBytes;
    private final int maxFrameLength;

    public FrameTooLongException(int bufferedBytes, int maxFrameLength)
    {
        super("frame too long: " + bufferedBytes + " bytes buffered without terminator (limit " + maxFrameLength + ")");
        this.bufferedBytes = bufferedBytes;
        this.maxFrameLength = maxFrameLength;
    }

    public int bufferedBytes()
    {
        return bufferedBytes;
    }

    public int maxFrameLength()
    {
        return maxFrameLength;
    }
}
