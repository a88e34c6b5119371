package com.questrail.voice.protocol.framing;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Adapts a blocking {@link InputStream} to the {@link ByteSource} port.
 */
public final class InputStreamByteSource implements ByteSource
{
    private final InputStream in;

    public InputStreamByteSource(InputStream in)
    {
        this.in = Objects.requireNonNull(in, "in");
    }

    @Override
    public int read(byte[] dst, int off, int len) throws IOException
    {
        return in.read(dst, off, len);
    }
}
