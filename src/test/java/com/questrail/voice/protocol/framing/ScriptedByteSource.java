package com.questrail.voice.protocol.framing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Test source that delivers a fixed script of chunks, one chunk (or the part
 * of it that fits) per read, then reports end of stream.
 */
public final class ScriptedByteSource implements ByteSource
{
    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private int reads;

    public static ScriptedByteSource of(String... chunks)
    {
        ScriptedByteSource source = new ScriptedByteSource();
        for (String chunk : chunks) {
            source.chunks.add(chunk.getBytes(StandardCharsets.UTF_8));
        }
        return source;
    }

    /** One byte per read. */
    public static ScriptedByteSource byteAtATime(byte[] data)
    {
        ScriptedByteSource source = new ScriptedByteSource();
        for (byte b : data) {
            source.chunks.add(new byte[] { b });
        }
        return source;
    }

    @Override
    public int read(byte[] dst, int off, int len)
    {
        reads++;
        byte[] next = chunks.poll();
        if (next == null) {
            return -1;
        }
        int n = Math.min(len, next.length);
        System.arraycopy(next, 0, dst, off, n);
        if (n < next.length) {
            byte[] rest = new byte[next.length - n];
            System.arraycopy(next, n, rest, 0, rest.length);
            chunks.addFirst(rest);
        }
        return n;
    }

    public int reads()
    {
        return reads;
    }
}
