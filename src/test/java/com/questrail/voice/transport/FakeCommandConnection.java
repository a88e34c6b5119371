package com.questrail.voice.transport;

import com.questrail.voice.protocol.framing.ByteSource;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory connection for dispatcher tests. The test thread writes chunks
 * and ends the stream; the dispatcher thread reads them.
 */
public final class FakeCommandConnection implements CommandConnection
{
    private static final byte[] END = new byte[0];

    private final String id;
    private final BlockingQueue<Object> chunks = new LinkedBlockingQueue<>();
    private final CountDownLatch closed = new CountDownLatch(1);

    public FakeCommandConnection(String id)
    {
        this.id = id;
    }

    public FakeCommandConnection write(String text)
    {
        chunks.add(text.getBytes(StandardCharsets.UTF_8));
        return this;
    }

    public FakeCommandConnection write(byte[] bytes)
    {
        chunks.add(bytes.clone());
        return this;
    }

    public FakeCommandConnection endOfStream()
    {
        chunks.add(END);
        return this;
    }

    /** Make the next read fail as a broken transport would. */
    public FakeCommandConnection fail(IOException failure)
    {
        chunks.add(failure);
        return this;
    }

    public boolean awaitClosed(long timeout, TimeUnit unit) throws InterruptedException
    {
        return closed.await(timeout, unit);
    }

    public boolean isClosed()
    {
        return closed.getCount() == 0;
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public ByteSource source()
    {
        return (dst, off, len) -> {
            Object next;
            try {
                next = chunks.take();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("read interrupted");
            }
            if (next instanceof IOException failure) {
                throw failure;
            }
            byte[] chunk = (byte[]) next;
            if (chunk == END) {
                chunks.add(END);
                return -1;
            }
            // Chunks are written small enough to fit one read.
            System.arraycopy(chunk, 0, dst, off, Math.min(len, chunk.length));
            return Math.min(len, chunk.length);
        };
    }

    @Override
    public void close()
    {
        closed.countDown();
    }
}
