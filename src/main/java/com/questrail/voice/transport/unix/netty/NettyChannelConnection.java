package com.questrail.voice.transport.unix.netty;

import com.questrail.voice.protocol.framing.ByteSource;
import com.questrail.voice.transport.CommandConnection;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * NettyChannelConnection
 * =============================================================================
 * Bridges one Netty child channel to the pull-based {@link CommandConnection}
 * port.
 *
 * <h2>Flow control</h2>
 * The channel runs with auto-read disabled. A read is requested from the event
 * loop only when the consuming thread has drained everything delivered so far,
 * so at most a few chunks are ever buffered per connection and a slow reader
 * pushes back on the peer through the socket buffer.
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>Inbound callbacks run on the channel's event loop and never block.</li>
 *   <li>{@link ByteSource#read} runs on the connection's dispatcher thread and
 *       blocks on a hand-off queue; interruption aborts it with an
 *       {@link InterruptedIOException}.</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Inbound {@link ByteBuf}s are copied into {@code byte[]} and released on the
 * event loop. No Netty type escapes this package.
 */
final class NettyChannelConnection implements CommandConnection
{
    private static final byte[] END_OF_STREAM = new byte[0];

    private final String id;
    private final Channel channel;
    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final Source source = new Source();

    NettyChannelConnection(String id, Channel channel)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public ByteSource source()
    {
        return source;
    }

    @Override
    public void close()
    {
        channel.close();
    }

    /** Pipeline handler feeding this connection. */
    ChannelInboundHandlerAdapter inboundHandler()
    {
        return new InboundHandler();
    }

    /**
     * Reader-side state. Only the dispatcher thread touches it.
     */
    private final class Source implements ByteSource
    {
        private byte[] chunk;
        private int chunkOffset;
        private boolean ended;

        @Override
        public int read(byte[] dst, int off, int len) throws IOException
        {
            if (chunk == null || chunkOffset == chunk.length) {
                if (ended) {
                    return -1;
                }
                Object next = inbound.poll();
                if (next == null) {
                    channel.read();
                    next = take();
                }
                if (next instanceof Throwable failure) {
                    ended = true;
                    throw new IOException("connection " + id + " failed", failure);
                }
                chunk = (byte[]) next;
                chunkOffset = 0;
                if (chunk == END_OF_STREAM) {
                    ended = true;
                    return -1;
                }
            }
            int n = Math.min(len, chunk.length - chunkOffset);
            System.arraycopy(chunk, chunkOffset, dst, off, n);
            chunkOffset += n;
            return n;
        }

        private Object take() throws InterruptedIOException
        {
            try {
                return inbound.take();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                InterruptedIOException interrupted = new InterruptedIOException("read on " + id + " interrupted");
                interrupted.initCause(e);
                throw interrupted;
            }
        }
    }

    private final class InboundHandler extends ChannelInboundHandlerAdapter
    {
        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            ByteBuf content = (ByteBuf) msg;
            try {
                if (content.isReadable()) {
                    byte[] bytes = new byte[content.readableBytes()];
                    content.getBytes(content.readerIndex(), bytes);
                    inbound.offer(bytes);
                }
                else {
                    // Nothing usable arrived; ask again so the reader is not left waiting.
                    ctx.read();
                }
            }
            finally {
                content.release();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            inbound.offer(END_OF_STREAM);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            inbound.offer(cause);
            ctx.close();
        }
    }
}
