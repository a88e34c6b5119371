package com.questrail.voice.protocol.framing.impl;

import com.questrail.voice.protocol.framing.ByteSource;
import com.questrail.voice.protocol.framing.FrameReceiver;
import com.questrail.voice.protocol.framing.FrameTooLongException;
import com.questrail.voice.protocol.framing.FramingException;
import com.questrail.voice.protocol.framing.IncompleteFrameException;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * TerminatedFrameReceiver
 * -----------------------------------------------------------------------------
 * {@link FrameReceiver} for frames that end with a fixed terminator sequence,
 * e.g. {@code "\n"} for newline-delimited lines.
 *
 * <p>The receiver is hardened against hostile peers:</p>
 * <ul>
 *   <li>Buffered data is bounded by {@code maxFrameLength} plus one read.</li>
 *   <li>Bytes already proven free of the terminator are never searched again,
 *       so a peer dribbling one byte per read cannot force quadratic
 *       rescanning. Total search work is O(bytes received).</li>
 *   <li>Consumed frames are released by advancing a head offset; the live
 *       region is compacted at most once per read, keeping front-removal
 *       amortized O(1) per byte.</li>
 * </ul>
 *
 * <h2>Buffer layout</h2>
 * <pre>
 *   buf:  [ consumed | head ... tail | free ]
 *                      ^ nextFindIdx is relative to head
 * </pre>
 *
 * <p>Not thread-safe. One instance per stream.</p>
 */
public final class TerminatedFrameReceiver implements FrameReceiver
{
    /** Newline terminator used by the command wire protocol. */
    public static final byte[] NEWLINE = new byte[] { '\n' };

    public static final int DEFAULT_MAX_FRAME_LENGTH = 16384;

    /** Upper bound on a single read from the source. */
    public static final int DEFAULT_RECEIVE_SIZE = 4096;

    private final ByteSource source;
    private final byte[] terminator;
    private final int maxFrameLength;
    private final int receiveSize;

    private byte[] buf;
    private int head;
    private int tail;

    // Lowest offset (relative to head) at which the next search must start.
    private int nextFindIdx;

    private long comparisons;

    public TerminatedFrameReceiver(ByteSource source, byte[] terminator)
    {
        this(source, terminator, DEFAULT_MAX_FRAME_LENGTH, DEFAULT_RECEIVE_SIZE);
    }

    public TerminatedFrameReceiver(ByteSource source, byte[] terminator, int maxFrameLength, int receiveSize)
    {
        this.source = Objects.requireNonNull(source, "source");
        Objects.requireNonNull(terminator, "terminator");
        if (terminator.length == 0) {
            throw new IllegalArgumentException("terminator must not be empty");
        }
        if (maxFrameLength < 0) {
            throw new IllegalArgumentException("maxFrameLength must be >= 0");
        }
        if (receiveSize <= 0) {
            throw new IllegalArgumentException("receiveSize must be > 0");
        }
        this.terminator = terminator.clone();
        this.maxFrameLength = maxFrameLength;
        this.receiveSize = receiveSize;
        this.buf = new byte[Math.max(receiveSize, 64)];
    }

    @Override
    public Optional<byte[]> receive() throws IOException, FramingException
    {
        while (true) {
            final int terminatorIdx = find(nextFindIdx);

            if (terminatorIdx < 0) {
                final int buffered = tail - head;
                if (buffered > maxFrameLength) {
                    throw new FrameTooLongException(buffered, maxFrameLength);
                }

                // Resume where this search stopped; keep the last
                // (terminator.length - 1) bytes in range so a terminator
                // split across two reads is still found.
                nextFindIdx = Math.max(0, buffered - terminator.length + 1);

                if (!fill()) {
                    if (buffered > 0) {
                        throw new IncompleteFrameException(buffered);
                    }
                    return Optional.empty();
                }
            }
            else {
                final byte[] frame = Arrays.copyOfRange(buf, head, head + terminatorIdx);
                head += terminatorIdx + terminator.length;
                if (head == tail) {
                    head = 0;
                    tail = 0;
                }
                nextFindIdx = 0;
                return Optional.of(frame);
            }
        }
    }

    /**
     * Number of candidate positions examined by terminator searches so far.
     *
     * <p>Exposed so the linear-work bound can be observed.</p>
     */
    public long comparisons()
    {
        return comparisons;
    }

    /** Bytes received but not yet delivered as part of a frame. */
    public int buffered()
    {
        return tail - head;
    }

    private int find(int fromRelative)
    {
        final int last = tail - terminator.length;
        for (int i = head + fromRelative; i <= last; i++) {
            comparisons++;
            if (matchesAt(i)) {
                return i - head;
            }
        }
        return -1;
    }

    private boolean matchesAt(int index)
    {
        for (int j = 0; j < terminator.length; j++) {
            if (buf[index + j] != terminator[j]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reads one chunk from the source into the free region.
     *
     * @return false on orderly end of stream
     */
    private boolean fill() throws IOException
    {
        ensureFreeSpace(receiveSize);
        final int n = source.read(buf, tail, receiveSize);
        if (n <= 0) {
            return false;
        }
        tail += n;
        return true;
    }

    private void ensureFreeSpace(int wanted)
    {
        if (buf.length - tail >= wanted) {
            return;
        }
        final int live = tail - head;
        if (head > 0) {
            System.arraycopy(buf, head, buf, 0, live);
            head = 0;
            tail = live;
        }
        if (buf.length - tail < wanted) {
            buf = Arrays.copyOf(buf, Math.max(buf.length * 2, live + wanted));
        }
    }
}
