package com.questrail.voice.transport.unix;

import com.questrail.voice.transport.BindFailureException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * EndpointLock
 * -----------------------------------------------------------------------------
 * Advisory lock serializing servers that share one socket path.
 *
 * <p>Removing a stale socket file and binding a new one is not atomic. Two
 * servers starting on the same path could each delete the other's endpoint.
 * Holding an exclusive lock on {@code <socket>.lock} for the server's lifetime
 * makes the second server fail fast instead. The lock file itself is left in
 * place on release; deleting it would reintroduce the race.</p>
 */
public final class EndpointLock implements AutoCloseable
{
    private final Path lockPath;
    private final FileChannel channel;
    private final FileLock lock;

    private EndpointLock(Path lockPath, FileChannel channel, FileLock lock)
    {
        this.lockPath = lockPath;
        this.channel = channel;
        this.lock = lock;
    }

    /** Lock file guarding {@code socketPath}. */
    public static Path lockPathFor(Path socketPath)
    {
        return socketPath.resolveSibling(socketPath.getFileName() + ".lock");
    }

    /**
     * @throws BindFailureException if another process or listener holds the lock,
     *         or the lock file cannot be created
     */
    public static EndpointLock acquire(Path socketPath)
    {
        Objects.requireNonNull(socketPath, "socketPath");
        Path lockPath = lockPathFor(socketPath);
        FileChannel channel;
        try {
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        }
        catch (IOException e) {
            throw new BindFailureException("cannot create lock file " + lockPath, e);
        }

        FileLock lock;
        try {
            lock = channel.tryLock();
        }
        catch (OverlappingFileLockException e) {
            // Held by another listener in this JVM.
            BindFailureException failure =
                    new BindFailureException("endpoint " + socketPath + " is in use by this process", e);
            closeAfterFailure(channel, failure);
            throw failure;
        }
        catch (IOException e) {
            BindFailureException failure = new BindFailureException("cannot lock " + lockPath, e);
            closeAfterFailure(channel, failure);
            throw failure;
        }

        if (lock == null) {
            BindFailureException failure =
                    new BindFailureException("endpoint " + socketPath + " is in use by another server");
            closeAfterFailure(channel, failure);
            throw failure;
        }
        return new EndpointLock(lockPath, channel, lock);
    }

    public Path path()
    {
        return lockPath;
    }

    @Override
    public void close() throws IOException
    {
        try {
            lock.release();
        }
        finally {
            channel.close();
        }
    }

    private static void closeAfterFailure(FileChannel channel, Exception primary)
    {
        try {
            channel.close();
        }
        catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
