package com.questrail.voice.transport.unix;

import com.questrail.voice.transport.BindFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class EndpointLockTest
{
    @TempDir
    Path dir;

    @Test
    void lockFileSitsNextToSocket()
    {
        assertEquals(dir.resolve("voice.sock.lock"), EndpointLock.lockPathFor(dir.resolve("voice.sock")));
    }

    @Test
    void secondAcquireFailsWhileHeld() throws Exception
    {
        Path socket = dir.resolve("voice.sock");
        try (EndpointLock held = EndpointLock.acquire(socket)) {
            assertTrue(Files.exists(held.path()));
            assertThrows(BindFailureException.class, () -> EndpointLock.acquire(socket));
        }
    }

    @Test
    void lockCanBeReacquiredAfterRelease() throws Exception
    {
        Path socket = dir.resolve("voice.sock");
        EndpointLock.acquire(socket).close();

        try (EndpointLock again = EndpointLock.acquire(socket)) {
            assertNotNull(again);
        }
    }

    @Test
    void differentSocketsDoNotContend() throws Exception
    {
        try (EndpointLock a = EndpointLock.acquire(dir.resolve("a.sock"));
             EndpointLock b = EndpointLock.acquire(dir.resolve("b.sock"))) {
            assertNotEquals(a.path(), b.path());
        }
    }

    @Test
    void unwritableDirectoryIsABindFailure()
    {
        assertThrows(BindFailureException.class,
                () -> EndpointLock.acquire(dir.resolve("missing").resolve("voice.sock")));
    }
}
