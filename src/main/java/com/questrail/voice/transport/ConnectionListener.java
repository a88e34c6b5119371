package com.questrail.voice.transport;

/**
 * ConnectionListener
 * -----------------------------------------------------------------------------
 * Port for a local stream endpoint that accepts command connections.
 *
 * <p>Implementations must hand every accepted connection to the handler
 * independently, so that a misbehaving connection never delays acceptance of
 * new ones or the processing of others.</p>
 */
public interface ConnectionListener
{
    /**
     * Bind the endpoint and begin accepting connections.
     *
     * @throws BindFailureException if the endpoint cannot be created
     */
    void start(ConnectionHandler handler);

    /**
     * Stop accepting, cancel all in-flight connection handling as a unit and
     * release the endpoint. Idempotent.
     */
    void stop();

    /**
     * Block until the listener has stopped.
     */
    void awaitTermination() throws InterruptedException;
}
