package com.questrail.logrelay.transport;

/**
 * ClientEndpoint
 * -----------------------------------------------------------------------------
 * One live client connection as seen from above the transport boundary.
 *
 * <p>{@link #sendText(String)} may be called from any thread. Implementations
 * must tolerate sends after the connection closed by dropping them.</p>
 */
public interface ClientEndpoint
{
    /** Stable, unique identifier for the lifetime of the connection. */
    String id();

    /** Identifier of the requesting origin, used for admission control. */
    String origin();

    /** Queue one complete text frame for the client. */
    void sendText(String frame);

    boolean isOpen();

    /** Close the connection. Idempotent. */
    void close();
}
