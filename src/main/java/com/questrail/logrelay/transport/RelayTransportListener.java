package com.questrail.logrelay.transport;

/**
 * RelayTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for a relay transport.
 *
 * <p>Callbacks for one endpoint are delivered serially and in order: one
 * {@link #onOpen}, any number of {@link #onText}, then at most one
 * {@link #onClose}. Callbacks for different endpoints may run concurrently.
 * Implementations must not block the calling thread.</p>
 */
public interface RelayTransportListener
{
    void onOpen(ClientEndpoint endpoint);

    /**
     * A complete text frame arrived.
     */
    void onText(ClientEndpoint endpoint, String frame);

    void onClose(ClientEndpoint endpoint);
}
