package com.questrail.logrelay.protocol;

/**
 * Indicates that an inbound text frame could not be turned into a
 * {@link com.questrail.logrelay.api.ClientCommand}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Text that is not JSON</li>
 *   <li>JSON that is not an object</li>
 *   <li>A missing or non-string {@code event} field</li>
 * </ul>
 */
public final class RelayDecodeException extends RuntimeException
{
    public RelayDecodeException(String message) {
        super(message);
    }

    public RelayDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
