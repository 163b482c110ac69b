package com.questrail.logrelay.fetch;

/**
 * Classification of a failed retrieval attempt.
 */
public enum FetchFailureKind
{
    /** The remote answered with a non-2xx status. */
    HTTP_STATUS,

    /** No complete answer within the configured timeout. */
    TIMEOUT,

    /** The remote could not be reached or the connection broke. */
    CONNECTION,

    UNKNOWN
}
