package com.meshnet.linkwatch.exception;

/**
 * The topology document could not be retrieved (unreachable, timed out, unreadable).
 */
public class TopologyFetchException extends RuntimeException {

    public TopologyFetchException(String message) {
        super(message);
    }

    public TopologyFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
