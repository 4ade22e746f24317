package com.meshnet.linkwatch.exception;

/**
 * The topology document is not a valid NetJSON network graph.
 */
public class TopologyDecodeException extends RuntimeException {

    public TopologyDecodeException(String message) {
        super(message);
    }

    public TopologyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
