package com.meshnet.linkwatch.exception;

import lombok.Getter;

/**
 * A link for the same endpoint pair already exists in the same topology source.
 */
@Getter
public class DuplicateLinkException extends RuntimeException {

    private final String topologySourceId;
    private final String endpointPairKey;

    public DuplicateLinkException(String topologySourceId, String endpointPairKey, Throwable cause) {
        super("Link " + endpointPairKey + " already exists in topology " + topologySourceId, cause);
        this.topologySourceId = topologySourceId;
        this.endpointPairKey = endpointPairKey;
    }
}
