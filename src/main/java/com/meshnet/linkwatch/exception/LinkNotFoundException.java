package com.meshnet.linkwatch.exception;

import com.meshnet.linkwatch.model.EndpointPair;
import lombok.Getter;

/**
 * Both endpoints were resolved but no link connects them.
 * Carries the resolved pair so callers can create the link.
 */
@Getter
public class LinkNotFoundException extends RuntimeException {

    private final EndpointPair endpoints;

    public LinkNotFoundException(EndpointPair endpoints) {
        super("Link matching endpoints " + endpoints.a().getId() + " and " + endpoints.b().getId()
                + " does not exist");
        this.endpoints = endpoints;
    }
}
