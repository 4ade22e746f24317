package com.meshnet.linkwatch.model;

import java.util.Objects;

/**
 * Two endpoints resolved from a pair of addresses, in the order they were given.
 */
public record EndpointPair(Endpoint a, Endpoint b) {

    public EndpointPair {
        Objects.requireNonNull(a, "endpoint a");
        Objects.requireNonNull(b, "endpoint b");
    }

    public EndpointPair reversed() {
        return new EndpointPair(b, a);
    }

    /**
     * Key identifying the unordered pair: the two ids sorted and joined.
     */
    public String key() {
        return pairKey(a.getId(), b.getId());
    }

    public static String pairKey(String idA, String idB) {
        if (idA == null || idB == null) {
            return null;
        }
        return idA.compareTo(idB) <= 0 ? idA + "|" + idB : idB + "|" + idA;
    }
}
