package com.meshnet.linkwatch.model;

/**
 * Physical type of a network interface.
 */
public enum EndpointType {
    WIRELESS,
    ETHERNET,
    BRIDGE,
    VIRTUAL,
    OTHER;

    /**
     * Link type implied by a link whose first endpoint has this type.
     */
    public LinkType impliedLinkType() {
        return switch (this) {
            case WIRELESS -> LinkType.RADIO;
            case ETHERNET -> LinkType.ETHERNET;
            default -> LinkType.VIRTUAL;
        };
    }
}
