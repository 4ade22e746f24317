package com.meshnet.linkwatch.model;

/**
 * Lifecycle state of a link.
 * DOWN is reserved for monitoring and behaves like any other non-planned state.
 */
public enum LinkStatus {
    PLANNED,
    ACTIVE,
    DISCONNECTED,
    DOWN
}
