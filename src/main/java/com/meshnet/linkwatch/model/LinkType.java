package com.meshnet.linkwatch.model;

public enum LinkType {
    RADIO,
    ETHERNET,
    VIRTUAL
}
