package com.meshnet.linkwatch.exception;

import lombok.Getter;

/**
 * No endpoint owns the given address.
 */
@Getter
public class AddressNotFoundException extends RuntimeException {

    private final String address;

    public AddressNotFoundException(String address) {
        super("No endpoint found for address " + address);
        this.address = address;
    }
}
