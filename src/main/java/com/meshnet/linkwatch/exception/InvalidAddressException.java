package com.meshnet.linkwatch.exception;

/**
 * Raised when a string is not a valid IPv4, IPv6 or MAC address, or when two
 * addresses of a pair are of different kinds.
 */
public class InvalidAddressException extends RuntimeException {

    public InvalidAddressException(String message) {
        super(message);
    }
}
