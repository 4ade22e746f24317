package com.meshnet.linkwatch.exception;

public class LinkValidationException extends RuntimeException {

    public LinkValidationException(String message) {
        super(message);
    }
}
