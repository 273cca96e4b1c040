package com.travease.auth.exception;

/**
 * Exception thrown when a submitted OTP does not match the outstanding code.
 * The outstanding code stays valid, so the user may try again until it expires.
 */
public class InvalidCodeException extends RuntimeException {
    public InvalidCodeException(String message) {
        super(message);
    }
}
