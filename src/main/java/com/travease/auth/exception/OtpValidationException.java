package com.travease.auth.exception;

/**
 * Thrown when a send-otp or verify-otp request is missing a field or carries a malformed code.
 */
public class OtpValidationException extends RuntimeException {
    public OtpValidationException(String message) {
        super(message);
    }
}
