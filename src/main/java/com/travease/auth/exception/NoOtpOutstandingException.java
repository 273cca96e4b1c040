package com.travease.auth.exception;

/**
 * Thrown when the user exists but has no outstanding OTP, either because none was requested
 * since the last successful sign-in or because the code was already consumed.
 */
public class NoOtpOutstandingException extends RuntimeException {
    public NoOtpOutstandingException(String message) {
        super(message);
    }
}
