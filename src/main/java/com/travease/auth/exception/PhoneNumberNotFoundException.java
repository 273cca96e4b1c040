package com.travease.auth.exception;

/**
 * Thrown when an OTP is verified for a phone number that never requested one.
 */
public class PhoneNumberNotFoundException extends RuntimeException {
    public PhoneNumberNotFoundException(String message) {
        super(message);
    }
}
