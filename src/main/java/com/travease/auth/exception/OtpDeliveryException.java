package com.travease.auth.exception;

/**
 * Thrown by an {@link com.travease.auth.service.SmsNotifier} when the SMS provider rejects or
 * fails to accept a message.
 */
public class OtpDeliveryException extends RuntimeException {

    public OtpDeliveryException(String message) {
        super(message);
    }

    public OtpDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
