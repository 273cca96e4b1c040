package com.travease.auth.service;

/**
 * Outbound SMS boundary used to deliver one-time passwords.
 * <p>
 * At most one implementation is registered, chosen by {@code travease.sms.provider}
 * (see {@link com.travease.auth.config.SmsNotifierConfig}). When none is registered the
 * issuing side falls back to returning the code in development mode.
 */
public interface SmsNotifier {

    /**
     * Sends a text message.
     *
     * @param toPhoneNumber recipient in E.164 format
     * @param message the message body
     * @throws com.travease.auth.exception.OtpDeliveryException if the provider does not accept the message
     */
    void send(String toPhoneNumber, String message);
}
