package com.travease.auth.service;

import com.travease.auth.exception.OtpDeliveryException;
import com.twilio.Twilio;
import com.twilio.exception.ApiException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Twilio Programmable Messaging implementation of {@link SmsNotifier}.
 * <p>
 * Sends from a single configured Twilio number. Code generation and expiry stay local;
 * Twilio only carries the text.
 * <p>
 * Note: Bean is created by {@link com.travease.auth.config.SmsNotifierConfig}
 */
public class TwilioSmsNotifier implements SmsNotifier {

    private static final Logger logger = LoggerFactory.getLogger(TwilioSmsNotifier.class);

    private final String fromPhoneNumber;

    public TwilioSmsNotifier(String accountSid, String authToken, String fromPhoneNumber) {
        this.fromPhoneNumber = fromPhoneNumber;
        Twilio.init(accountSid, authToken);
        logger.info("Twilio client initialized for sender {}", fromPhoneNumber);
    }

    @Override
    public void send(String toPhoneNumber, String message) {
        try {
            Message sent = Message.creator(
                            new PhoneNumber(toPhoneNumber),
                            new PhoneNumber(fromPhoneNumber),
                            message)
                    .create();
            logger.info("SMS sent to {} via Twilio: SID {}, status {}",
                       toPhoneNumber, sent.getSid(), sent.getStatus());
        } catch (ApiException e) {
            logger.error("Twilio rejected SMS to {}: {} (code: {})",
                        toPhoneNumber, e.getMessage(), e.getCode(), e);
            throw new OtpDeliveryException("Failed to send SMS via Twilio: " + e.getMessage(), e);
        } catch (Exception e) {
            logger.error("Unexpected error sending SMS to {} via Twilio: {}",
                        toPhoneNumber, e.getMessage(), e);
            throw new OtpDeliveryException("Failed to send SMS via Twilio", e);
        }
    }
}
