package com.travease.auth.service;

import com.travease.auth.exception.OtpDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;
import software.amazon.awssdk.services.sns.model.SnsException;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * AWS SNS-based SMS delivery.
 * <p>
 * Numbers on the allowlist are never texted; the message is written to the log instead so
 * test accounts can sign in without a real handset.
 * <p>
 * Note: Bean is created by {@link com.travease.auth.config.SmsNotifierConfig}
 */
public class SnsSmsNotifier implements SmsNotifier {

    private static final Logger logger = LoggerFactory.getLogger(SnsSmsNotifier.class);

    private final SnsClient snsClient;
    private final List<String> allowlist;

    public SnsSmsNotifier(SnsClient snsClient, String allowlistString) {
        this.snsClient = snsClient;
        this.allowlist = allowlistString == null || allowlistString.isBlank() ?
            List.of() :
            Arrays.stream(allowlistString.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());

        logger.info("SNS SMS notifier initialized with allowlist: {}",
                   allowlist.isEmpty() ? "empty (production mode)" : allowlist.size() + " numbers");
    }

    @Override
    public void send(String toPhoneNumber, String message) {
        if (allowlist.contains(toPhoneNumber.trim())) {
            logger.info("[SMS Bypass] Message for {}: {}", toPhoneNumber, message);
            return;
        }

        try {
            Map<String, MessageAttributeValue> messageAttributes = new HashMap<>();
            messageAttributes.put("AWS.SNS.SMS.SMSType",
                MessageAttributeValue.builder()
                    .stringValue("Transactional")
                    .dataType("String")
                    .build());

            PublishRequest request = PublishRequest.builder()
                .phoneNumber(toPhoneNumber)
                .message(message)
                .messageAttributes(messageAttributes)
                .build();

            PublishResponse response = snsClient.publish(request);
            logger.info("SMS sent to {} with messageId: {}", toPhoneNumber, response.messageId());

        } catch (SnsException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Failed to send SMS to {}: {}", toPhoneNumber, detail, e);
            throw new OtpDeliveryException("Failed to send SMS via SNS", e);
        } catch (Exception e) {
            logger.error("Unexpected error sending SMS to {}: {}", toPhoneNumber, e.getMessage(), e);
            throw new OtpDeliveryException("Failed to send SMS via SNS", e);
        }
    }
}
