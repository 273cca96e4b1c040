package com.travease.auth.config;

import com.travease.auth.service.SmsNotifier;
import com.travease.auth.service.SnsSmsNotifier;
import com.travease.auth.service.TwilioSmsNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;

/**
 * Selects the SMS provider used to deliver one-time passwords.
 * <p>
 * Driven by {@code travease.sms.provider}:
 * - "none" (default): no {@link SmsNotifier} bean; codes are returned in the response in development mode
 * - "aws": AWS SNS
 * - "twilio": Twilio Programmable Messaging
 * <p>
 * Twilio credentials are read from AWS Parameter Store when a {@code *-parameter-name} property is
 * set, otherwise from the plain property (dev/test).
 */
@Configuration
public class SmsNotifierConfig {

    private static final Logger logger = LoggerFactory.getLogger(SmsNotifierConfig.class);

    @Value("${aws.region:ap-south-1}")
    private String awsRegion;

    @Bean
    @ConditionalOnProperty(name = "travease.sms.provider", havingValue = "aws")
    public SmsNotifier snsSmsNotifier(SnsClient snsClient,
                                      @Value("${travease.sms.allowlist:}") String allowlist) {
        logger.info("Configuring AWS SNS SMS notifier");
        return new SnsSmsNotifier(snsClient, allowlist);
    }

    @Bean
    @ConditionalOnProperty(name = "travease.sms.provider", havingValue = "twilio")
    public SmsNotifier twilioSmsNotifier(
            @Value("${twilio.account-sid-parameter-name:}") String accountSidParameterName,
            @Value("${twilio.account-sid:}") String accountSidDirect,
            @Value("${twilio.auth-token-parameter-name:}") String authTokenParameterName,
            @Value("${twilio.auth-token:}") String authTokenDirect,
            @Value("${twilio.from-number:}") String fromNumber) {

        logger.info("Configuring Twilio SMS notifier");

        String accountSid = resolve("Twilio account SID", accountSidParameterName, accountSidDirect);
        String authToken = resolve("Twilio auth token", authTokenParameterName, authTokenDirect);

        if (fromNumber.isEmpty()) {
            throw new IllegalStateException("twilio.from-number must be set when travease.sms.provider=twilio");
        }
        return new TwilioSmsNotifier(accountSid, authToken, fromNumber);
    }

    private String resolve(String description, String parameterName, String directValue) {
        if (parameterName != null && !parameterName.isEmpty()) {
            logger.info("Retrieving {} from Parameter Store: {}", description, parameterName);
            return retrieveFromParameterStore(parameterName);
        }
        logger.info("Using {} from configuration (dev/test mode)", description);
        return directValue;
    }

    /**
     * Retrieves a parameter value from AWS Systems Manager Parameter Store.
     */
    private String retrieveFromParameterStore(String parameterName) {
        try (SsmClient ssmClient = SsmClient.builder()
                .region(Region.of(awsRegion))
                .build()) {

            GetParameterRequest parameterRequest = GetParameterRequest.builder()
                    .name(parameterName)
                    .withDecryption(true)
                    .build();

            GetParameterResponse parameterResponse = ssmClient.getParameter(parameterRequest);
            logger.info("Successfully retrieved parameter from Parameter Store: {}", parameterName);
            return parameterResponse.parameter().value();

        } catch (Exception e) {
            logger.error("Failed to retrieve parameter from Parameter Store: {}", parameterName, e);
            throw new IllegalStateException("Failed to retrieve " + parameterName + " from Parameter Store", e);
        }
    }
}
