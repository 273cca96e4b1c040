package com.travease.auth.service;

import com.travease.auth.config.AuthProperties;
import com.travease.auth.exception.OtpDeliveryException;
import com.travease.auth.exception.OtpValidationException;
import com.travease.auth.repository.UserRepository;
import com.travease.auth.util.PhoneNumberNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Generates one-time passwords and hands them to the SMS provider.
 * <p>
 * Every request replaces whatever code was outstanding for the number. Delivery failures are
 * fatal only when development mode is off. In development mode an undelivered code is returned
 * to the caller instead; outside it, a missing SMS provider leaves the code stored but unsent.
 */
@Service
public class OtpIssueService {

    private static final Logger logger = LoggerFactory.getLogger(OtpIssueService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final String MESSAGE_TEMPLATE = "Your Travease verification code is: %s. Valid for %d minutes.";

    private final UserRepository userRepository;
    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final Optional<SmsNotifier> smsNotifier;
    private final MeterRegistry meterRegistry;
    private final Duration otpTtl;
    private final boolean developmentMode;

    @Autowired
    public OtpIssueService(UserRepository userRepository,
                           PhoneNumberNormalizer phoneNumberNormalizer,
                           Optional<SmsNotifier> smsNotifier,
                           MeterRegistry meterRegistry,
                           AuthProperties authProperties) {
        this(userRepository, phoneNumberNormalizer, smsNotifier, meterRegistry,
             authProperties.getOtpTtl(), authProperties.isDevelopmentMode());
    }

    public OtpIssueService(UserRepository userRepository,
                           PhoneNumberNormalizer phoneNumberNormalizer,
                           Optional<SmsNotifier> smsNotifier,
                           MeterRegistry meterRegistry,
                           Duration otpTtl,
                           boolean developmentMode) {
        this.userRepository = userRepository;
        this.phoneNumberNormalizer = phoneNumberNormalizer;
        this.smsNotifier = smsNotifier;
        this.meterRegistry = meterRegistry;
        this.otpTtl = otpTtl;
        this.developmentMode = developmentMode;

        if (smsNotifier.isEmpty()) {
            logger.warn("No SMS provider configured; OTPs will {}",
                       developmentMode ? "be returned in the API response" : "not be delivered");
        }
    }

    public OtpIssueResult sendOtp(String rawPhoneNumber) {
        if (rawPhoneNumber == null || rawPhoneNumber.isBlank()) {
            throw new OtpValidationException("Phone number is required");
        }

        String phoneNumber = phoneNumberNormalizer.normalize(rawPhoneNumber);
        String otp = generateSixDigitCode();
        Instant expiresAt = Instant.now().plus(otpTtl);

        userRepository.createOrUpdate(phoneNumber, otp, expiresAt);
        logger.info("OTP stored for {}, expires at {}", phoneNumber, expiresAt);

        if (smsNotifier.isPresent()) {
            try {
                smsNotifier.get().send(phoneNumber, String.format(MESSAGE_TEMPLATE, otp, otpTtl.toMinutes()));
                count("sent");
                return OtpIssueResult.sent(phoneNumber, expiresAt);
            } catch (OtpDeliveryException e) {
                if (!developmentMode) {
                    count("delivery_failed");
                    throw e;
                }
                logger.warn("SMS delivery to {} failed, returning OTP in response (development mode)", phoneNumber);
            }
        }

        if (developmentMode) {
            logger.info("Returning OTP for {} in response (development mode)", phoneNumber);
            count("development_fallback");
            return OtpIssueResult.developmentFallback(phoneNumber, otp, expiresAt);
        }

        logger.warn("No SMS provider configured; OTP for {} was stored but not delivered", phoneNumber);
        count("undelivered");
        return OtpIssueResult.undelivered(phoneNumber, expiresAt);
    }

    /**
     * Generates a random 6-digit numeric code.
     *
     * @return a String containing exactly 6 digits (100000-999999)
     */
    private String generateSixDigitCode() {
        int code = SECURE_RANDOM.nextInt(900000) + 100000;
        return String.valueOf(code);
    }

    private void count(String outcome) {
        meterRegistry.counter("otp_issued", "outcome", outcome).increment();
    }
}
