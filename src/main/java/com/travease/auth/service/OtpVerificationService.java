package com.travease.auth.service;

import com.travease.auth.exception.InvalidCodeException;
import com.travease.auth.exception.NoOtpOutstandingException;
import com.travease.auth.exception.OtpExpiredException;
import com.travease.auth.exception.OtpValidationException;
import com.travease.auth.exception.PhoneNumberNotFoundException;
import com.travease.auth.model.User;
import com.travease.auth.repository.UserRepository;
import com.travease.auth.util.PhoneNumberNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Checks a submitted OTP and, on a match, consumes it and mints a session token.
 * <p>
 * Attempts are not counted or throttled: a wrong or expired code leaves the stored code in
 * place, and only a successful verification or a new issue replaces it.
 */
@Service
public class OtpVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(OtpVerificationService.class);
    private static final Pattern OTP_FORMAT = Pattern.compile("^\\d{6}$");

    private final UserRepository userRepository;
    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final JwtService jwtService;
    private final MeterRegistry meterRegistry;

    public OtpVerificationService(UserRepository userRepository,
                                  PhoneNumberNormalizer phoneNumberNormalizer,
                                  JwtService jwtService,
                                  MeterRegistry meterRegistry) {
        this.userRepository = userRepository;
        this.phoneNumberNormalizer = phoneNumberNormalizer;
        this.jwtService = jwtService;
        this.meterRegistry = meterRegistry;
    }

    public VerifiedSession verifyOtp(String rawPhoneNumber, String submittedOtp) {
        if (rawPhoneNumber == null || rawPhoneNumber.isBlank()) {
            throw new OtpValidationException("Phone number is required");
        }
        if (submittedOtp == null || submittedOtp.isBlank()) {
            throw new OtpValidationException("OTP is required");
        }

        String cleanOtp = submittedOtp.trim();
        if (!OTP_FORMAT.matcher(cleanOtp).matches()) {
            count("invalid_format");
            throw new OtpValidationException("Please enter a valid 6-digit OTP");
        }

        String phoneNumber = phoneNumberNormalizer.normalize(rawPhoneNumber);
        User user = userRepository.findByPhoneNumber(phoneNumber)
                .orElseThrow(() -> {
                    logger.info("No user found for phone number: {}", phoneNumber);
                    count("unknown_number");
                    return new PhoneNumberNotFoundException("User not found");
                });

        if (!user.hasOutstandingOtp()) {
            logger.info("No outstanding OTP for user {}", user.getId());
            count("no_otp");
            throw new NoOtpOutstandingException("No OTP found. Please request a new OTP");
        }

        // Expired codes are left in place; the next issue overwrites them.
        if (user.getOtpExpires() != null && user.getOtpExpires().isBefore(Instant.now())) {
            logger.info("OTP expired for user {} at {}", user.getId(), user.getOtpExpires());
            count("expired");
            throw new OtpExpiredException("OTP has expired. Please request a new OTP");
        }

        if (!user.getOtp().trim().equals(cleanOtp)) {
            logger.info("Invalid OTP submitted for user {}", user.getId());
            count("invalid_code");
            throw new InvalidCodeException("Invalid OTP. Please try again");
        }

        userRepository.clearOtp(phoneNumber);
        logger.info("OTP consumed for user {}", user.getId());

        String token = jwtService.generateSessionToken(user.getId(), phoneNumber);
        count("success");
        return new VerifiedSession(token, user.getId(), phoneNumber);
    }

    private void count(String result) {
        meterRegistry.counter("otp_verification", "result", result).increment();
    }
}
