package com.travease.auth.util;

import com.travease.auth.config.AuthProperties;
import com.travease.auth.exception.OtpValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes user-entered phone numbers into the {@code +<digits>} key the user table is
 * indexed by. Every non-digit is dropped, and the default country code is prepended unless the
 * digits already start with it. Issue and verify must both go through this class so the same
 * number always yields the same key. Input without a single digit is rejected.
 */
@Component
public class PhoneNumberNormalizer {

    private final String defaultCountryCode;

    @Autowired
    public PhoneNumberNormalizer(AuthProperties authProperties) {
        this(authProperties.getDefaultCountryCode());
    }

    public PhoneNumberNormalizer(String defaultCountryCode) {
        this.defaultCountryCode = defaultCountryCode.replaceAll("\\D", "");
    }

    public String normalize(String rawPhoneNumber) {
        String digits = rawPhoneNumber.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            throw new OtpValidationException("Please enter a valid phone number");
        }
        if (!digits.startsWith(defaultCountryCode)) {
            return "+" + defaultCountryCode + digits;
        }
        return "+" + digits;
    }
}
