package com.travease.auth.util;

import com.travease.auth.config.AuthProperties;
import com.travease.auth.exception.OtpValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PhoneNumberNormalizer Tests")
class PhoneNumberNormalizerTest {

    private final PhoneNumberNormalizer normalizer = new PhoneNumberNormalizer("91");

    @Test
    void normalize_LocalAndInternationalFormsOfSameNumber_YieldSameKey() {
        assertThat(normalizer.normalize("9876543210")).isEqualTo("+919876543210");
        assertThat(normalizer.normalize("+919876543210")).isEqualTo("+919876543210");
    }

    @ParameterizedTest
    @ValueSource(strings = {"98765 43210", "(987) 654-3210", "+91 98765-43210", "91.9876.543.210"})
    void normalize_StripsFormattingCharacters(String raw) {
        assertThat(normalizer.normalize(raw)).isEqualTo("+919876543210");
    }

    @Test
    void normalize_NumberAlreadyStartingWithCountryCodeDigits_IsNotPrefixedAgain() {
        // A local number that happens to begin with 91 is taken as already carrying the code
        assertThat(normalizer.normalize("9123456789")).isEqualTo("+9123456789");
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "+", "(---) ---", "phone"})
    void normalize_InputWithoutDigits_IsRejected(String raw) {
        assertThatThrownBy(() -> normalizer.normalize(raw))
                .isInstanceOf(OtpValidationException.class)
                .hasMessage("Please enter a valid phone number");
    }

    @Test
    void normalize_IsIdempotent() {
        String once = normalizer.normalize("98765 43210");

        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void normalize_WithUsCountryCode_KeepsE164NumberUnchanged() {
        PhoneNumberNormalizer us = new PhoneNumberNormalizer("1");

        assertThat(us.normalize("+15551234567")).isEqualTo("+15551234567");
        assertThat(us.normalize("555-123-4567")).isEqualTo("+15551234567");
    }

    @Test
    void constructor_ReadsCountryCodeFromAuthProperties() {
        AuthProperties properties = new AuthProperties();
        properties.setDefaultCountryCode("+44");

        PhoneNumberNormalizer uk = new PhoneNumberNormalizer(properties);

        assertThat(uk.normalize("7700 900123")).isEqualTo("+447700900123");
    }
}
