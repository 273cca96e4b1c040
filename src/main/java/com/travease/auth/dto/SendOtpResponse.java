package com.travease.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Response DTO for send-otp. {@code development} is only present on the development fallback.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendOtpResponse {

    private final boolean success = true;
    private final String message;
    private final DevelopmentOtp development;

    public SendOtpResponse(String message, DevelopmentOtp development) {
        this.message = message;
        this.development = development;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public DevelopmentOtp getDevelopment() {
        return development;
    }

    public static class DevelopmentOtp {
        private final String otp;
        private final Instant expiresAt;

        public DevelopmentOtp(String otp, Instant expiresAt) {
            this.otp = otp;
            this.expiresAt = expiresAt;
        }

        public String getOtp() {
            return otp;
        }

        public Instant getExpiresAt() {
            return expiresAt;
        }
    }
}
