package com.travease.auth.service;

import java.time.Instant;

/**
 * Outcome of issuing an OTP. The plain code is only carried for {@link Status#DEVELOPMENT_FALLBACK}.
 */
public class OtpIssueResult {
    public enum Status {
        SENT,
        DEVELOPMENT_FALLBACK,
        UNDELIVERED
    }

    private final Status status;
    private final String phoneNumber;
    private final String code;
    private final Instant expiresAt;

    private OtpIssueResult(Status status, String phoneNumber, String code, Instant expiresAt) {
        this.status = status;
        this.phoneNumber = phoneNumber;
        this.code = code;
        this.expiresAt = expiresAt;
    }

    public static OtpIssueResult sent(String phoneNumber, Instant expiresAt) {
        return new OtpIssueResult(Status.SENT, phoneNumber, null, expiresAt);
    }

    public static OtpIssueResult developmentFallback(String phoneNumber, String code, Instant expiresAt) {
        return new OtpIssueResult(Status.DEVELOPMENT_FALLBACK, phoneNumber, code, expiresAt);
    }

    public static OtpIssueResult undelivered(String phoneNumber, Instant expiresAt) {
        return new OtpIssueResult(Status.UNDELIVERED, phoneNumber, null, expiresAt);
    }

    public Status getStatus() {
        return status;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getCode() {
        return code;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public String getMessage() {
        return status == Status.SENT ? "OTP sent successfully" : "OTP generated successfully";
    }

    public boolean exposesCode() {
        return status == Status.DEVELOPMENT_FALLBACK;
    }
}
