package com.travease.auth.service;

/**
 * A consumed OTP and the session token minted for it.
 */
public class VerifiedSession {

    private final String token;
    private final String userId;
    private final String phoneNumber;

    public VerifiedSession(String token, String userId, String phoneNumber) {
        this.token = token;
        this.userId = userId;
        this.phoneNumber = phoneNumber;
    }

    public String getToken() {
        return token;
    }

    public String getUserId() {
        return userId;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }
}
