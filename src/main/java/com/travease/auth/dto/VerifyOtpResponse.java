package com.travease.auth.dto;

public class VerifyOtpResponse {

    private final boolean success = true;
    private final String message;
    private final String token;

    public VerifyOtpResponse(String message, String token) {
        this.message = message;
        this.token = token;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public String getToken() {
        return token;
    }
}
