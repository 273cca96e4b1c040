package com.travease.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for completing a phone number sign-in.
 * Clients may send {@code otp} as a JSON string or number; numbers are coerced to their text form.
 */
@Data
public class VerifyOtpRequest {

    @NotBlank(message = "Phone number is required")
    private String phoneNumber;

    @NotBlank(message = "OTP is required")
    private String otp;

    public VerifyOtpRequest() {}

    public VerifyOtpRequest(String phoneNumber, String otp) {
        this.phoneNumber = phoneNumber;
        this.otp = otp;
    }
}
