package com.travease.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for starting a phone number sign-in.
 */
@Data
public class SendOtpRequest {

    @NotBlank(message = "Phone number is required")
    private String phoneNumber;

    public SendOtpRequest() {}

    public SendOtpRequest(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }
}
