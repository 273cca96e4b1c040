package com.travease.auth.controller;

import com.travease.auth.dto.SendOtpRequest;
import com.travease.auth.dto.SendOtpResponse;
import com.travease.auth.dto.VerifyOtpRequest;
import com.travease.auth.dto.VerifyOtpResponse;
import com.travease.auth.service.OtpIssueResult;
import com.travease.auth.service.OtpIssueService;
import com.travease.auth.service.OtpVerificationService;
import com.travease.auth.service.VerifiedSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Phone number sign-in. Failures are rendered by
 * {@link com.travease.auth.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Phone number sign-in with one-time passwords")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final OtpIssueService otpIssueService;
    private final OtpVerificationService otpVerificationService;

    @PostMapping("/send-otp")
    @Operation(summary = "Send a one-time password",
               description = "Generates a 6-digit code valid for 10 minutes and texts it to the phone number.")
    public ResponseEntity<SendOtpResponse> sendOtp(@Valid @RequestBody SendOtpRequest request) {
        logger.info("OTP requested for phone number: {}", request.getPhoneNumber());

        OtpIssueResult result = otpIssueService.sendOtp(request.getPhoneNumber());

        SendOtpResponse.DevelopmentOtp development = result.exposesCode()
                ? new SendOtpResponse.DevelopmentOtp(result.getCode(), result.getExpiresAt())
                : null;
        return new ResponseEntity<>(new SendOtpResponse(result.getMessage(), development), HttpStatus.OK);
    }

    @PostMapping("/verify-otp")
    @Operation(summary = "Verify a one-time password",
               description = "Consumes the outstanding code and returns a session token valid for 7 days.")
    public ResponseEntity<VerifyOtpResponse> verifyOtp(@Valid @RequestBody VerifyOtpRequest request) {
        VerifiedSession session = otpVerificationService.verifyOtp(request.getPhoneNumber(), request.getOtp());
        return new ResponseEntity<>(new VerifyOtpResponse("OTP verified successfully", session.getToken()), HttpStatus.OK);
    }
}
