package com.travease.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Settings for phone number sign-in.
 * <p>
 * {@code developmentMode} is an explicit switch rather than a check on the active profile or
 * environment name. When it is on, an OTP that could not be delivered by SMS is returned in the
 * send-otp response and 500 responses carry the exception message. It must be off in production.
 */
@ConfigurationProperties(prefix = "travease.auth")
public class AuthProperties {

    private boolean developmentMode = false;

    /** Country calling code prepended to numbers entered without one (India). */
    private String defaultCountryCode = "91";

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration otpTtl = Duration.ofMinutes(10);

    @DurationUnit(ChronoUnit.DAYS)
    private Duration sessionTokenTtl = Duration.ofDays(7);

    public boolean isDevelopmentMode() {
        return developmentMode;
    }

    public void setDevelopmentMode(boolean developmentMode) {
        this.developmentMode = developmentMode;
    }

    public String getDefaultCountryCode() {
        return defaultCountryCode;
    }

    public void setDefaultCountryCode(String defaultCountryCode) {
        this.defaultCountryCode = defaultCountryCode;
    }

    public Duration getOtpTtl() {
        return otpTtl;
    }

    public void setOtpTtl(Duration otpTtl) {
        this.otpTtl = otpTtl;
    }

    public Duration getSessionTokenTtl() {
        return sessionTokenTtl;
    }

    public void setSessionTokenTtl(Duration sessionTokenTtl) {
        this.sessionTokenTtl = sessionTokenTtl;
    }
}
