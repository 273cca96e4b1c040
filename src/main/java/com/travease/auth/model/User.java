package com.travease.auth.model;

import com.travease.auth.util.InstantAsLongAttributeConverter;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;
import java.util.UUID;

/**
 * A rider known by phone number. {@code otp} and {@code otpExpires} are set together while a
 * code is outstanding and cleared together once it is consumed.
 */
@Data
@NoArgsConstructor
@DynamoDbBean
public class User {
    private String id;
    private String phoneNumber;
    private String otp;
    private Instant otpExpires;
    private Instant creationDate;

    public User(String phoneNumber) {
        this.id = UUID.randomUUID().toString();
        this.phoneNumber = phoneNumber;
        this.creationDate = Instant.now();
    }

    @DynamoDbPartitionKey
    public String getPhoneNumber() {
        return phoneNumber;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getOtpExpires() {
        return otpExpires;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreationDate() {
        return creationDate;
    }

    public void assignOtp(String otp, Instant otpExpires) {
        this.otp = otp;
        this.otpExpires = otpExpires;
    }

    public void clearOtp() {
        this.otp = null;
        this.otpExpires = null;
    }

    public boolean hasOutstandingOtp() {
        return otp != null;
    }

    @Override
    public String toString() {
        return "User{" +
                "id='" + id + '\'' +
                ", phoneNumber='" + phoneNumber + '\'' +
                ", otp=" + (otp == null ? "null" : "'[REDACTED]'") +
                ", otpExpires=" + otpExpires +
                ", creationDate=" + creationDate +
                '}';
    }
}
