package com.travease.auth.repository.impl;

import com.travease.auth.exception.RepositoryException;
import com.travease.auth.model.User;
import com.travease.auth.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.time.Instant;
import java.util.Optional;

@Repository
public class UserRepositoryImpl implements UserRepository {

    private static final Logger logger = LoggerFactory.getLogger(UserRepositoryImpl.class);

    private final DynamoDbTable<User> userTable;

    public UserRepositoryImpl(DynamoDbTable<User> usersTable) {
        this.userTable = usersTable;
    }

    @Override
    public Optional<User> findByPhoneNumber(String phoneNumber) {
        try {
            return Optional.ofNullable(userTable.getItem(keyFor(phoneNumber)));
        } catch (DynamoDbException e) {
            logger.error("Failed to load user for phone number {}", phoneNumber, e);
            throw new RepositoryException("Failed to load user", e);
        }
    }

    @Override
    public User createOrUpdate(String phoneNumber, String otp, Instant otpExpires) {
        try {
            User user = userTable.getItem(keyFor(phoneNumber));
            if (user == null) {
                user = new User(phoneNumber);
                logger.info("Creating user {} for phone number {}", user.getId(), phoneNumber);
            }
            user.assignOtp(otp, otpExpires);
            userTable.putItem(user);
            return user;
        } catch (DynamoDbException e) {
            logger.error("Failed to store OTP for phone number {}", phoneNumber, e);
            throw new RepositoryException("Failed to store OTP", e);
        }
    }

    @Override
    public void clearOtp(String phoneNumber) {
        try {
            User user = userTable.getItem(keyFor(phoneNumber));
            if (user == null) {
                return;
            }
            user.clearOtp();
            userTable.putItem(user);
        } catch (DynamoDbException e) {
            logger.error("Failed to clear OTP for phone number {}", phoneNumber, e);
            throw new RepositoryException("Failed to clear OTP", e);
        }
    }

    private Key keyFor(String phoneNumber) {
        return Key.builder()
                .partitionValue(phoneNumber)
                .build();
    }
}
