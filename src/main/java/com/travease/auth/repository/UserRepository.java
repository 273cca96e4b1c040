package com.travease.auth.repository;

import com.travease.auth.model.User;

import java.time.Instant;
import java.util.Optional;

/**
 * User records keyed by normalized phone number.
 * <p>
 * Writes are plain last-write-wins puts. Two concurrent {@link #createOrUpdate} calls for the
 * same number both succeed and whichever lands second decides the outstanding code.
 */
public interface UserRepository {

    Optional<User> findByPhoneNumber(String phoneNumber);

    /**
     * Stores an outstanding OTP for the number, creating the user with a fresh id if none exists.
     * Any code previously outstanding for the number is overwritten.
     *
     * @return the stored user
     */
    User createOrUpdate(String phoneNumber, String otp, Instant otpExpires);

    /**
     * Removes the outstanding OTP, if any. Does nothing for an unknown number.
     */
    void clearOtp(String phoneNumber);
}
