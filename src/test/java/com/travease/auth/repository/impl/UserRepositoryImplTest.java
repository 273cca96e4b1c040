package com.travease.auth.repository.impl;

import com.travease.auth.exception.RepositoryException;
import com.travease.auth.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserRepositoryImplTest {

    private static final String PHONE = "+919876543210";

    @Mock
    private DynamoDbTable<User> mockUserTable;

    private UserRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository = new UserRepositoryImpl(mockUserTable);
    }

    @Test
    void findByPhoneNumber_ExistingUser_LooksUpByPartitionKey() {
        User user = new User(PHONE);
        ArgumentCaptor<Key> keyCaptor = ArgumentCaptor.forClass(Key.class);
        when(mockUserTable.getItem(any(Key.class))).thenReturn(user);

        Optional<User> result = repository.findByPhoneNumber(PHONE);

        assertThat(result).containsSame(user);
        verify(mockUserTable).getItem(keyCaptor.capture());
        assertThat(keyCaptor.getValue().partitionKeyValue().s()).isEqualTo(PHONE);
    }

    @Test
    void findByPhoneNumber_UnknownNumber_ReturnsEmpty() {
        when(mockUserTable.getItem(any(Key.class))).thenReturn(null);

        assertThat(repository.findByPhoneNumber(PHONE)).isEmpty();
    }

    @Test
    void createOrUpdate_NewNumber_CreatesUserWithIdAndOtp() {
        Instant expires = Instant.now().plusSeconds(600);
        when(mockUserTable.getItem(any(Key.class))).thenReturn(null);
        ArgumentCaptor<User> userCaptor = ArgumentCaptor.forClass(User.class);

        User created = repository.createOrUpdate(PHONE, "123456", expires);

        verify(mockUserTable).putItem(userCaptor.capture());
        User saved = userCaptor.getValue();
        assertThat(saved).isSameAs(created);
        assertThat(saved.getId()).isNotBlank();
        assertThat(saved.getPhoneNumber()).isEqualTo(PHONE);
        assertThat(saved.getOtp()).isEqualTo("123456");
        assertThat(saved.getOtpExpires()).isEqualTo(expires);
        assertThat(saved.getCreationDate()).isNotNull();
    }

    @Test
    void createOrUpdate_ExistingNumber_KeepsIdAndOverwritesOtp() {
        User existing = new User(PHONE);
        existing.assignOtp("111111", Instant.now().plusSeconds(60));
        String originalId = existing.getId();
        Instant newExpiry = Instant.now().plusSeconds(600);
        when(mockUserTable.getItem(any(Key.class))).thenReturn(existing);

        User updated = repository.createOrUpdate(PHONE, "222222", newExpiry);

        verify(mockUserTable).putItem(existing);
        assertThat(updated.getId()).isEqualTo(originalId);
        assertThat(updated.getOtp()).isEqualTo("222222");
        assertThat(updated.getOtpExpires()).isEqualTo(newExpiry);
    }

    @Test
    void clearOtp_ExistingUser_RemovesCodeAndExpiryTogether() {
        User existing = new User(PHONE);
        existing.assignOtp("123456", Instant.now().plusSeconds(600));
        when(mockUserTable.getItem(any(Key.class))).thenReturn(existing);

        repository.clearOtp(PHONE);

        verify(mockUserTable).putItem(existing);
        assertThat(existing.getOtp()).isNull();
        assertThat(existing.getOtpExpires()).isNull();
        assertThat(existing.hasOutstandingOtp()).isFalse();
    }

    @Test
    void clearOtp_UnknownNumber_WritesNothing() {
        when(mockUserTable.getItem(any(Key.class))).thenReturn(null);

        repository.clearOtp(PHONE);

        verify(mockUserTable, never()).putItem(any(User.class));
    }

    @Test
    void createOrUpdate_DynamoDbFailure_WrapsInRepositoryException() {
        DynamoDbException failure = (DynamoDbException) DynamoDbException.builder()
                .message("Throughput exceeded")
                .build();
        when(mockUserTable.getItem(any(Key.class))).thenThrow(failure);

        assertThatThrownBy(() -> repository.createOrUpdate(PHONE, "123456", Instant.now()))
                .isInstanceOf(RepositoryException.class)
                .hasCause(failure);
    }
}
