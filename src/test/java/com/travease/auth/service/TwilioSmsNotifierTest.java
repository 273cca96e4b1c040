package com.travease.auth.service;

import com.travease.auth.exception.OtpDeliveryException;
import com.twilio.exception.ApiException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.rest.api.v2010.account.MessageCreator;
import com.twilio.type.PhoneNumber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TwilioSmsNotifierTest {

    private static final String FROM = "+15005550006";

    @Mock
    private MessageCreator messageCreator;

    @Mock
    private Message message;

    private TwilioSmsNotifier notifier;

    @BeforeEach
    void setUp() {
        // Twilio.init only stores the credentials; no request is made here
        notifier = new TwilioSmsNotifier("test-account-sid", "test-auth-token", FROM);
    }

    @Test
    void send_CreatesMessageFromConfiguredNumber() {
        ArgumentCaptor<PhoneNumber> toCaptor = ArgumentCaptor.forClass(PhoneNumber.class);
        ArgumentCaptor<PhoneNumber> fromCaptor = ArgumentCaptor.forClass(PhoneNumber.class);

        try (MockedStatic<Message> mockedMessage = mockStatic(Message.class)) {
            mockedMessage.when(() -> Message.creator(any(PhoneNumber.class), any(PhoneNumber.class), anyString()))
                    .thenReturn(messageCreator);
            when(messageCreator.create()).thenReturn(message);

            notifier.send("+919876543210", "Your Travease verification code is: 123456. Valid for 10 minutes.");

            mockedMessage.verify(() -> Message.creator(toCaptor.capture(), fromCaptor.capture(),
                    eq("Your Travease verification code is: 123456. Valid for 10 minutes.")));
            verify(messageCreator).create();
        }

        assertThat(toCaptor.getValue().getEndpoint()).isEqualTo("+919876543210");
        assertThat(fromCaptor.getValue().getEndpoint()).isEqualTo(FROM);
    }

    @Test
    void send_TwilioApiException_ThrowsDeliveryException() {
        ApiException apiException = new ApiException("The 'To' number is not a valid phone number.");

        try (MockedStatic<Message> mockedMessage = mockStatic(Message.class)) {
            mockedMessage.when(() -> Message.creator(any(PhoneNumber.class), any(PhoneNumber.class), anyString()))
                    .thenReturn(messageCreator);
            when(messageCreator.create()).thenThrow(apiException);

            assertThatThrownBy(() -> notifier.send("+910", "hello"))
                    .isInstanceOf(OtpDeliveryException.class)
                    .hasMessageContaining("Failed to send SMS via Twilio")
                    .hasCause(apiException);
        }
    }

    @Test
    void send_NetworkFailure_ThrowsDeliveryException() {
        RuntimeException networkException = new RuntimeException("Network error");

        try (MockedStatic<Message> mockedMessage = mockStatic(Message.class)) {
            mockedMessage.when(() -> Message.creator(any(PhoneNumber.class), any(PhoneNumber.class), anyString()))
                    .thenReturn(messageCreator);
            when(messageCreator.create()).thenThrow(networkException);

            assertThatThrownBy(() -> notifier.send("+919876543210", "hello"))
                    .isInstanceOf(OtpDeliveryException.class)
                    .hasCause(networkException);
        }
    }
}
