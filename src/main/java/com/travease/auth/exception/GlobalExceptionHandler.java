package com.travease.auth.exception;

import com.travease.auth.config.AuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts every failure into the {@code {success: false, message}} envelope.
 * 500 responses also carry the exception message under {@code error}, in development mode only.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final boolean developmentMode;

    public GlobalExceptionHandler(AuthProperties authProperties) {
        this.developmentMode = authProperties.isDevelopmentMode();
    }

    @ExceptionHandler(OtpValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(OtpValidationException e) {
        logger.info("Rejected OTP request: {}", e.getMessage());
        return failure(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "Invalid request";
        logger.info("Rejected OTP request: {}", message);
        return failure(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.info("Unreadable request body: {}", e.getMessage());
        return failure(HttpStatus.BAD_REQUEST, "Request body is missing or malformed");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException e) {
        logger.info("Missing request parameter: {}", e.getParameterName());
        return failure(HttpStatus.BAD_REQUEST, "Required parameter '" + e.getParameterName() + "' is missing");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        logger.info("Unsupported method: {}", e.getMethod());
        HttpHeaders headers = new HttpHeaders();
        Set<HttpMethod> supported = e.getSupportedHttpMethods();
        if (supported != null && !supported.isEmpty()) {
            headers.setAllow(supported);
        }
        String message = "Method " + e.getMethod() + " is not supported for this endpoint";
        return new ResponseEntity<>(envelope(message), headers, HttpStatus.METHOD_NOT_ALLOWED);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException e) {
        logger.info("Unsupported content type: {}", e.getContentType());
        String supported = e.getSupportedMediaTypes().stream()
                .map(Object::toString)
                .collect(Collectors.joining(", "));
        String message = e.getContentType() == null
                ? "Content type is missing; use " + supported
                : "Content type '" + e.getContentType() + "' is not supported; use " + supported;
        return failure(HttpStatus.UNSUPPORTED_MEDIA_TYPE, message);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoResource(NoResourceFoundException e) {
        return failure(HttpStatus.NOT_FOUND, "Route not found");
    }

    @ExceptionHandler(PhoneNumberNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handlePhoneNumberNotFound(PhoneNumberNotFoundException e) {
        return failure(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({NoOtpOutstandingException.class, OtpExpiredException.class, InvalidCodeException.class})
    public ResponseEntity<Map<String, Object>> handleRejectedCode(RuntimeException e) {
        return failure(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(OtpDeliveryException.class)
    public ResponseEntity<Map<String, Object>> handleDelivery(OtpDeliveryException e) {
        logger.error("OTP delivery failed: {}", e.getMessage(), e);
        return internalError("Failed to send OTP via SMS", e);
    }

    @ExceptionHandler(RepositoryException.class)
    public ResponseEntity<Map<String, Object>> handleRepository(RepositoryException e) {
        logger.error("Repository error: {}", e.getMessage(), e);
        return internalError("Server error", e);
    }

    @ExceptionHandler(DynamoDbException.class)
    public ResponseEntity<Map<String, Object>> handleDynamoDbException(DynamoDbException e) {
        logger.error("DynamoDB error: {}", e.getMessage(), e);
        return internalError("Server error", e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return internalError("Something went wrong!", e);
    }

    private ResponseEntity<Map<String, Object>> internalError(String message, Exception e) {
        Map<String, Object> body = envelope(message);
        if (developmentMode) {
            body.put("error", e.getMessage());
        }
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<Map<String, Object>> failure(HttpStatus status, String message) {
        return new ResponseEntity<>(envelope(message), status);
    }

    private Map<String, Object> envelope(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        return body;
    }
}
