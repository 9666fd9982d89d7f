package com.cred.freestyle.jewelryauction.api.exception;

import com.cred.freestyle.jewelryauction.api.dto.ErrorResponse;
import com.cred.freestyle.jewelryauction.exception.AuctionException;
import com.cred.freestyle.jewelryauction.exception.AuthorizationException;
import com.cred.freestyle.jewelryauction.exception.BusinessRuleViolationException;
import com.cred.freestyle.jewelryauction.exception.ConcurrencyException;
import com.cred.freestyle.jewelryauction.exception.ConflictException;
import com.cred.freestyle.jewelryauction.exception.ExternalServiceException;
import com.cred.freestyle.jewelryauction.exception.InsufficientBidException;
import com.cred.freestyle.jewelryauction.exception.InvalidCredentialsException;
import com.cred.freestyle.jewelryauction.exception.InvalidStateTransitionException;
import com.cred.freestyle.jewelryauction.exception.ResourceNotFoundException;
import com.cred.freestyle.jewelryauction.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the auction API.
 * Converts domain and framework exceptions into {@link ErrorResponse} bodies.
 *
 * Status mapping: 400 validation and business rules, 403 authorization and invalid state
 * transitions, 404 missing resources, 409 conflicts and concurrency, 502 gateway failures.
 *
 * @author Jewelry Auction Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle InsufficientBidException.
     * Returns 400 BAD REQUEST with the minimum acceptable amount.
     */
    @ExceptionHandler(InsufficientBidException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBid(
            InsufficientBidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Insufficient bid: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.BAD_REQUEST, "Insufficient Bid", ex, request);
        error.addDetail("offeredAmount", ex.getOfferedAmount());
        error.addDetail("minimumAmount", ex.getMinimumAmount());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle InvalidStateTransitionException.
     * Returns 403 FORBIDDEN: the operation is not permitted in the current state.
     */
    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidStateTransition(
            InvalidStateTransitionException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid state transition: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.FORBIDDEN, "Invalid State Transition", ex, request);
        error.addDetail("entityType", ex.getEntityType());
        error.addDetail("entityId", ex.getEntityId());
        error.addDetail("currentStatus", ex.getCurrentStatus());
        error.addDetail("expectedStatus", ex.getExpectedStatus());

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle BusinessRuleViolationException and its remaining subtypes.
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler(BusinessRuleViolationException.class)
    public ResponseEntity<ErrorResponse> handleBusinessRule(
            BusinessRuleViolationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Business rule violated [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(build(HttpStatus.BAD_REQUEST, "Business Rule Violation", ex, request));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed on {}: {}", ex.getField(), ex.getMessage());

        ErrorResponse error = build(HttpStatus.BAD_REQUEST, "Validation Error", ex, request);
        error.addDetail("field", ex.getField());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle bean validation errors on request bodies.
     * Returns 400 BAD REQUEST with a message per field.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Request validation failed: {}", ex.getMessage());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Validation Error",
                ValidationException.CODE,
                "Invalid request parameters",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Validation Error",
                ValidationException.CODE,
                "Malformed request",
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle AuthorizationException.
     * Returns 403 FORBIDDEN when the caller's role or identity does not allow the action.
     */
    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(
            AuthorizationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Authorization denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(build(HttpStatus.FORBIDDEN, "Forbidden", ex, request));
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCredentials(
            InvalidCredentialsException ex,
            HttpServletRequest request
    ) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex, request));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.FORBIDDEN,
                "Forbidden",
                AuthorizationException.CODE,
                "Access denied",
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.NOT_FOUND, "Not Found", ex, request);
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(
            ConflictException ex,
            HttpServletRequest request
    ) {
        logger.warn("Conflict [{}]: {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(build(HttpStatus.CONFLICT, "Conflict", ex, request));
    }

    /**
     * Handle ConcurrencyException.
     * Returns 409 CONFLICT; the client may retry.
     */
    @ExceptionHandler(ConcurrencyException.class)
    public ResponseEntity<ErrorResponse> handleConcurrency(
            ConcurrencyException ex,
            HttpServletRequest request
    ) {
        logger.warn("Concurrent modification: {}", ex.getMessage());

        ErrorResponse error = build(HttpStatus.CONFLICT, "Concurrent Modification", ex, request);

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle lock failures and constraint violations that escaped the services.
     * Returns 409 CONFLICT; the client may retry.
     */
    @ExceptionHandler({
            OptimisticLockingFailureException.class,
            PessimisticLockingFailureException.class,
            CannotAcquireLockException.class,
            DataIntegrityViolationException.class
    })
    public ResponseEntity<ErrorResponse> handleDataConflict(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Data conflict: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT,
                "Concurrent Modification",
                ConcurrencyException.CODE,
                "The resource was modified concurrently, please retry",
                request.getRequestURI()
        );
        error.setRetryable(true);

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle ExternalServiceException.
     * Returns 502 BAD GATEWAY.
     */
    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<ErrorResponse> handleExternalService(
            ExternalServiceException ex,
            HttpServletRequest request
    ) {
        logger.error("External service {} failed: {}", ex.getService(), ex.getMessage(), ex);

        ErrorResponse error = build(HttpStatus.BAD_GATEWAY, "Bad Gateway", ex, request);
        error.addDetail("service", ex.getService());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }

    /**
     * Handle all other exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error", ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "INTERNAL_ERROR",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static ErrorResponse build(HttpStatus status, String error, AuctionException ex,
                                       HttpServletRequest request) {
        return ErrorResponse.of(status, error, ex, request.getRequestURI());
    }
}
