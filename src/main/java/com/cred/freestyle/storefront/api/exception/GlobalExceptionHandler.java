package com.cred.freestyle.storefront.api.exception;

import com.cred.freestyle.storefront.api.dto.ErrorResponse;
import com.cred.freestyle.storefront.exception.*;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the storefront API.
 * Catches all exceptions thrown by controllers and converts them to standardized error responses.
 *
 * @author Storefront Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final StorefrontMetricsService metricsService;

    public GlobalExceptionHandler(StorefrontMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Handle InsufficientStockException.
     * Returns 409 CONFLICT when stock cannot cover the request.
     */
    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStockException(
            InsufficientStockException ex,
            HttpServletRequest request
    ) {
        logger.warn("Insufficient stock: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT,
                "Insufficient Stock",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("InsufficientStock");
        error.addDetail("itemId", ex.getItemId());
        error.addDetail("requestedQuantity", ex.getRequestedQuantity());
        error.addDetail("availableQuantity", ex.getAvailableQuantity());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle StaleCartItemException.
     * Returns 409 CONFLICT; the cart is unchanged and the buyer can fix it and retry.
     */
    @ExceptionHandler(StaleCartItemException.class)
    public ResponseEntity<ErrorResponse> handleStaleCartItemException(
            StaleCartItemException ex,
            HttpServletRequest request
    ) {
        logger.warn("Stale cart item: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT,
                "Stale Cart Item",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("ValidationError");
        error.addDetail("itemId", ex.getItemId());
        error.addDetail("reason", ex.getReason().name());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle PaymentMismatchException.
     * Returns 402 PAYMENT REQUIRED; the order stays awaiting payment.
     */
    @ExceptionHandler(PaymentMismatchException.class)
    public ResponseEntity<ErrorResponse> handlePaymentMismatchException(
            PaymentMismatchException ex,
            HttpServletRequest request
    ) {
        logger.warn("Payment mismatch: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.PAYMENT_REQUIRED,
                "Payment Mismatch",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("PaymentMismatch");
        error.addDetail("orderId", ex.getOrderId());
        error.addDetail("expectedAmountMinor", ex.getExpectedAmountMinor());
        error.addDetail("actualAmountMinor", ex.getActualAmountMinor());
        error.addDetail("expectedCurrency", ex.getExpectedCurrency());
        error.addDetail("actualCurrency", ex.getActualCurrency());

        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(error);
    }

    /**
     * Handle ReservationInvariantViolationException.
     * Returns 500; this is an accounting bug, not a user error.
     */
    @ExceptionHandler(ReservationInvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleReservationInvariantViolationException(
            ReservationInvariantViolationException ex,
            HttpServletRequest request
    ) {
        logger.error("Reservation invariant violated: {}", ex.getMessage(), ex);
        metricsService.recordError("RESERVATION_INVARIANT_VIOLATION", request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Reservation Invariant Violation",
                "Stock accounting for this order is inconsistent. Staff have been alerted.",
                request.getRequestURI()
        ).kind("ReservationInvariantViolation");
        error.addDetail("orderId", ex.getOrderId());
        error.addDetail("itemId", ex.getItemId());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle FulfillmentFailureException.
     * Returns 500; the order stays paid with the reason recorded for a retry.
     */
    @ExceptionHandler(FulfillmentFailureException.class)
    public ResponseEntity<ErrorResponse> handleFulfillmentFailureException(
            FulfillmentFailureException ex,
            HttpServletRequest request
    ) {
        logger.error("Fulfillment failed: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Fulfillment Failed",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("FulfillmentFailure");
        error.addDetail("orderId", ex.getOrderId());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle InvalidOrderStateException.
     * Returns 409 CONFLICT for transitions the order cannot make.
     */
    @ExceptionHandler(InvalidOrderStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOrderStateException(
            InvalidOrderStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid order state: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT,
                "Invalid Order State",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("InvalidOrderState");
        error.addDetail("orderId", ex.getOrderId());
        error.addDetail("currentState", ex.getCurrentState().name());
        error.addDetail("requestedState", ex.getRequestedState().name());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle ShopClosedException.
     * Returns 503 SERVICE UNAVAILABLE while the shop is closed.
     */
    @ExceptionHandler(ShopClosedException.class)
    public ResponseEntity<ErrorResponse> handleShopClosedException(
            ShopClosedException ex,
            HttpServletRequest request
    ) {
        logger.info("Rejected request while shop closed: {}", request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Shop Closed",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("ShopClosed");

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND when any resource doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("NotFound");
        error.addDetail("resourceType", ex.getResourceType());
        error.addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle PaymentGatewayException.
     * Returns 502 BAD GATEWAY when the payment provider failed.
     */
    @ExceptionHandler(PaymentGatewayException.class)
    public ResponseEntity<ErrorResponse> handlePaymentGatewayException(
            PaymentGatewayException ex,
            HttpServletRequest request
    ) {
        logger.error("Payment gateway error: {}", ex.getMessage());
        metricsService.recordError("PAYMENT_GATEWAY_ERROR", request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_GATEWAY,
                "Payment Provider Error",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("PaymentGatewayUnavailable");

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }

    /**
     * Handle CartBusyException.
     * Returns 429 TOO MANY REQUESTS when another edit of the same cart is in progress.
     */
    @ExceptionHandler(CartBusyException.class)
    public ResponseEntity<ErrorResponse> handleCartBusyException(
            CartBusyException ex,
            HttpServletRequest request
    ) {
        logger.warn("Cart busy: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.TOO_MANY_REQUESTS,
                "Cart Busy",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("CartBusy");
        error.addDetail("ownerId", ex.getOwnerId());

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(error);
    }

    /**
     * Handle TicketAlreadyOpenException.
     * Returns 409 CONFLICT when the user already has an open ticket.
     */
    @ExceptionHandler(TicketAlreadyOpenException.class)
    public ResponseEntity<ErrorResponse> handleTicketAlreadyOpenException(
            TicketAlreadyOpenException ex,
            HttpServletRequest request
    ) {
        logger.info("Ticket already open: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT,
                "Ticket Already Open",
                ex.getMessage(),
                request.getRequestURI()
        ).kind("TicketAlreadyOpen");
        error.addDetail("ownerId", ex.getOwnerId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle ObjectOptimisticLockingFailureException.
     * Returns 409 CONFLICT when a concurrent update won.
     */
    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailure(
            ObjectOptimisticLockingFailureException ex,
            HttpServletRequest request
    ) {
        logger.warn("Concurrent modification: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT,
                "Concurrent Modification",
                "The resource was changed by another request. Please retry.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Handle IllegalStateException.
     * Returns 400 BAD REQUEST for general business logic violations.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalStateException(
            IllegalStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal state: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Invalid Request",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle IllegalArgumentException.
     * Returns 400 BAD REQUEST for invalid arguments.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle a missing identity header (X-User-Id / X-Staff-Id).
     * Returns 400 BAD REQUEST.
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(
            MissingRequestHeaderException ex,
            HttpServletRequest request
    ) {
        logger.warn("Missing header: {}", ex.getHeaderName());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Missing Header",
                "Required header " + ex.getHeaderName() + " is missing",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the field errors.",
                request.getRequestURI()
        );
        error.addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);
        metricsService.recordError(ex.getClass().getSimpleName(), request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request.getRequestURI()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
