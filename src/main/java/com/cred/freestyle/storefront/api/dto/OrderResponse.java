package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.Order;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for an order.
 *
 * @author Storefront Team
 */
public class OrderResponse {

    private String orderId;

    private String ownerId;

    private List<OrderLineResponse> lines;

    private Long totalMinor;

    private String currency;

    private String state;

    private String paymentMethod;

    private String paymentRef;

    private String approvalUrl;

    private Instant createdAt;

    private Instant expiresAt;

    private boolean manualVerificationRequested;

    private String paymentIssue;

    private boolean manualFulfillmentPending;

    private String fulfillmentIssue;

    private String fulfilledBy;

    private String cancellationReason;

    private Integer reviewRating;

    private String reviewText;

    public OrderResponse() {
    }

    /**
     * Create response from Order entity.
     *
     * @param order Order entity
     * @return OrderResponse
     */
    public static OrderResponse fromEntity(Order order) {
        OrderResponse response = new OrderResponse();
        response.setOrderId(order.getOrderId());
        response.setOwnerId(order.getOwnerId());
        response.setLines(order.getLines().stream()
                .map(OrderLineResponse::fromLine)
                .collect(Collectors.toList()));
        response.setTotalMinor(order.getTotalMinor());
        response.setCurrency(order.getCurrency());
        response.setState(order.getState().name());
        response.setPaymentMethod(order.getPaymentMethod().name());
        response.setPaymentRef(order.getPaymentRef());
        response.setApprovalUrl(order.getApprovalUrl());
        response.setCreatedAt(order.getCreatedAt());
        response.setExpiresAt(order.getExpiresAt());
        response.setManualVerificationRequested(order.getManualVerificationRequestedAt() != null);
        response.setPaymentIssue(order.getPaymentIssue());
        response.setManualFulfillmentPending(order.isManualFulfillmentPending());
        response.setFulfillmentIssue(order.getFulfillmentIssue());
        response.setFulfilledBy(order.getFulfilledBy());
        response.setCancellationReason(order.getCancellationReason());
        response.setReviewRating(order.getReviewRating());
        response.setReviewText(order.getReviewText());
        return response;
    }

    // Getters and setters
    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public List<OrderLineResponse> getLines() {
        return lines;
    }

    public void setLines(List<OrderLineResponse> lines) {
        this.lines = lines;
    }

    public Long getTotalMinor() {
        return totalMinor;
    }

    public void setTotalMinor(Long totalMinor) {
        this.totalMinor = totalMinor;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(String paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    public String getPaymentRef() {
        return paymentRef;
    }

    public void setPaymentRef(String paymentRef) {
        this.paymentRef = paymentRef;
    }

    public String getApprovalUrl() {
        return approvalUrl;
    }

    public void setApprovalUrl(String approvalUrl) {
        this.approvalUrl = approvalUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public boolean isManualVerificationRequested() {
        return manualVerificationRequested;
    }

    public void setManualVerificationRequested(boolean manualVerificationRequested) {
        this.manualVerificationRequested = manualVerificationRequested;
    }

    public String getPaymentIssue() {
        return paymentIssue;
    }

    public void setPaymentIssue(String paymentIssue) {
        this.paymentIssue = paymentIssue;
    }

    public boolean isManualFulfillmentPending() {
        return manualFulfillmentPending;
    }

    public void setManualFulfillmentPending(boolean manualFulfillmentPending) {
        this.manualFulfillmentPending = manualFulfillmentPending;
    }

    public String getFulfillmentIssue() {
        return fulfillmentIssue;
    }

    public void setFulfillmentIssue(String fulfillmentIssue) {
        this.fulfillmentIssue = fulfillmentIssue;
    }

    public String getFulfilledBy() {
        return fulfilledBy;
    }

    public void setFulfilledBy(String fulfilledBy) {
        this.fulfilledBy = fulfilledBy;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public void setCancellationReason(String cancellationReason) {
        this.cancellationReason = cancellationReason;
    }

    public Integer getReviewRating() {
        return reviewRating;
    }

    public void setReviewRating(Integer reviewRating) {
        this.reviewRating = reviewRating;
    }

    public String getReviewText() {
        return reviewText;
    }

    public void setReviewText(String reviewText) {
        this.reviewText = reviewText;
    }
}
