package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.service.CartSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for a cart snapshot.
 *
 * @author Storefront Team
 */
public class CartResponse {

    private String ownerId;

    private List<CartLineResponse> lines;

    private long totalMinor;

    private Instant lastActivityAt;

    public CartResponse() {
    }

    public static CartResponse fromSnapshot(CartSnapshot snapshot) {
        CartResponse response = new CartResponse();
        response.setOwnerId(snapshot.getOwnerId());
        response.setLines(snapshot.getLines().stream()
                .map(CartLineResponse::fromLine)
                .collect(Collectors.toList()));
        response.setTotalMinor(snapshot.getTotalMinor());
        response.setLastActivityAt(snapshot.getLastActivityAt());
        return response;
    }

    // Getters and setters
    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public List<CartLineResponse> getLines() {
        return lines;
    }

    public void setLines(List<CartLineResponse> lines) {
        this.lines = lines;
    }

    public long getTotalMinor() {
        return totalMinor;
    }

    public void setTotalMinor(long totalMinor) {
        this.totalMinor = totalMinor;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public void setLastActivityAt(Instant lastActivityAt) {
        this.lastActivityAt = lastActivityAt;
    }
}
