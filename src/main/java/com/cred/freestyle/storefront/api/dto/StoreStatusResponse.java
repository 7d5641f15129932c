package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.StoreState;

import java.time.Instant;

/**
 * Response DTO for the shop status.
 *
 * @author Storefront Team
 */
public class StoreStatusResponse {

    private String status;

    private String activeRoundId;

    private String ticketPanelChannelRef;

    private Instant updatedAt;

    public StoreStatusResponse() {
    }

    public static StoreStatusResponse fromEntity(StoreState state) {
        StoreStatusResponse response = new StoreStatusResponse();
        response.setStatus(state.getShopStatus().name());
        response.setActiveRoundId(state.getActiveRoundId());
        response.setTicketPanelChannelRef(state.getTicketPanelChannelRef());
        response.setUpdatedAt(state.getUpdatedAt());
        return response;
    }

    // Getters and setters
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getActiveRoundId() {
        return activeRoundId;
    }

    public void setActiveRoundId(String activeRoundId) {
        this.activeRoundId = activeRoundId;
    }

    public String getTicketPanelChannelRef() {
        return ticketPanelChannelRef;
    }

    public void setTicketPanelChannelRef(String ticketPanelChannelRef) {
        this.ticketPanelChannelRef = ticketPanelChannelRef;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
