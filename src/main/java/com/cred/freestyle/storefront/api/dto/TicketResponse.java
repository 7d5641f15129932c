package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.Ticket;

import java.time.Instant;

/**
 * Response DTO for a support ticket.
 *
 * @author Storefront Team
 */
public class TicketResponse {

    private String ticketId;

    private String ownerId;

    private String channelRef;

    private String state;

    private Instant openedAt;

    private Instant closedAt;

    private String closedBy;

    private Instant purgeAt;

    public TicketResponse() {
    }

    public static TicketResponse fromEntity(Ticket ticket) {
        TicketResponse response = new TicketResponse();
        response.setTicketId(ticket.getTicketId());
        response.setOwnerId(ticket.getOwnerId());
        response.setChannelRef(ticket.getChannelRef());
        response.setState(ticket.getState().name());
        response.setOpenedAt(ticket.getOpenedAt());
        response.setClosedAt(ticket.getClosedAt());
        response.setClosedBy(ticket.getClosedBy());
        response.setPurgeAt(ticket.getPurgeAt());
        return response;
    }

    // Getters and setters
    public String getTicketId() {
        return ticketId;
    }

    public void setTicketId(String ticketId) {
        this.ticketId = ticketId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getChannelRef() {
        return channelRef;
    }

    public void setChannelRef(String channelRef) {
        this.channelRef = channelRef;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public void setOpenedAt(Instant openedAt) {
        this.openedAt = openedAt;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }

    public String getClosedBy() {
        return closedBy;
    }

    public void setClosedBy(String closedBy) {
        this.closedBy = closedBy;
    }

    public Instant getPurgeAt() {
        return purgeAt;
    }

    public void setPurgeAt(Instant purgeAt) {
        this.purgeAt = purgeAt;
    }
}
