package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Request DTO for opening a support ticket.
 *
 * @author Storefront Team
 */
public class OpenTicketRequest {

    @Size(max = 100, message = "Channel reference must be at most 100 characters")
    private String channelRef;

    public OpenTicketRequest() {
    }

    public OpenTicketRequest(String channelRef) {
        this.channelRef = channelRef;
    }

    // Getters and setters
    public String getChannelRef() {
        return channelRef;
    }

    public void setChannelRef(String channelRef) {
        this.channelRef = channelRef;
    }
}
