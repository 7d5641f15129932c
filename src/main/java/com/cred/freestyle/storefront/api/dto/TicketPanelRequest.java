package com.cred.freestyle.storefront.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for posting the ticket panel in a channel.
 *
 * @author Storefront Team
 */
public class TicketPanelRequest {

    @NotBlank(message = "Channel reference is required")
    @Size(max = 100, message = "Channel reference must be at most 100 characters")
    private String channelRef;

    public TicketPanelRequest() {
    }

    public TicketPanelRequest(String channelRef) {
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
