package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.OpenTicketRequest;
import com.cred.freestyle.storefront.api.dto.TicketPanelRequest;
import com.cred.freestyle.storefront.api.dto.TicketResponse;
import com.cred.freestyle.storefront.domain.model.Ticket;
import com.cred.freestyle.storefront.service.TicketService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Support tickets. A user has at most one open ticket; closed tickets are purged after a delay.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/tickets")
public class TicketController {

    private final TicketService ticketService;

    public TicketController(TicketService ticketService) {
        this.ticketService = ticketService;
    }

    @PostMapping
    public ResponseEntity<TicketResponse> openTicket(
            @RequestBody(required = false) OpenTicketRequest request,
            @RequestHeader(RequestHeaders.USER_ID) String userId
    ) {
        String channelRef = request == null ? null : request.getChannelRef();
        Ticket ticket = ticketService.openTicket(userId, channelRef);
        return ResponseEntity.status(HttpStatus.CREATED).body(TicketResponse.fromEntity(ticket));
    }

    @GetMapping("/{ticketId}")
    public ResponseEntity<TicketResponse> getTicket(@PathVariable String ticketId) {
        return ResponseEntity.ok(TicketResponse.fromEntity(ticketService.getTicket(ticketId)));
    }

    /**
     * Close a ticket. The closer is whoever sent the request, buyer or staff.
     */
    @PostMapping("/{ticketId}/close")
    public ResponseEntity<TicketResponse> closeTicket(
            @PathVariable String ticketId,
            @RequestHeader(value = RequestHeaders.USER_ID, required = false) String userId,
            @RequestHeader(value = RequestHeaders.STAFF_ID, required = false) String staffId
    ) {
        String closedBy = staffId != null ? staffId : userId;
        if (closedBy == null) {
            throw new IllegalArgumentException("Closing a ticket needs " + RequestHeaders.USER_ID
                    + " or " + RequestHeaders.STAFF_ID);
        }
        return ResponseEntity.ok(TicketResponse.fromEntity(ticketService.closeTicket(ticketId, closedBy)));
    }

    @GetMapping("/open")
    public ResponseEntity<List<TicketResponse>> listOpen(@RequestHeader(RequestHeaders.STAFF_ID) String staffId) {
        List<TicketResponse> tickets = ticketService.listOpen()
                .stream()
                .map(TicketResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(tickets);
    }

    /**
     * Post the "open a ticket" panel into a channel.
     */
    @PostMapping("/panel")
    public ResponseEntity<Void> setupTicketPanel(
            @Valid @RequestBody TicketPanelRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        ticketService.setupTicketPanel(request.getChannelRef(), staffId);
        return ResponseEntity.accepted().build();
    }
}
