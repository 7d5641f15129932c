package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Ticket;
import com.cred.freestyle.storefront.domain.model.Ticket.TicketState;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.exception.TicketAlreadyOpenException;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.TicketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Support tickets: open, close, and purge after a delay.
 *
 * A user has at most one open ticket, enforced by a unique key that is only set while the ticket
 * is open. Closing a ticket schedules its purge; the purge sweep removes it with a guarded update
 * so that two overlapping sweeps purge a ticket once.
 *
 * @author Storefront Team
 */
@Service
public class TicketService {

    private static final Logger logger = LoggerFactory.getLogger(TicketService.class);

    private final TicketRepository ticketRepository;
    private final StoreStateService storeStateService;
    private final ApplicationEventPublisher eventPublisher;
    private final StorefrontMetricsService metricsService;
    private final Duration purgeDelay;

    public TicketService(
            TicketRepository ticketRepository,
            StoreStateService storeStateService,
            ApplicationEventPublisher eventPublisher,
            StorefrontMetricsService metricsService,
            @Value("${storefront.ticket.purge-delay:PT24H}") Duration purgeDelay
    ) {
        this.ticketRepository = ticketRepository;
        this.storeStateService = storeStateService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.purgeDelay = purgeDelay;
    }

    /**
     * Open a ticket for a user.
     * Runs outside a surrounding transaction so the unique-key violation of a concurrent open can
     * be translated here.
     *
     * @param channelRef Chat channel created for the ticket, generated when absent
     * @throws TicketAlreadyOpenException if the user already has an open ticket
     */
    public Ticket openTicket(String ownerId, String channelRef) {
        if (ticketRepository.findByOwnerIdAndState(ownerId, TicketState.OPEN).isPresent()) {
            throw new TicketAlreadyOpenException(ownerId);
        }

        String channel = channelRef == null || channelRef.isBlank()
                ? "ticket-" + UUID.randomUUID().toString().substring(0, 8)
                : channelRef;

        Ticket ticket;
        try {
            ticket = ticketRepository.saveAndFlush(Ticket.builder()
                    .ownerId(ownerId)
                    .channelRef(channel)
                    .state(TicketState.OPEN)
                    .build());
        } catch (DataIntegrityViolationException e) {
            logger.info("Concurrent ticket open for {} lost the race", ownerId);
            throw new TicketAlreadyOpenException(ownerId);
        }

        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.TICKET_OPENED, ownerId, ticket.getTicketId())
                .with("channelRef", channel));
        logger.info("Ticket {} opened for {} in {}", ticket.getTicketId(), ownerId, channel);
        return ticket;
    }

    /**
     * Close a ticket and schedule its purge. Closing a ticket that is not open is a no-op.
     */
    @Transactional
    public Ticket closeTicket(String ticketId, String closedBy) {
        Ticket ticket = ticketRepository.findByIdWithLock(ticketId)
                .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
        if (ticket.getState() != TicketState.OPEN) {
            logger.debug("Ticket {} already {}", ticketId, ticket.getState());
            return ticket;
        }

        ticket.close(closedBy, Instant.now(), purgeDelay);
        Ticket saved = ticketRepository.save(ticket);

        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.TICKET_CLOSING, ticket.getOwnerId(), ticketId)
                .with("channelRef", ticket.getChannelRef())
                .with("closedBy", closedBy)
                .with("purgeAt", String.valueOf(ticket.getPurgeAt())));
        logger.info("Ticket {} closed by {}, purge at {}", ticketId, closedBy, ticket.getPurgeAt());
        return saved;
    }

    /**
     * Ids of closed tickets whose purge time has passed.
     */
    @Transactional(readOnly = true)
    public List<String> findDueForPurge(Instant now) {
        return ticketRepository.findDueForPurge(now);
    }

    /**
     * Purge one ticket if it is still closed and due.
     *
     * @return true if this call purged it
     */
    @Transactional
    public boolean purge(String ticketId, Instant now) {
        int updated = ticketRepository.markPurged(ticketId, now);
        if (updated == 0) {
            logger.debug("Ticket {} already purged or reopened", ticketId);
            metricsService.recordDuplicateSkipped("ticket_purge");
            return false;
        }

        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.TICKET_PURGED, ticket.getOwnerId(), ticketId)
                .with("channelRef", ticket.getChannelRef()));
        logger.info("Ticket {} purged", ticketId);
        return true;
    }

    /**
     * Ask the chat adapter to post the ticket panel in a channel, and remember the channel.
     */
    @Transactional
    public void setupTicketPanel(String channelRef, String staffId) {
        if (channelRef == null || channelRef.isBlank()) {
            throw new IllegalArgumentException("Channel reference is required");
        }
        storeStateService.setTicketPanelChannel(channelRef);
        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.TICKET_PANEL_REQUESTED, staffId, channelRef));
        logger.info("Ticket panel requested in {} by {}", channelRef, staffId);
    }

    @Transactional(readOnly = true)
    public List<Ticket> listOpen() {
        return ticketRepository.findByStateOrderByOpenedAtAsc(TicketState.OPEN);
    }

    @Transactional(readOnly = true)
    public Ticket getTicket(String ticketId) {
        return ticketRepository.findById(ticketId)
                .orElseThrow(() -> new ResourceNotFoundException("Ticket", ticketId));
    }
}
