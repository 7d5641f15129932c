package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Ticket;
import com.cred.freestyle.storefront.domain.model.Ticket.TicketState;
import com.cred.freestyle.storefront.exception.TicketAlreadyOpenException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.TicketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TicketService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TicketService Unit Tests")
class TicketServiceTest {

    @Mock
    private TicketRepository ticketRepository;

    @Mock
    private StoreStateService storeStateService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private StorefrontMetricsService metricsService;

    private TicketService ticketService;

    @BeforeEach
    void setUp() {
        ticketService = new TicketService(ticketRepository, storeStateService, eventPublisher,
                metricsService, Duration.ofHours(24));
    }

    private Ticket openTicket() {
        return Ticket.builder()
                .ticketId("ticket-1")
                .ownerId("user-1")
                .channelRef("ticket-abc")
                .state(TicketState.OPEN)
                .openOwnerKey("user-1")
                .openedAt(Instant.now())
                .build();
    }

    // ========================================
    // openTicket() Tests
    // ========================================

    @Test
    @DisplayName("openTicket - No open ticket: Should create one with a generated channel")
    void openTicket_Success() {
        // Given
        when(ticketRepository.findByOwnerIdAndState("user-1", TicketState.OPEN)).thenReturn(Optional.empty());
        when(ticketRepository.saveAndFlush(any(Ticket.class))).thenAnswer(invocation -> {
            Ticket ticket = invocation.getArgument(0);
            ticket.setTicketId("ticket-1");
            return ticket;
        });

        // When
        Ticket ticket = ticketService.openTicket("user-1", null);

        // Then
        assertThat(ticket.getState()).isEqualTo(TicketState.OPEN);
        assertThat(ticket.getChannelRef()).startsWith("ticket-");
        verify(eventPublisher).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("openTicket - Ticket already open: Should reject")
    void openTicket_AlreadyOpen() {
        when(ticketRepository.findByOwnerIdAndState("user-1", TicketState.OPEN)).thenReturn(Optional.of(openTicket()));

        assertThatThrownBy(() -> ticketService.openTicket("user-1", "chan"))
                .isInstanceOf(TicketAlreadyOpenException.class);
        verify(ticketRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("openTicket - Concurrent open wins the unique key: Should reject")
    void openTicket_ConcurrentDuplicate() {
        when(ticketRepository.findByOwnerIdAndState("user-1", TicketState.OPEN)).thenReturn(Optional.empty());
        when(ticketRepository.saveAndFlush(any(Ticket.class)))
                .thenThrow(new DataIntegrityViolationException("uk_ticket_open_owner"));

        assertThatThrownBy(() -> ticketService.openTicket("user-1", "chan"))
                .isInstanceOf(TicketAlreadyOpenException.class);
        verifyNoInteractions(eventPublisher);
    }

    // ========================================
    // closeTicket() Tests
    // ========================================

    @Test
    @DisplayName("closeTicket - Open ticket: Should close and schedule purge")
    void closeTicket_Open() {
        // Given
        Ticket ticket = openTicket();
        when(ticketRepository.findByIdWithLock("ticket-1")).thenReturn(Optional.of(ticket));
        when(ticketRepository.save(ticket)).thenReturn(ticket);

        // When
        Ticket result = ticketService.closeTicket("ticket-1", "staff-1");

        // Then
        assertThat(result.getState()).isEqualTo(TicketState.CLOSED);
        assertThat(result.getOpenOwnerKey()).isNull();
        assertThat(Duration.between(result.getClosedAt(), result.getPurgeAt())).isEqualTo(Duration.ofHours(24));
        verify(eventPublisher).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("closeTicket - Already closed: Should be a no-op")
    void closeTicket_AlreadyClosed() {
        Ticket ticket = openTicket();
        ticket.close("staff-1", Instant.now(), Duration.ofHours(24));
        when(ticketRepository.findByIdWithLock("ticket-1")).thenReturn(Optional.of(ticket));

        ticketService.closeTicket("ticket-1", "staff-2");

        assertThat(ticket.getClosedBy()).isEqualTo("staff-1");
        verify(ticketRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    // ========================================
    // purge() Tests
    // ========================================

    @Test
    @DisplayName("purge - Guarded update wins: Should notify once")
    void purge_Executed() {
        Instant now = Instant.now();
        when(ticketRepository.markPurged("ticket-1", now)).thenReturn(1);
        when(ticketRepository.findById("ticket-1")).thenReturn(Optional.of(openTicket()));

        assertThat(ticketService.purge("ticket-1", now)).isTrue();
        verify(eventPublisher).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("purge - Already purged by another sweep: Should skip")
    void purge_AlreadyPurged() {
        Instant now = Instant.now();
        when(ticketRepository.markPurged("ticket-1", now)).thenReturn(0);

        assertThat(ticketService.purge("ticket-1", now)).isFalse();
        verify(metricsService).recordDuplicateSkipped("ticket_purge");
        verifyNoInteractions(eventPublisher);
    }

    // ========================================
    // setupTicketPanel() Tests
    // ========================================

    @Test
    @DisplayName("setupTicketPanel - Should remember the channel and request the panel")
    void setupTicketPanel_Success() {
        ticketService.setupTicketPanel("support", "staff-1");

        verify(storeStateService).setTicketPanelChannel("support");
        verify(eventPublisher).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("setupTicketPanel - Blank channel: Should reject")
    void setupTicketPanel_Blank() {
        assertThatThrownBy(() -> ticketService.setupTicketPanel(" ", "staff-1"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(storeStateService);
    }
}
