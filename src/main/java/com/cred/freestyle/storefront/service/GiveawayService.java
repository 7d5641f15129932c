package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.GiveawayEntry;
import com.cred.freestyle.storefront.domain.model.GiveawayRound;
import com.cred.freestyle.storefront.domain.model.GiveawayRound.RoundState;
import com.cred.freestyle.storefront.domain.model.StoreState;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.GiveawayEntryRepository;
import com.cred.freestyle.storefront.repository.GiveawayRoundRepository;
import com.cred.freestyle.storefront.repository.StoreStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Recurring giveaway rounds.
 *
 * One round is active at a time; its id lives on the store state row, and starting or ending a
 * round locks that row. When a round's end time passes, one entrant is drawn uniformly at random
 * and credited the prize, and the next round starts in the same transaction. Ending is a guarded
 * update on the round, so overlapping sweeps select a winner once.
 *
 * @author Storefront Team
 */
@Service
public class GiveawayService {

    private static final Logger logger = LoggerFactory.getLogger(GiveawayService.class);

    private final GiveawayRoundRepository roundRepository;
    private final GiveawayEntryRepository entryRepository;
    private final StoreStateRepository storeStateRepository;
    private final StoreStateService storeStateService;
    private final CustomerService customerService;
    private final ApplicationEventPublisher eventPublisher;
    private final StorefrontMetricsService metricsService;
    private final Random random;
    private final Duration cycleLength;
    private final long prizeMinor;
    private final String roleRef;

    public GiveawayService(
            GiveawayRoundRepository roundRepository,
            GiveawayEntryRepository entryRepository,
            StoreStateRepository storeStateRepository,
            StoreStateService storeStateService,
            CustomerService customerService,
            ApplicationEventPublisher eventPublisher,
            StorefrontMetricsService metricsService,
            @Qualifier("giveawayRandom") Random random,
            @Value("${storefront.giveaway.cycle-length:PT24H}") Duration cycleLength,
            @Value("${storefront.giveaway.prize-minor:500}") long prizeMinor,
            @Value("${storefront.giveaway.role-ref:giveaway}") String roleRef
    ) {
        this.roundRepository = roundRepository;
        this.entryRepository = entryRepository;
        this.storeStateRepository = storeStateRepository;
        this.storeStateService = storeStateService;
        this.customerService = customerService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.random = random;
        this.cycleLength = cycleLength;
        this.prizeMinor = prizeMinor;
        this.roleRef = roleRef;
    }

    /**
     * The active round, if one is open.
     */
    @Transactional(readOnly = true)
    public Optional<GiveawayRound> currentRound() {
        String activeRoundId = storeStateService.current().getActiveRoundId();
        if (activeRoundId == null) {
            return Optional.empty();
        }
        return roundRepository.findById(activeRoundId)
                .filter(round -> round.getState() == RoundState.OPEN);
    }

    @Transactional(readOnly = true)
    public List<GiveawayRound> recentRounds() {
        return roundRepository.findTop10ByOrderByStartedAtDesc();
    }

    @Transactional(readOnly = true)
    public long entrantCount(String roundId) {
        return entryRepository.countByRoundId(roundId);
    }

    /**
     * Start a round unless one is already open.
     *
     * @return The open round
     */
    @Transactional
    public GiveawayRound startRound(Instant now) {
        StoreState state = storeStateService.lockState();
        if (state.getActiveRoundId() != null) {
            Optional<GiveawayRound> active = roundRepository.findById(state.getActiveRoundId())
                    .filter(round -> round.getState() == RoundState.OPEN);
            if (active.isPresent()) {
                return active.get();
            }
        }
        return openRound(state, now);
    }

    /**
     * Enter the active round. Entering twice is a no-op.
     * Runs outside a surrounding transaction so a concurrent duplicate entry can be recognised
     * from the unique key.
     *
     * @return true if this call created the entry
     * @throws IllegalStateException if no round is accepting entries
     */
    public boolean enter(String ownerId) {
        Instant now = Instant.now();
        GiveawayRound round = currentRound()
                .filter(open -> open.acceptsEntriesAt(now))
                .orElseThrow(() -> new IllegalStateException("No giveaway round is accepting entries"));

        if (entryRepository.existsByRoundIdAndOwnerId(round.getRoundId(), ownerId)) {
            return false;
        }

        try {
            entryRepository.saveAndFlush(GiveawayEntry.builder()
                    .roundId(round.getRoundId())
                    .ownerId(ownerId)
                    .build());
        } catch (DataIntegrityViolationException e) {
            logger.debug("Duplicate giveaway entry for {} in round {}", ownerId, round.getRoundId());
            metricsService.recordDuplicateSkipped("giveaway_entry");
            return false;
        }

        logger.info("{} entered giveaway round {}", ownerId, round.getRoundId());
        return true;
    }

    @Transactional(readOnly = true)
    public List<String> findDueForSelection(Instant now) {
        return roundRepository.findDueForSelection(now);
    }

    /**
     * End a due round: draw the winner, credit the prize and start the next round.
     *
     * @return true if this call ended the round
     */
    @Transactional
    public boolean endRound(String roundId, Instant now) {
        storeStateService.lockState();

        GiveawayRound round = roundRepository.findById(roundId)
                .orElseThrow(() -> new ResourceNotFoundException("Giveaway round", roundId));
        if (round.getState() != RoundState.OPEN || round.getEndsAt().isAfter(now)) {
            logger.debug("Giveaway round {} not due (state {})", roundId, round.getState());
            return false;
        }

        List<String> entrants = entryRepository.findEntrantIds(roundId);
        String winnerId = entrants.isEmpty() ? null : entrants.get(random.nextInt(entrants.size()));

        int updated = roundRepository.markEnded(roundId, winnerId, now);
        if (updated == 0) {
            logger.debug("Giveaway round {} already ended", roundId);
            metricsService.recordDuplicateSkipped("giveaway_selection");
            return false;
        }

        if (winnerId != null) {
            customerService.addCredit(winnerId, round.getPrizeMinor());
            logger.info("Giveaway round {} won by {} out of {} entrants", roundId, winnerId, entrants.size());
        } else {
            logger.info("Giveaway round {} ended without entrants", roundId);
        }
        metricsService.recordGiveawayRound(winnerId != null);

        StoreNotification ended = StoreNotification.of(StoreNotification.Type.GIVEAWAY_ENDED, winnerId, roundId)
                .with("entrants", entrants.size())
                .with("prizeMinor", round.getPrizeMinor());
        eventPublisher.publishEvent(ended);

        StoreState state = storeStateService.lockState();
        if (state.getActiveRoundId() == null || state.getActiveRoundId().equals(roundId)) {
            openRound(state, now);
        }
        return true;
    }

    private GiveawayRound openRound(StoreState state, Instant now) {
        GiveawayRound round = roundRepository.save(GiveawayRound.builder()
                .startedAt(now)
                .endsAt(now.plus(cycleLength))
                .prizeMinor(prizeMinor)
                .state(RoundState.OPEN)
                .build());

        state.setActiveRoundId(round.getRoundId());
        storeStateRepository.save(state);

        eventPublisher.publishEvent(StoreNotification.of(
                        StoreNotification.Type.GIVEAWAY_STARTED, null, round.getRoundId())
                .with("roleRef", roleRef)
                .with("endsAt", String.valueOf(round.getEndsAt()))
                .with("prizeMinor", round.getPrizeMinor()));
        logger.info("Giveaway round {} started, ends at {}", round.getRoundId(), round.getEndsAt());
        return round;
    }
}
