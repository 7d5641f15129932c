package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.StoreState;
import com.cred.freestyle.storefront.domain.model.StoreState.ShopStatus;
import com.cred.freestyle.storefront.exception.ShopClosedException;
import com.cred.freestyle.storefront.infrastructure.messaging.StoreNotification;
import com.cred.freestyle.storefront.repository.StoreStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Access to the single-row store state (shop status, active giveaway, ticket panel).
 * Writers lock the row; the version column catches any writer that does not.
 *
 * @author Storefront Team
 */
@Service
public class StoreStateService {

    private static final Logger logger = LoggerFactory.getLogger(StoreStateService.class);

    private final StoreStateRepository storeStateRepository;
    private final ApplicationEventPublisher eventPublisher;

    public StoreStateService(StoreStateRepository storeStateRepository, ApplicationEventPublisher eventPublisher) {
        this.storeStateRepository = storeStateRepository;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Current state, as last committed. A missing row means a fresh store: open, no round.
     */
    @Transactional(readOnly = true)
    public StoreState current() {
        return storeStateRepository.findById(StoreState.SINGLETON_ID)
                .orElseGet(StoreState::initial);
    }

    public boolean isShopOpen() {
        return current().isOpen();
    }

    /**
     * @throws ShopClosedException if the shop is closed
     */
    public void requireOpen() {
        if (!isShopOpen()) {
            throw new ShopClosedException();
        }
    }

    /**
     * Lock the store state row for the rest of the current transaction, creating it on first use.
     * Must be called inside a transaction.
     */
    @Transactional
    public StoreState lockState() {
        return storeStateRepository.findByIdWithLock(StoreState.SINGLETON_ID)
                .orElseGet(this::createInitialState);
    }

    @Transactional
    public StoreState setShopStatus(ShopStatus status, String staffId) {
        StoreState state = lockState();
        if (state.getShopStatus() == status) {
            logger.debug("Shop already {}", status);
            return state;
        }
        state.setShopStatus(status);
        state = storeStateRepository.save(state);

        logger.info("Shop status set to {} by {}", status, staffId);
        eventPublisher.publishEvent(StoreNotification.of(StoreNotification.Type.SHOP_STATUS_CHANGED, null, StoreState.SINGLETON_ID)
                .with("status", status.name())
                .with("changedBy", staffId));
        return state;
    }

    @Transactional
    public StoreState setTicketPanelChannel(String channelRef) {
        StoreState state = lockState();
        state.setTicketPanelChannelRef(channelRef);
        return storeStateRepository.save(state);
    }

    /**
     * Create the row at startup so workers never race to insert it.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void ensureStateRow() {
        if (!storeStateRepository.existsById(StoreState.SINGLETON_ID)) {
            storeStateRepository.save(StoreState.initial());
            logger.info("Initialized store state (shop open)");
        }
    }

    private StoreState createInitialState() {
        return storeStateRepository.saveAndFlush(StoreState.initial());
    }
}
