package com.cred.freestyle.storefront.testutil;

import com.cred.freestyle.storefront.infrastructure.messaging.NotificationSink;
import com.cred.freestyle.storefront.infrastructure.payment.PayPalGatewayClient;
import com.cred.freestyle.storefront.repository.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.mockito.Mockito.reset;

/**
 * Shared setup for tests that run against the full application context and the in-memory database.
 * All subclasses share one context: keep the mocked beans here.
 *
 * Data is committed for real so that concurrent callers see each other; every test starts from
 * empty tables.
 */
@SpringBootTest
public abstract class StorefrontIntegrationTestSupport {

    @MockBean
    protected NotificationSink notificationSink;

    @SpyBean
    protected PayPalGatewayClient payPalGatewayClient;

    @Autowired
    protected ItemRepository itemRepository;

    @Autowired
    protected OrderRepository orderRepository;

    @Autowired
    protected StockReservationRepository reservationRepository;

    @Autowired
    protected PaymentRepository paymentRepository;

    @Autowired
    protected CartRepository cartRepository;

    @Autowired
    protected CustomerRepository customerRepository;

    @Autowired
    protected DigitalAssetRepository digitalAssetRepository;

    @Autowired
    protected TicketRepository ticketRepository;

    @Autowired
    protected GiveawayEntryRepository giveawayEntryRepository;

    @Autowired
    protected GiveawayRoundRepository giveawayRoundRepository;

    @Autowired
    protected TierGrantRepository tierGrantRepository;

    @Autowired
    protected BuyerTierRuleRepository tierRuleRepository;

    @Autowired
    protected StoreStateRepository storeStateRepository;

    @BeforeEach
    void cleanDatabase() {
        paymentRepository.deleteAll();
        reservationRepository.deleteAll();
        digitalAssetRepository.deleteAll();
        orderRepository.deleteAll();
        cartRepository.deleteAll();
        itemRepository.deleteAll();
        customerRepository.deleteAll();
        ticketRepository.deleteAll();
        giveawayEntryRepository.deleteAll();
        giveawayRoundRepository.deleteAll();
        tierGrantRepository.deleteAll();
        tierRuleRepository.deleteAll();
        storeStateRepository.deleteAll();
    }

    @AfterEach
    void resetSpies() {
        reset(payPalGatewayClient);
    }

    /**
     * Start all tasks at the same moment and wait for every one of them.
     *
     * @return The futures, in task order
     */
    protected <T> List<Future<T>> runConcurrently(List<Callable<T>> tasks) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                futures.add(executor.submit(() -> {
                    startGate.await();
                    return task.call();
                }));
            }
            startGate.countDown();
            executor.shutdown();
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Concurrent tasks did not finish in time");
            }
            return futures;
        } finally {
            executor.shutdownNow();
        }
    }
}
