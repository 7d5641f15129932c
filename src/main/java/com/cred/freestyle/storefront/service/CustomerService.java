package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.Customer;
import com.cred.freestyle.storefront.repository.CustomerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * Store credit balances and per-user statistics.
 *
 * @author Storefront Team
 */
@Service
public class CustomerService {

    private static final Logger logger = LoggerFactory.getLogger(CustomerService.class);

    private final CustomerRepository customerRepository;
    private final TransactionTemplate creationTemplate;

    public CustomerService(CustomerRepository customerRepository, PlatformTransactionManager transactionManager) {
        this.customerRepository = customerRepository;
        this.creationTemplate = new TransactionTemplate(transactionManager);
        this.creationTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Customer row, or an unsaved zero-balance row for a user never seen before.
     */
    @Transactional(readOnly = true)
    public Customer getCustomer(String ownerId) {
        return customerRepository.findById(ownerId)
                .orElseGet(() -> Customer.newCustomer(ownerId));
    }

    public long balance(String ownerId) {
        return getCustomer(ownerId).getCreditBalanceMinor();
    }

    /**
     * Lock the customer row for the current transaction, creating it if needed.
     *
     * The row is inserted in its own transaction so that losing a race with another first
     * insert leaves the caller's transaction usable; the winner's row is then read under the lock.
     */
    @Transactional
    public Customer lockCustomer(String ownerId) {
        Optional<Customer> existing = customerRepository.findByIdWithLock(ownerId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            creationTemplate.executeWithoutResult(
                    status -> customerRepository.saveAndFlush(Customer.newCustomer(ownerId)));
        } catch (DataIntegrityViolationException e) {
            logger.debug("Customer {} was created concurrently, reading it under lock", ownerId);
        }
        return customerRepository.findByIdWithLock(ownerId)
                .orElseThrow(() -> new IllegalStateException("Customer row missing after creation: " + ownerId));
    }

    @Transactional
    public Customer addCredit(String ownerId, long amountMinor) {
        if (amountMinor <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        Customer customer = lockCustomer(ownerId);
        customer.credit(amountMinor);
        customer = customerRepository.save(customer);
        logger.info("Credited {} to {}, balance now {}", amountMinor, ownerId, customer.getCreditBalanceMinor());
        return customer;
    }

    @Transactional
    public Customer setCredit(String ownerId, long amountMinor) {
        if (amountMinor < 0) {
            throw new IllegalArgumentException("Credit balance cannot be negative");
        }
        Customer customer = lockCustomer(ownerId);
        customer.setCreditBalanceMinor(amountMinor);
        logger.info("Set credit balance of {} to {}", ownerId, amountMinor);
        return customerRepository.save(customer);
    }

    /**
     * Add to a staff member's delivered-value statistic.
     */
    @Transactional
    public void recordDeliveryHandled(String staffId, long orderValueMinor) {
        Customer staff = lockCustomer(staffId);
        staff.setDeliveryValueHandledMinor(staff.getDeliveryValueHandledMinor() + orderValueMinor);
        customerRepository.save(staff);
    }

    /**
     * Store the recomputed lifetime spend.
     */
    @Transactional
    public Customer updateLifetimeTotal(String ownerId, long lifetimeTotalMinor) {
        Customer customer = lockCustomer(ownerId);
        customer.setLifetimeTotalMinor(lifetimeTotalMinor);
        return customerRepository.save(customer);
    }
}
