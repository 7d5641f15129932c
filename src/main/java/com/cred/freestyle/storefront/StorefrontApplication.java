package com.cred.freestyle.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the storefront transactional core.
 *
 * System Overview:
 * - Catalog and inventory ledger with reserve / commit / release accounting
 * - Per-owner carts converted into orders by the checkout orchestrator
 * - Automated (PayPal) and manual (crypto attestation) payment verification
 * - Fulfillment of digital goods from a license key pool, manual completion otherwise
 * - Sticky buyer tiers granted from lifetime spend
 * - Support tickets with delayed purge and a daily giveaway cycle
 *
 * Architecture:
 * - API Layer: REST controllers acting as the presentation adapter
 * - Service Layer: state machines and ledgers, one transaction per state change
 * - Data Access Layer: JPA repositories with pessimistic locks and guarded updates
 * - Infrastructure Layer: scheduled sweeps, Kafka notifications, Redis locks, CloudWatch metrics
 *
 * @author Storefront Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
@EnableScheduling
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }
}
