package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.repository.BuyerTierRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Seeds tier rules from configuration ("roleId:thresholdMinor,...") when none exist yet.
 * Rules added at runtime take precedence; the configured list is never re-applied over them.
 *
 * @author Storefront Team
 */
@Component
public class TierRuleInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(TierRuleInitializer.class);

    private final BuyerTierEvaluator tierEvaluator;
    private final BuyerTierRuleRepository ruleRepository;
    private final String configuredThresholds;

    public TierRuleInitializer(
            BuyerTierEvaluator tierEvaluator,
            BuyerTierRuleRepository ruleRepository,
            @Value("${storefront.tier.thresholds:}") String configuredThresholds
    ) {
        this.tierEvaluator = tierEvaluator;
        this.ruleRepository = ruleRepository;
        this.configuredThresholds = configuredThresholds;
    }

    @Override
    public void run(ApplicationArguments args) {
        Map<String, Long> rules = parse(configuredThresholds);
        if (rules.isEmpty() || ruleRepository.count() > 0) {
            return;
        }
        rules.forEach(tierEvaluator::addRule);
        logger.info("Seeded {} tier rules from configuration", rules.size());
    }

    static Map<String, Long> parse(String thresholds) {
        Map<String, Long> rules = new LinkedHashMap<>();
        if (thresholds == null || thresholds.isBlank()) {
            return rules;
        }
        for (String entry : thresholds.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int separator = trimmed.lastIndexOf(':');
            if (separator <= 0 || separator == trimmed.length() - 1) {
                throw new IllegalArgumentException("Invalid tier threshold entry: " + trimmed);
            }
            rules.put(trimmed.substring(0, separator).trim(),
                    Long.parseLong(trimmed.substring(separator + 1).trim()));
        }
        return rules;
    }
}
