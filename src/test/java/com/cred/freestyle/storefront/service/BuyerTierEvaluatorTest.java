package com.cred.freestyle.storefront.service;

import com.cred.freestyle.storefront.domain.model.BuyerTierRule;
import com.cred.freestyle.storefront.domain.model.TierGrant;
import com.cred.freestyle.storefront.exception.ResourceNotFoundException;
import com.cred.freestyle.storefront.infrastructure.metrics.StorefrontMetricsService;
import com.cred.freestyle.storefront.repository.BuyerTierRuleRepository;
import com.cred.freestyle.storefront.repository.OrderRepository;
import com.cred.freestyle.storefront.repository.TierGrantRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BuyerTierEvaluator.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("BuyerTierEvaluator Unit Tests")
class BuyerTierEvaluatorTest {

    @Mock
    private BuyerTierRuleRepository ruleRepository;

    @Mock
    private TierGrantRepository grantRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private CustomerService customerService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private StorefrontMetricsService metricsService;

    @InjectMocks
    private BuyerTierEvaluator tierEvaluator;

    private final BuyerTierRule supporter = BuyerTierRule.builder()
            .roleId("supporter").spendThresholdMinor(10_000L).build();

    // ========================================
    // evaluate() Tests
    // ========================================

    @Test
    @DisplayName("evaluate - Spend crosses threshold: Should grant once across repeated evaluations")
    void evaluate_CrossingThreshold_GrantedOnce() {
        // Given - lifetime spend moves 95.00 -> 110.00 -> 110.00
        when(orderRepository.sumTotalByOwnerAndStates(eq("user-1"), anyCollection()))
                .thenReturn(9_500L, 11_000L, 11_000L);
        when(ruleRepository.findBySpendThresholdMinorLessThanEqualOrderBySpendThresholdMinorAsc(9_500L))
                .thenReturn(List.of());
        when(ruleRepository.findBySpendThresholdMinorLessThanEqualOrderBySpendThresholdMinorAsc(11_000L))
                .thenReturn(List.of(supporter));
        when(grantRepository.existsByOwnerIdAndRoleId("user-1", "supporter")).thenReturn(false, true);

        // When
        List<String> first = tierEvaluator.evaluate("user-1");
        List<String> second = tierEvaluator.evaluate("user-1");
        List<String> third = tierEvaluator.evaluate("user-1");

        // Then
        assertThat(first).isEmpty();
        assertThat(second).containsExactly("supporter");
        assertThat(third).isEmpty();
        verify(grantRepository, times(1)).save(any(TierGrant.class));
        verify(metricsService, times(1)).recordTierGrant("supporter");
        verify(eventPublisher, times(1)).publishEvent(any(Object.class));
        verify(customerService).updateLifetimeTotal("user-1", 9_500L);
        verify(customerService, times(2)).updateLifetimeTotal("user-1", 11_000L);
    }

    @Test
    @DisplayName("evaluate - Several thresholds crossed at once: Should grant each in ascending order")
    void evaluate_MultipleThresholds() {
        BuyerTierRule patron = BuyerTierRule.builder().roleId("patron").spendThresholdMinor(50_000L).build();
        when(orderRepository.sumTotalByOwnerAndStates(eq("user-1"), anyCollection())).thenReturn(60_000L);
        when(ruleRepository.findBySpendThresholdMinorLessThanEqualOrderBySpendThresholdMinorAsc(60_000L))
                .thenReturn(List.of(supporter, patron));
        when(grantRepository.existsByOwnerIdAndRoleId(eq("user-1"), anyString())).thenReturn(false);

        List<String> granted = tierEvaluator.evaluate("user-1");

        assertThat(granted).containsExactly("supporter", "patron");
        verify(customerService).lockCustomer("user-1");
    }

    // ========================================
    // addRule() Tests
    // ========================================

    @Test
    @DisplayName("addRule - New role: Should save the rule")
    void addRule_New() {
        when(ruleRepository.findBySpendThresholdMinor(10_000L)).thenReturn(Optional.empty());
        when(ruleRepository.findById("supporter")).thenReturn(Optional.empty());
        when(ruleRepository.save(any(BuyerTierRule.class))).thenAnswer(invocation -> invocation.getArgument(0));

        BuyerTierRule rule = tierEvaluator.addRule("supporter", 10_000L);

        assertThat(rule.getRoleId()).isEqualTo("supporter");
        assertThat(rule.getSpendThresholdMinor()).isEqualTo(10_000L);
    }

    @Test
    @DisplayName("addRule - Threshold taken by another role: Should reject")
    void addRule_ThresholdTaken() {
        when(ruleRepository.findBySpendThresholdMinor(10_000L)).thenReturn(Optional.of(supporter));

        assertThatThrownBy(() -> tierEvaluator.addRule("vip", 10_000L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("supporter");
        verify(ruleRepository, never()).save(any());
    }

    @Test
    @DisplayName("addRule - Negative threshold: Should reject")
    void addRule_Negative() {
        assertThatThrownBy(() -> tierEvaluator.addRule("vip", -1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ========================================
    // revoke() Tests
    // ========================================

    @Test
    @DisplayName("revoke - Active grant: Should revoke and keep the record")
    void revoke_Active() {
        TierGrant grant = TierGrant.builder().ownerId("user-1").roleId("supporter").grantedAt(Instant.now()).build();
        when(grantRepository.findByOwnerIdAndRoleId("user-1", "supporter")).thenReturn(Optional.of(grant));
        when(grantRepository.save(grant)).thenReturn(grant);

        TierGrant result = tierEvaluator.revoke("user-1", "supporter", "admin-1");

        assertThat(result.isActive()).isFalse();
        assertThat(result.getRevokedBy()).isEqualTo("admin-1");
        verify(grantRepository, never()).delete(any());
    }

    @Test
    @DisplayName("revoke - Unknown grant: Should throw not found")
    void revoke_Unknown() {
        when(grantRepository.findByOwnerIdAndRoleId("user-1", "supporter")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tierEvaluator.revoke("user-1", "supporter", "admin-1"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
