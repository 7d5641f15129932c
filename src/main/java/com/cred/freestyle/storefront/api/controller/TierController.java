package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.BuyerTiersResponse;
import com.cred.freestyle.storefront.api.dto.TierRuleRequest;
import com.cred.freestyle.storefront.api.dto.TierRuleResponse;
import com.cred.freestyle.storefront.service.BuyerTierEvaluator;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Buyer tier rules and grants.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/tiers")
public class TierController {

    private final BuyerTierEvaluator tierEvaluator;

    public TierController(BuyerTierEvaluator tierEvaluator) {
        this.tierEvaluator = tierEvaluator;
    }

    @GetMapping("/rules")
    public ResponseEntity<List<TierRuleResponse>> listRules() {
        List<TierRuleResponse> rules = tierEvaluator.listRules()
                .stream()
                .map(TierRuleResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(rules);
    }

    @PostMapping("/rules")
    public ResponseEntity<TierRuleResponse> addRule(
            @Valid @RequestBody TierRuleRequest request,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(TierRuleResponse.fromEntity(
                tierEvaluator.addRule(request.getRoleId(), request.getSpendThresholdMinor())));
    }

    @DeleteMapping("/rules/{roleId}")
    public ResponseEntity<Void> removeRule(
            @PathVariable String roleId,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        tierEvaluator.removeRule(roleId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    public ResponseEntity<BuyerTiersResponse> myTiers(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(new BuyerTiersResponse(userId, tierEvaluator.currentTiers(userId), List.of()));
    }

    /**
     * Re-evaluate the caller's spend. Grants already held are not granted again.
     */
    @PostMapping("/me/evaluate")
    public ResponseEntity<BuyerTiersResponse> evaluate(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        List<String> granted = tierEvaluator.evaluate(userId);
        return ResponseEntity.ok(new BuyerTiersResponse(userId, tierEvaluator.currentTiers(userId), granted));
    }

    @DeleteMapping("/{ownerId}/grants/{roleId}")
    public ResponseEntity<Void> revoke(
            @PathVariable String ownerId,
            @PathVariable String roleId,
            @RequestHeader(RequestHeaders.STAFF_ID) String staffId
    ) {
        tierEvaluator.revoke(ownerId, roleId, staffId);
        return ResponseEntity.noContent().build();
    }
}
