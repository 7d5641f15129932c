package com.cred.freestyle.storefront.api.controller;

import com.cred.freestyle.storefront.api.dto.GiveawayRoundResponse;
import com.cred.freestyle.storefront.domain.model.GiveawayRound;
import com.cred.freestyle.storefront.service.GiveawayService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Giveaway rounds. Rounds are started and ended by the scheduler; this controller only reads
 * them and records entries.
 *
 * @author Storefront Team
 */
@RestController
@RequestMapping("/api/v1/giveaways")
public class GiveawayController {

    private final GiveawayService giveawayService;

    public GiveawayController(GiveawayService giveawayService) {
        this.giveawayService = giveawayService;
    }

    @GetMapping("/current")
    public ResponseEntity<GiveawayRoundResponse> currentRound() {
        return giveawayService.currentRound()
                .map(this::toResponse)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<GiveawayRoundResponse>> recentRounds() {
        List<GiveawayRoundResponse> rounds = giveawayService.recentRounds()
                .stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(rounds);
    }

    /**
     * Enter the current round. Entering again is accepted and changes nothing.
     */
    @PostMapping("/current/entries")
    public ResponseEntity<Map<String, Object>> enter(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        boolean created = giveawayService.enter(userId);
        return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.OK)
                .body(Map.of("ownerId", userId, "entered", true, "newEntry", created));
    }

    private GiveawayRoundResponse toResponse(GiveawayRound round) {
        return GiveawayRoundResponse.fromEntity(round, giveawayService.entrantCount(round.getRoundId()));
    }
}
