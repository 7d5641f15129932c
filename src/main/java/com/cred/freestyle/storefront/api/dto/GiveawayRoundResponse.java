package com.cred.freestyle.storefront.api.dto;

import com.cred.freestyle.storefront.domain.model.GiveawayRound;

import java.time.Instant;

/**
 * Response DTO for a giveaway round.
 *
 * @author Storefront Team
 */
public class GiveawayRoundResponse {

    private String roundId;

    private Instant startedAt;

    private Instant endsAt;

    private Long prizeMinor;

    private String state;

    private String winnerId;

    private Long entrants;

    public GiveawayRoundResponse() {
    }

    public static GiveawayRoundResponse fromEntity(GiveawayRound round, Long entrants) {
        GiveawayRoundResponse response = new GiveawayRoundResponse();
        response.setRoundId(round.getRoundId());
        response.setStartedAt(round.getStartedAt());
        response.setEndsAt(round.getEndsAt());
        response.setPrizeMinor(round.getPrizeMinor());
        response.setState(round.getState().name());
        response.setWinnerId(round.getWinnerId());
        response.setEntrants(entrants);
        return response;
    }

    // Getters and setters
    public String getRoundId() {
        return roundId;
    }

    public void setRoundId(String roundId) {
        this.roundId = roundId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getEndsAt() {
        return endsAt;
    }

    public void setEndsAt(Instant endsAt) {
        this.endsAt = endsAt;
    }

    public Long getPrizeMinor() {
        return prizeMinor;
    }

    public void setPrizeMinor(Long prizeMinor) {
        this.prizeMinor = prizeMinor;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getWinnerId() {
        return winnerId;
    }

    public void setWinnerId(String winnerId) {
        this.winnerId = winnerId;
    }

    public Long getEntrants() {
        return entrants;
    }

    public void setEntrants(Long entrants) {
        this.entrants = entrants;
    }
}
