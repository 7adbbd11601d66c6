package com.yahtzeegame.scoringservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CommitResponse {
    private String category;
    private int points;
    private boolean joker;
    private boolean bonusYahtzee;
    private TotalsView totals;
}
