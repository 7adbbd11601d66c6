package com.yahtzeegame.scoringservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class ScoresheetView {
    private Long playerId;
    private Map<String, Integer> entries;
    private int bonusYahtzees;
    private boolean complete;
    private TotalsView totals;
}
