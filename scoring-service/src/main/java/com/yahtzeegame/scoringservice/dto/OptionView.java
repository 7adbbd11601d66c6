package com.yahtzeegame.scoringservice.dto;

import com.yahtzeegame.scoring.ScoreOption;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OptionView {
    private String category;
    private String name;
    private int points;
    private boolean joker;

    public static OptionView from(ScoreOption option) {
        return OptionView.builder()
                .category(option.getCategory().getId())
                .name(option.getCategory().getDisplayName())
                .points(option.getPoints())
                .joker(option.isJoker())
                .build();
    }
}
