package com.yahtzeegame.scoringservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ScoreResponse {
    private String category;
    private List<Integer> faces;
    private int points;
}
