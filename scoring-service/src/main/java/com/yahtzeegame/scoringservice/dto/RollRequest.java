package com.yahtzeegame.scoringservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RollRequest {
    private List<Integer> faces;
    private String category;
}
