package com.yahtzeegame.scoringservice.dto;

import com.yahtzeegame.scoring.Verdict;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class VerdictResponse {
    private String category;
    private boolean legal;
    private String reason;
    private String message;

    public static VerdictResponse from(String category, Verdict verdict) {
        return VerdictResponse.builder()
                .category(category)
                .legal(verdict.isOk())
                .reason(verdict.isOk() ? null : verdict.getReason().name())
                .message(verdict.getMessage())
                .build();
    }
}
