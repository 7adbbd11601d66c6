package com.yahtzeegame.scoringservice.dto;

import com.yahtzeegame.scoring.Category;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CategoryView {
    private String id;
    private String name;
    private String section;
    private String kind;
    private String pattern;

    public static CategoryView from(Category category) {
        return CategoryView.builder()
                .id(category.getId())
                .name(category.getDisplayName())
                .section(category.getSection().name())
                .kind(category.getKind().name())
                .pattern(category.getPattern().getDescription())
                .build();
    }
}
