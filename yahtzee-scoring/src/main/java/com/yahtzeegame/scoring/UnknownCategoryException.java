package com.yahtzeegame.scoring;

/**
 * Thrown when a category id is not part of the rule catalog.
 */
public class UnknownCategoryException extends IllegalArgumentException {

    private final String categoryId;

    public UnknownCategoryException(String categoryId) {
        super("Unknown category: " + categoryId);
        this.categoryId = categoryId;
    }

    public String getCategoryId() {
        return categoryId;
    }
}
