package com.yahtzeegame.scoring;

/**
 * The two halves of the scoresheet, used for subtotals and bonuses.
 */
public enum Section {
    UPPER("Upper Section"),
    LOWER("Lower Section");

    private final String displayName;

    Section(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
