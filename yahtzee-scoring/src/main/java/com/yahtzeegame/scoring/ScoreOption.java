package com.yahtzeegame.scoring;

/**
 * A category that may legally be scored for a roll, and what it would award.
 */
public final class ScoreOption {

    private final Category category;
    private final int points;
    private final boolean joker;

    public ScoreOption(Category category, int points, boolean joker) {
        this.category = category;
        this.points = points;
        this.joker = joker;
    }

    public Category getCategory() {
        return category;
    }

    public int getPoints() {
        return points;
    }

    public boolean isJoker() {
        return joker;
    }

    @Override
    public String toString() {
        return String.format("%s: %d points%s", category.getDisplayName(), points, joker ? " (joker)" : "");
    }
}
